package ca.gc.cra.sluice.infrastructure.report;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs JVM heap and non-heap usage around a transfer.
 * <p>Informational only: the buffered-byte bound is asserted from component counters, not from the heap.</p>
 *
 * @since 0.1.0
 */
public final class MemoryUsageReporter {
  private static final Logger log = LoggerFactory.getLogger(MemoryUsageReporter.class);
  private static final long MIB = 1024L * 1024L;

  private final MemoryMXBean memory;

  public MemoryUsageReporter() {
    this(ManagementFactory.getMemoryMXBean());
  }

  MemoryUsageReporter(MemoryMXBean memory) {
    this.memory = Objects.requireNonNull(memory, "memory");
  }

  /**
   * Captures current usage and logs it with {@code label}.
   *
   * @param label moment being reported (e.g., {@code before pipeline})
   * @return snapshot that was logged
   */
  public Snapshot report(String label) {
    Snapshot snapshot = snapshot();
    log.info("Memory {}: heapUsed={} MiB heapCommitted={} MiB nonHeapUsed={} MiB",
        label, snapshot.heapUsed() / MIB, snapshot.heapCommitted() / MIB, snapshot.nonHeapUsed() / MIB);
    return snapshot;
  }

  /**
   * Captures current usage without logging.
   *
   * @return current usage
   */
  public Snapshot snapshot() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();
    return new Snapshot(heap.getUsed(), heap.getCommitted(), nonHeap.getUsed());
  }

  /**
   * Point-in-time memory usage in bytes.
   *
   * @param heapUsed heap bytes in use
   * @param heapCommitted heap bytes committed by the JVM
   * @param nonHeapUsed non-heap bytes in use
   */
  public record Snapshot(long heapUsed, long heapCommitted, long nonHeapUsed) {}
}
