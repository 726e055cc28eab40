package ca.gc.cra.sluice.application.flow;

import static ca.gc.cra.sluice.testutil.Topologies.KIB;
import static ca.gc.cra.sluice.testutil.Topologies.MIB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sluice.application.session.SessionTopology;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferException;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import ca.gc.cra.sluice.testutil.CapturingWritableResource;
import ca.gc.cra.sluice.testutil.PatternReadableResource;
import ca.gc.cra.sluice.testutil.RecordingObserver;
import ca.gc.cra.sluice.testutil.Topologies;
import ca.gc.cra.sluice.testutil.VirtualTimeScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ManualTransferUseCaseTest {
  private final VirtualTimeScheduler scheduler = new VirtualTimeScheduler();
  private final RecordingObserver observer = new RecordingObserver();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void copiesThroughLatencyStageWithBackpressureOnBothHops() throws Exception {
    CapturingWritableResource writable = CapturingWritableResource.checksumOnly();
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(MIB), writable, 64 * KIB, Watermarks.single(64 * KIB), 10, scheduler);

    TransferReport report = new ManualTransferUseCase(topology, "manual-1", observer).run();

    assertEquals(MIB, report.bytesConsumed());
    assertEquals(MIB, report.bytesProduced());
    assertEquals(PatternReadableResource.crc32(MIB), writable.crc32());
    assertEquals(32, report.backpressureEvents());
    assertEquals(160, scheduler.elapsedMillis());
    assertEquals(64L * KIB, report.peakBufferedBytes());
    assertTrue(report.peakBufferedTotal() <= 128L * KIB,
        "total peak " + report.peakBufferedTotal() + " exceeds bound");
    assertEquals(1, writable.closeCount());
    assertEquals(1, observer.completed.size());
    assertNull(MDC.get("sessionId"));
  }

  @Test
  void totalBufferedStaysBoundedWhenCapacityHoldsSeveralChunks() throws Exception {
    long size = 4L * MIB;
    int chunk = 16 * KIB;
    long capacity = 64 * KIB;
    CapturingWritableResource writable = CapturingWritableResource.checksumOnly();
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(size), writable, chunk, Watermarks.single(capacity), 10, scheduler);

    TransferReport report = new ManualTransferUseCase(topology, "manual-wide", observer).run();

    assertEquals(PatternReadableResource.crc32(size), writable.crc32());
    assertTrue(report.peakBufferedTotal() <= capacity + chunk,
        "total peak " + report.peakBufferedTotal() + " exceeds bound");
  }

  @Test
  void zeroByteInputProducesEmptyOutput() throws Exception {
    CapturingWritableResource writable = CapturingWritableResource.keepingBytes();
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(0), writable, 64 * KIB, Watermarks.single(64 * KIB), -1, scheduler);

    TransferReport report = new ManualTransferUseCase(topology, "manual-0", observer).run();

    assertEquals(0, report.bytesConsumed());
    assertEquals(0, report.backpressureEvents());
    assertEquals(0, writable.bytes().length);
    assertEquals(1, writable.flushCount());
  }

  @Test
  void sinkFailureThroughStageAbortsSourceOnce() {
    PatternReadableResource readable = new PatternReadableResource(MIB);
    CapturingWritableResource writable = CapturingWritableResource.failingAt(256 * KIB);
    SessionTopology topology = Topologies.build(
        readable, writable, 64 * KIB, Watermarks.single(64 * KIB), 1, scheduler);
    ManualTransferUseCase transfer = new ManualTransferUseCase(topology, "manual-2", observer);

    TransferException ex = assertThrows(TransferException.class, transfer::run);

    assertEquals(TransferErrorKind.SINK_WRITE, ex.kind());
    assertEquals("sink", ex.stage());
    assertEquals(1, Topologies.source(topology).abortCount());
    assertEquals(0, Topologies.sink(topology).acceptsAfterError());
    assertEquals(1, readable.closeCount());
    assertEquals(1, writable.closeCount());
    assertEquals(256L * KIB, writable.written());
    assertEquals(1, observer.errors.size());
  }

  @Test
  void interruptionAbortsSourceAndSink() {
    PatternReadableResource readable = new PatternReadableResource(MIB);
    CapturingWritableResource writable = CapturingWritableResource.checksumOnly();
    SessionTopology topology = Topologies.build(
        readable, writable, 64 * KIB, Watermarks.single(64 * KIB), 10, scheduler);
    ManualTransferUseCase transfer = new ManualTransferUseCase(topology, "manual-3", observer);

    Thread.currentThread().interrupt();
    assertThrows(InterruptedException.class, transfer::run);

    assertEquals(TransferErrorKind.PIPELINE_ABORT, transfer.session().failure().orElseThrow().kind());
    assertEquals(1, Topologies.source(topology).abortCount());
    assertEquals(1, Topologies.sink(topology).aborts());
    assertEquals(1, readable.closeCount());
    assertEquals(1, writable.closeCount());
  }

  @Test
  void runsOnlyOnce() throws Exception {
    SessionTopology topology = Topologies.build(
        new PatternReadableResource(10), CapturingWritableResource.keepingBytes(), 4,
        Watermarks.single(8), -1, scheduler);
    ManualTransferUseCase transfer = new ManualTransferUseCase(topology, "manual-4", observer);
    transfer.run();

    assertThrows(IllegalStateException.class, transfer::run);
    assertFalse(observer.completed.isEmpty());
  }
}
