package ca.gc.cra.sluice.domain.transfer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable summary of a successfully completed transfer session.
 * <p><strong>Role:</strong> Returned by the bridges and published to reporting collaborators.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param sessionId session identifier
 * @param bytesProduced bytes emitted by the source
 * @param bytesConsumed bytes written by the terminal sink
 * @param backpressureEvents number of times any hop suspended its upstream
 * @param elapsed session duration measured on the session scheduler's clock
 * @param peakBufferedTotal highest simultaneous buffered-byte count summed across components
 * @param peakBufferedByComponent highest buffered-byte count observed per component name
 * @since 0.1.0
 */
public record TransferReport(
    String sessionId,
    long bytesProduced,
    long bytesConsumed,
    long backpressureEvents,
    Duration elapsed,
    long peakBufferedTotal,
    Map<String, Long> peakBufferedByComponent) {

  public TransferReport {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(elapsed, "elapsed");
    peakBufferedByComponent = Map.copyOf(peakBufferedByComponent);
  }

  /**
   * Highest buffered-byte count observed in any single component.
   *
   * @return per-component peak, zero when nothing was buffered
   */
  public long peakBufferedBytes() {
    return peakBufferedByComponent.values().stream().mapToLong(Long::longValue).max().orElse(0L);
  }
}
