package ca.gc.cra.sluice.application.stage;

import ca.gc.cra.sluice.application.session.BufferLedger;
import ca.gc.cra.sluice.domain.transfer.Watermarks;
import java.util.Objects;

/**
 * Buffered-byte counter with binary saturation state.
 *
 * <p>Saturation latches when an addition reaches the high-water mark and clears only through a release
 * that brings the count to or below the low-water mark, so each saturation period drains exactly once.</p>
 */
final class BufferGauge {
  private final Watermarks watermarks;
  private final BufferLedger ledger;
  private long buffered;
  private long peak;
  private boolean saturated;

  BufferGauge(Watermarks watermarks, BufferLedger ledger) {
    this.watermarks = Objects.requireNonNull(watermarks, "watermarks");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
  }

  /**
   * Adds bytes and latches saturation when the high-water mark is reached.
   *
   * @return saturation state after the addition
   */
  boolean add(int bytes) {
    buffered += bytes;
    ledger.add(bytes);
    if (buffered > peak) {
      peak = buffered;
    }
    if (watermarks.saturates(buffered)) {
      saturated = true;
    }
    return saturated;
  }

  /**
   * Releases bytes.
   *
   * @return {@code true} when this release ended a saturation period
   */
  boolean release(int bytes) {
    if (bytes > buffered) {
      throw new IllegalStateException("release of " + bytes + " exceeds buffered " + buffered);
    }
    buffered -= bytes;
    ledger.release(bytes);
    if (saturated && watermarks.drains(buffered)) {
      saturated = false;
      return true;
    }
    return false;
  }

  /** Drops everything without signalling drained. */
  void clear() {
    ledger.release(buffered);
    buffered = 0;
    saturated = false;
  }

  boolean isSaturated() {
    return saturated;
  }

  long buffered() {
    return buffered;
  }

  long peak() {
    return peak;
  }
}
