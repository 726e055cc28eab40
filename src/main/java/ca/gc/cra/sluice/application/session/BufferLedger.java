package ca.gc.cra.sluice.application.session;

/**
 * Session-wide tally of bytes buffered across all components.
 *
 * <p>Each component's buffer reports additions and releases here so the session can observe the
 * simultaneous total. Confined to the session scheduler thread.</p>
 *
 * @since 0.1.0
 */
public final class BufferLedger {
  private long buffered;
  private long peak;

  /**
   * Records bytes entering some component's buffer.
   *
   * @param bytes non-negative byte count
   */
  public void add(long bytes) {
    if (bytes < 0) {
      throw new IllegalArgumentException("bytes must not be negative");
    }
    buffered += bytes;
    if (buffered > peak) {
      peak = buffered;
    }
  }

  /**
   * Records bytes leaving some component's buffer.
   *
   * @param bytes non-negative byte count no larger than {@link #buffered()}
   */
  public void release(long bytes) {
    if (bytes < 0 || bytes > buffered) {
      throw new IllegalStateException("release of " + bytes + " exceeds buffered " + buffered);
    }
    buffered -= bytes;
  }

  /** Bytes currently buffered across components. */
  public long buffered() {
    return buffered;
  }

  /** Highest simultaneous buffered total observed. */
  public long peak() {
    return peak;
  }
}
