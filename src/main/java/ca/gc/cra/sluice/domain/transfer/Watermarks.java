package ca.gc.cra.sluice.domain.transfer;

/**
 * <strong>What:</strong> Capacity thresholds governing when a buffer reports saturation and when it drains.
 * <p><strong>Why:</strong> Separates the saturation trigger (high-water) from the resume trigger (low-water).</p>
 * <p><strong>Role:</strong> Domain value shared by sinks and the latency stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param highWaterBytes buffered-byte count at or above which a buffer is saturated; must be positive
 * @param lowWaterBytes buffered-byte count at or below which a saturated buffer drains; between zero and
 *     {@code highWaterBytes}
 * @since 0.1.0
 */
public record Watermarks(long highWaterBytes, long lowWaterBytes) {

  /**
   * Validates the thresholds.
   *
   * @throws IllegalArgumentException if the high-water mark is not positive or the low-water mark lies
   *     outside {@code [0, highWaterBytes]}
   */
  public Watermarks {
    if (highWaterBytes <= 0) {
      throw new IllegalArgumentException("highWaterBytes must be positive (was " + highWaterBytes + ")");
    }
    if (lowWaterBytes < 0 || lowWaterBytes > highWaterBytes) {
      throw new IllegalArgumentException(
          "lowWaterBytes must be between 0 and " + highWaterBytes + " (was " + lowWaterBytes + ")");
    }
  }

  /**
   * Creates single-threshold watermarks where the low-water mark equals the high-water mark.
   *
   * @param highWaterBytes shared threshold in bytes
   * @return watermarks with equal thresholds
   */
  public static Watermarks single(long highWaterBytes) {
    return new Watermarks(highWaterBytes, highWaterBytes);
  }

  /**
   * Reports whether {@code bufferedBytes} saturates a buffer.
   *
   * @param bufferedBytes bytes currently buffered
   * @return {@code true} when at or above the high-water mark
   */
  public boolean saturates(long bufferedBytes) {
    return bufferedBytes >= highWaterBytes;
  }

  /**
   * Reports whether a saturated buffer holding {@code bufferedBytes} has drained.
   *
   * @param bufferedBytes bytes currently buffered
   * @return {@code true} when at or below the low-water mark
   */
  public boolean drains(long bufferedBytes) {
    return bufferedBytes <= lowWaterBytes;
  }
}
