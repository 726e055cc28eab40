package ca.gc.cra.sluice.domain.transfer;

/**
 * Outcome of handing a chunk to a sink.
 *
 * <p>The chunk is always committed before the result is returned; {@code saturated} tells the caller
 * that the sink's buffer reached its high-water mark with this write and that no further chunk may be
 * offered until the sink signals drained.</p>
 *
 * @param saturated {@code true} when the sink reached its high-water mark with this write
 * @since 0.1.0
 */
public record AcceptResult(boolean saturated) {
  /** Chunk buffered; sink still has room. */
  public static final AcceptResult ACCEPTED = new AcceptResult(false);
  /** Chunk buffered; sink is now saturated. */
  public static final AcceptResult SATURATED = new AcceptResult(true);

  /**
   * Returns the shared instance for the given saturation flag.
   *
   * @param saturated whether the sink is saturated after the write
   * @return shared result instance
   */
  public static AcceptResult of(boolean saturated) {
    return saturated ? SATURATED : ACCEPTED;
  }

  /** Always {@code true}: sinks commit before signalling. */
  public boolean accepted() {
    return true;
  }
}
