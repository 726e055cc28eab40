package ca.gc.cra.sluice.domain.transfer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one bridged hop between an emitter and a sink.
 *
 * <pre>
 * IDLE -> ACTIVE -> SATURATED -> ACTIVE -> ENDING -> FINISHED
 *   any non-terminal state -> ERRORED
 * </pre>
 *
 * @since 0.1.0
 */
public enum FlowState {
  /** Created, not yet started. */
  IDLE,
  /** Upstream flowing; sink has room. */
  ACTIVE,
  /** Sink saturated; upstream suspended until drained. */
  SATURATED,
  /** Upstream reached end of stream; waiting for the sink to finish. */
  ENDING,
  /** Sink finished successfully. */
  FINISHED,
  /** A component failed or the hop was aborted. */
  ERRORED;

  /**
   * Reports whether no further transition may leave this state.
   *
   * @return {@code true} for {@link #FINISHED} and {@link #ERRORED}
   */
  public boolean isTerminal() {
    return this == FINISHED || this == ERRORED;
  }

  /**
   * Checks whether moving from this state to {@code next} is legal.
   *
   * @param next candidate state
   * @return {@code true} when the transition is allowed
   */
  public boolean canTransitionTo(FlowState next) {
    return successors().contains(next);
  }

  private Set<FlowState> successors() {
    return switch (this) {
      case IDLE -> EnumSet.of(ACTIVE, ERRORED);
      case ACTIVE -> EnumSet.of(SATURATED, ENDING, ERRORED);
      case SATURATED -> EnumSet.of(ACTIVE, ERRORED);
      case ENDING -> EnumSet.of(FINISHED, ERRORED);
      case FINISHED, ERRORED -> EnumSet.noneOf(FlowState.class);
    };
  }
}
