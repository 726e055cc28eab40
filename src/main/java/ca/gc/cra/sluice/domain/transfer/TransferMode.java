package ca.gc.cra.sluice.domain.transfer;

import java.util.Locale;

/**
 * Bridge strategies selectable for a transfer.
 *
 * @since 0.1.0
 */
public enum TransferMode {
  /** Caller-wired flow controllers with ad hoc cleanup. */
  MANUAL,
  /** Pipeline orchestrator with centralized teardown. */
  PIPELINE,
  /** Automatically linked hops; on error the caller aborts only the source and the sink. */
  PIPE,
  /** Runs {@link #MANUAL} then {@link #PIPELINE} into separate outputs. */
  COMPARE;

  /**
   * Parses a mode name, defaulting to {@link #PIPELINE} when blank.
   *
   * @param value textual mode such as {@code "manual"}
   * @return parsed mode
   * @throws IllegalArgumentException if the value is not a known mode
   */
  public static TransferMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return PIPELINE;
    }
    try {
      return TransferMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown mode: " + value, ex);
    }
  }
}
