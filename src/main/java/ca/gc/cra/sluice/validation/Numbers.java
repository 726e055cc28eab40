package ca.gc.cra.sluice.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by sluice CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects impossible watermark, chunk and latency settings before any resource is
 * opened.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation
 * fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal value and validates its range; blank input yields {@code fallback}.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value from CLI or YAML; may be {@code null}
   * @param fallback value used when {@code raw} is blank; not range checked
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static long parseLong(String name, String raw, long fallback, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    long value;
    try {
      value = Long.parseLong(raw.trim().replace("_", ""));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Int variant of {@link #parseLong(String, String, long, long, long)}.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; may be {@code null}
   * @param fallback value used when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   */
  public static int parseInt(String name, String raw, int fallback, int min, int max) {
    return (int) parseLong(name, raw, fallback, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
