package ca.gc.cra.s3.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards ACL field limits and grant capacities before buffers are sized from them.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
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
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          Strings.message(name, "must be between " + min + " and " + max + " (was " + value + ")"));
    }
    return value;
  }

  /**
   * Parses a decimal integer and validates it against an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw decimal text; surrounding whitespace is ignored
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside {@code [min, max]}
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    int value;
    try {
      value = Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(Strings.message(name, "must be an integer (was " + trimmed + ")"), ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
