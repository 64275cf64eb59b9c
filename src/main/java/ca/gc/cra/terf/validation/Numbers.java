package ca.gc.cra.terf.validation;

/**
 * Numeric range checks for configuration values such as {@code threads} and {@code perShard}.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name parameter name used in the error message
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks it against {@code [min, max]}.
   *
   * @param name parameter name used in error messages
   * @param raw trimmed or untrimmed text
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException when blank, not an integer, or out of range
   */
  public static int parseIntInRange(String name, String raw, int min, int max) {
    String text = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(text);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + text + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
