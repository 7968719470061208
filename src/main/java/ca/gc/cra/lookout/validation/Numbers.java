package ca.gc.cra.lookout.validation;

/**
 * Numeric range checks for configuration values.
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
   * @param name value label
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }
}
