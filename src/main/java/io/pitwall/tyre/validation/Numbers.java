package io.pitwall.tyre.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by model configuration and tyre profiles.
 * <p><strong>Why:</strong> Guards against negative noise terms, degradation rates and penalties before they reach the
 * estimators, where they would silently corrupt every health figure.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration records and profile setters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive numeric bounds declared by configuration records.</li>
 *   <li>Provide consistent error messaging for configuration feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
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
   * @throws IllegalArgumentException if {@code value} is NaN or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a value is finite and not negative.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is negative, NaN or infinite
   */
  public static double requireNonNegative(String name, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new IllegalArgumentException(label(name) + " must be non-negative (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a count is not negative.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate count
   * @return the validated count
   * @throws IllegalArgumentException if {@code value} is negative
   */
  public static int requireNonNegative(String name, int value) {
    if (value < 0) {
      throw new IllegalArgumentException(label(name) + " must be non-negative (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
