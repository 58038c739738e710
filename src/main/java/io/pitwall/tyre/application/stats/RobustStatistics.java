package io.pitwall.tyre.application.stats;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * <strong>What:</strong> Outlier-resistant statistics used by the degradation estimators.
 * <p><strong>Why:</strong> Single laps lost to traffic or yellow flags must not drag a stint's degradation slope; the
 * Theil–Sen estimator tolerates close to 29% corrupted points.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Performance:</strong> Theil–Sen is O(n² log n) in stint length; stints are tens of laps.</p>
 *
 * @since 0.1.0
 */
public final class RobustStatistics {
  private RobustStatistics() {
    // Utility
  }

  /**
   * Returns the median of the values; the mean of the two middle values for even counts.
   *
   * @param values sample; must not be empty
   * @return median
   * @throws IllegalArgumentException if {@code values} is empty
   */
  public static double median(double[] values) {
    Objects.requireNonNull(values, "values");
    if (values.length == 0) {
      throw new IllegalArgumentException("median of empty sample");
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  /**
   * Returns the median of a collection of samples.
   *
   * @param values sample; must not be empty
   * @return median
   */
  public static double median(Collection<Double> values) {
    return median(values.stream().mapToDouble(Double::doubleValue).toArray());
  }

  /**
   * Fits the Theil–Sen slope: the median of the slopes over every pair of points with distinct {@code x}.
   *
   * @param x abscissae
   * @param y ordinates, same length as {@code x}
   * @return robust slope estimate
   * @throws IllegalArgumentException if lengths differ or no pair has distinct {@code x}
   */
  public static double theilSenSlope(double[] x, double[] y) {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (x.length != y.length) {
      throw new IllegalArgumentException("x and y must have the same length (" + x.length + " vs " + y.length + ")");
    }
    int n = x.length;
    double[] slopes = new double[n * (n - 1) / 2];
    int count = 0;
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        double dx = x[j] - x[i];
        if (dx != 0.0) {
          slopes[count++] = (y[j] - y[i]) / dx;
        }
      }
    }
    if (count == 0) {
      throw new IllegalArgumentException("Theil-Sen slope needs at least two distinct x values");
    }
    return median(Arrays.copyOf(slopes, count));
  }

  /**
   * Returns {@code true} when the sample is not constant (non-zero standard deviation).
   *
   * @param values sample
   * @return whether any two values differ
   */
  public static boolean hasSpread(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (values[i] != values[0]) {
        return true;
      }
    }
    return false;
  }

  /**
   * Clamps a value to an inclusive range.
   *
   * @param value candidate
   * @param min lower bound
   * @param max upper bound
   * @return clamped value
   */
  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }
}
