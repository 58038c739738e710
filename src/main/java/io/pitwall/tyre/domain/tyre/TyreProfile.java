package io.pitwall.tyre.domain.tyre;

import io.pitwall.tyre.validation.Numbers;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Per-compound degradation parameters.
 * <p><strong>Why:</strong> Holds the hard-coded prior for each compound and the session-fitted degradation rate that
 * replaces it after a fit pass.</p>
 * <p><strong>Role:</strong> Mutable domain entity owned by {@link TyreProfileRegistry}.</p>
 * <p><strong>Thread-safety:</strong> The degradation rate is {@code volatile}; writes happen only inside an exclusive
 * fit pass, reads may come from any thread afterwards.</p>
 *
 * @implNote Every field except {@link #degradationRate()} is fixed at construction.
 * @since 0.1.0
 */
public final class TyreProfile {
  private final String name;
  private final TyreCategory category;
  private final double priorDegradationRate;
  private final double resetPace;
  private final int warmupLaps;
  private final Integer maxAnalysisLaps;
  private final double maxDegradation;
  private volatile double degradationRate;

  /**
   * Creates a profile whose current degradation rate starts at the prior.
   *
   * @param name compound name (e.g., {@code MEDIUM}); must not be {@code null}
   * @param category compound family; must not be {@code null}
   * @param degradationRate prior degradation in seconds per lap on tyre; must be non-negative
   * @param resetPace expected fuel-free lap time on lap one of a fresh set, in seconds
   * @param warmupLaps laps needed to bring the tyre into its window; must be non-negative
   * @param maxAnalysisLaps optional analysis horizon in laps on tyre, descriptive only; {@code null} for none
   * @param maxDegradation cumulative seconds lost at which the tyre is considered spent; must be non-negative
   * @throws IllegalArgumentException if a numeric invariant is violated
   */
  public TyreProfile(
      String name,
      TyreCategory category,
      double degradationRate,
      double resetPace,
      int warmupLaps,
      Integer maxAnalysisLaps,
      double maxDegradation) {
    this.name = Objects.requireNonNull(name, "name");
    this.category = Objects.requireNonNull(category, "category");
    this.priorDegradationRate = Numbers.requireNonNegative("degradationRate", degradationRate);
    this.resetPace = resetPace;
    this.warmupLaps = Numbers.requireNonNegative("warmupLaps", warmupLaps);
    if (maxAnalysisLaps != null && maxAnalysisLaps < 1) {
      throw new IllegalArgumentException("maxAnalysisLaps must be positive (was " + maxAnalysisLaps + ")");
    }
    this.maxAnalysisLaps = maxAnalysisLaps;
    this.maxDegradation = Numbers.requireNonNegative("maxDegradation", maxDegradation);
    this.degradationRate = degradationRate;
  }

  public String name() {
    return name;
  }

  public TyreCategory category() {
    return category;
  }

  /** Current degradation rate in seconds per lap; equals the prior until a fit updates it. */
  public double degradationRate() {
    return degradationRate;
  }

  public double priorDegradationRate() {
    return priorDegradationRate;
  }

  public double resetPace() {
    return resetPace;
  }

  public int warmupLaps() {
    return warmupLaps;
  }

  public OptionalInt maxAnalysisLaps() {
    return maxAnalysisLaps == null ? OptionalInt.empty() : OptionalInt.of(maxAnalysisLaps);
  }

  public double maxDegradation() {
    return maxDegradation;
  }

  /**
   * Replaces the current degradation rate.
   *
   * @param rate new rate in seconds per lap
   * @throws IllegalArgumentException if {@code rate} is negative or not finite
   */
  public void updateDegradationRate(double rate) {
    this.degradationRate = Numbers.requireNonNegative(name + ".degradationRate", rate);
  }

  /** Restores the hard-coded prior rate. */
  public void resetToPrior() {
    this.degradationRate = priorDegradationRate;
  }

  @Override
  public String toString() {
    return "TyreProfile[" + name + ", " + category + ", rate=" + degradationRate + "]";
  }
}
