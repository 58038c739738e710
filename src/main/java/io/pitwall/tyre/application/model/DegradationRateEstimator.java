package io.pitwall.tyre.application.model;

import io.pitwall.tyre.application.stats.RobustStatistics;
import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.PreparedLap;
import io.pitwall.tyre.domain.tyre.TyreProfile;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pulls each compound's degradation prior toward the slope observed in this session.
 * <p><strong>Why:</strong> Priors are generic across circuits; blending with a robust per-stint median adapts them while
 * falling back to the prior wherever evidence is thin.</p>
 * <p><strong>Role:</strong> Third stage of the fit pass; the only writer of {@link TyreProfile#degradationRate()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fit a Theil–Sen slope over every lap of each qualifying stint on fuel-corrected deltas.</li>
 *   <li>Keep only positive slopes; negative ones are timing noise.</li>
 *   <li>Blend {@code priorWeight × prior + (1 − priorWeight) × median}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutates registry profiles; callers must hold exclusive access.</p>
 *
 * @since 0.1.0
 */
public final class DegradationRateEstimator {
  private static final Logger log = LoggerFactory.getLogger(DegradationRateEstimator.class);

  static final int MIN_COMPOUND_LAPS = 5;
  static final int MIN_STINT_LAPS = 5;
  static final int MIN_ANALYSIS_LAPS = 3;

  private final ModelConfig config;
  private final TyreProfileRegistry registry;

  public DegradationRateEstimator(ModelConfig config, TyreProfileRegistry registry) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Refines registry degradation rates from prepared laps.
   *
   * @param laps prepared laps sorted by driver then lap number
   * @return observed median slope per compound that had evidence, keyed by upper-case compound name
   */
  public Map<String, Double> refine(List<PreparedLap> laps) {
    Map<String, Double> observed = new LinkedHashMap<>();
    StintSeries.group(laps, registry).forEach((compound, series) -> {
      int compoundLaps = series.stream().mapToInt(StintSeries::size).sum();
      if (compoundLaps < MIN_COMPOUND_LAPS) {
        return;
      }
      List<Double> slopes = new ArrayList<>();
      for (StintSeries stint : series) {
        if (stint.size() < MIN_STINT_LAPS) {
          continue;
        }
        stintSlope(stint).ifPresent(slopes::add);
      }
      if (slopes.isEmpty()) {
        return;
      }
      TyreProfile profile = registry.asMap().get(compound);
      double median = RobustStatistics.median(slopes);
      double prior = profile.degradationRate();
      double blended = config.priorWeight() * prior + (1.0 - config.priorWeight()) * median;
      profile.updateDegradationRate(blended);
      observed.put(compound, median);
      log.debug("Compound {} degradation {} -> {} (median {} over {} stints)",
          compound, prior, blended, median, slopes.size());
    });
    return observed;
  }

  private Optional<Double> stintSlope(StintSeries stint) {
    double[] x = stint.lapsOnTyre();
    double[] deltas = stint.deltasFromFirst(config.fuelEffect());
    if (x.length < MIN_ANALYSIS_LAPS) {
      return Optional.empty();
    }
    if (!RobustStatistics.hasSpread(deltas)) {
      log.debug("Skipping {} stint {} on {}: constant lap times", stint.driver(), stint.stint(),
          stint.profile().name());
      return Optional.empty();
    }
    double slope = RobustStatistics.theilSenSlope(x, deltas);
    return slope > 0 ? Optional.of(slope) : Optional.empty();
  }
}
