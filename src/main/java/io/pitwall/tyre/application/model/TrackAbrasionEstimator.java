package io.pitwall.tyre.application.model;

import io.pitwall.tyre.application.stats.RobustStatistics;
import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.PreparedLap;
import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Infers how aggressive this circuit's surface is relative to global slick baselines.
 * <p><strong>Why:</strong> A rough surface speeds up wear of every compound alike; one multiplicative factor captures it
 * without refitting each compound.</p>
 * <p><strong>Role:</strong> Second stage of the fit pass.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration.</p>
 *
 * @implNote Uses only dry laps on HARD, MEDIUM and SOFT; the median and clamp keep one odd stint from setting the
 *     surface-wide factor.
 * @since 0.1.0
 */
public final class TrackAbrasionEstimator {
  private static final Logger log = LoggerFactory.getLogger(TrackAbrasionEstimator.class);

  /** Neutral factor used when there is not enough evidence. */
  public static final double NEUTRAL = 1.0;
  public static final double MIN_FACTOR = 0.7;
  public static final double MAX_FACTOR = 1.4;

  static final Map<String, Double> SLICK_BASELINES = Map.of("HARD", 0.003, "MEDIUM", 0.009, "SOFT", 0.015);
  static final int MIN_STINT_LAPS = 8;
  static final int MIN_SAMPLES = 3;

  private final ModelConfig config;
  private final TyreProfileRegistry registry;

  public TrackAbrasionEstimator(ModelConfig config, TyreProfileRegistry registry) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Estimates the abrasion factor from prepared laps.
   *
   * @param laps prepared laps sorted by driver then lap number
   * @return factor in {@code [0.7, 1.4]}; exactly {@code 1.0} with fewer than three samples
   */
  public double estimate(List<PreparedLap> laps) {
    List<PreparedLap> dryLaps = laps.stream()
        .filter(lap -> lap.condition() == TrackCondition.DRY)
        .toList();
    List<Double> samples = new ArrayList<>();
    StintSeries.group(dryLaps, registry).forEach((compound, series) -> {
      Double baseline = SLICK_BASELINES.get(compound);
      if (baseline == null) {
        return;
      }
      for (StintSeries stint : series) {
        if (stint.size() < MIN_STINT_LAPS) {
          continue;
        }
        double[] deltas = stint.deltasFromFirst(config.fuelEffect());
        if (!RobustStatistics.hasSpread(deltas)) {
          continue;
        }
        double slope = RobustStatistics.theilSenSlope(stint.lapsOnTyre(), deltas);
        if (slope > 0) {
          samples.add(slope / baseline);
        }
      }
    });
    if (samples.size() < MIN_SAMPLES) {
      log.debug("Only {} abrasion samples; using neutral factor", samples.size());
      return NEUTRAL;
    }
    double factor = RobustStatistics.clamp(RobustStatistics.median(samples), MIN_FACTOR, MAX_FACTOR);
    log.debug("Track abrasion {} from {} samples", factor, samples.size());
    return factor;
  }
}
