package io.pitwall.tyre.application.model;

import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.health.LatentPaceEstimate;
import io.pitwall.tyre.domain.health.LatentPaceHistory;
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
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Scalar Kalman filter tracking each driver's hidden fuel-free tyre pace.
 * <p><strong>Why:</strong> Raw lap times jitter by tenths; the filter separates that noise from the steady drift caused
 * by wear.</p>
 * <p><strong>Role:</strong> Final stage of the fit pass. Its output is diagnostic; health scoring does not read it.</p>
 * <p><strong>Model:</strong> state α<sub>t</sub> = α<sub>t−1</sub> + rate × abrasion + η, observation
 * y<sub>t</sub> = α<sub>t</sub> + fuelEffect × fuel<sub>t</sub> + ε. The state restarts at the compound's reset pace
 * on the first lap of every stint.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each run allocates its own histories.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code driver} while a driver's laps are filtered.</p>
 *
 * @since 0.1.0
 */
public final class LatentPaceFilter {
  private static final Logger log = LoggerFactory.getLogger(LatentPaceFilter.class);

  private final ModelConfig config;
  private final TyreProfileRegistry registry;

  public LatentPaceFilter(ModelConfig config, TyreProfileRegistry registry) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Runs the filter over every driver's prepared laps.
   *
   * @param laps prepared laps sorted by driver then lap number
   * @param trackAbrasion abrasion factor applied to every compound's rate
   * @return one history per driver; the map is unmodifiable
   */
  public Map<String, LatentPaceHistory> run(List<PreparedLap> laps, double trackAbrasion) {
    Map<String, List<PreparedLap>> byDriver = new LinkedHashMap<>();
    for (PreparedLap lap : laps) {
      byDriver.computeIfAbsent(lap.driver(), d -> new ArrayList<>()).add(lap);
    }
    Map<String, LatentPaceHistory> histories = new LinkedHashMap<>();
    String previousDriver = MDC.get("driver");
    try {
      byDriver.forEach((driver, driverLaps) -> {
        MDC.put("driver", driver);
        histories.put(driver, filterDriver(driver, driverLaps, trackAbrasion));
      });
    } finally {
      if (previousDriver == null) {
        MDC.remove("driver");
      } else {
        MDC.put("driver", previousDriver);
      }
    }
    return Map.copyOf(histories);
  }

  private LatentPaceHistory filterDriver(String driver, List<PreparedLap> laps, double trackAbrasion) {
    double observationVariance = config.observationNoise() * config.observationNoise();
    double processVariance = config.processNoise() * config.processNoise();
    List<LatentPaceEstimate> estimates = new ArrayList<>(laps.size());
    double mean = 0.0;
    double variance = 0.0;
    Integer currentStint = null;
    for (PreparedLap lap : laps) {
      Optional<TyreProfile> maybeProfile = registry.find(lap.compound());
      if (maybeProfile.isEmpty()) {
        log.debug("Skipping lap {} with unknown compound {}", lap.lapNumber(), lap.compound());
        continue;
      }
      TyreProfile profile = maybeProfile.get();
      if (currentStint == null || currentStint != lap.stint()) {
        mean = profile.resetPace();
        variance = processVariance;
        currentStint = lap.stint();
      } else {
        double predictedMean = mean + profile.degradationRate() * trackAbrasion;
        double predictedVariance = variance + processVariance;
        double expectedLap = predictedMean + config.fuelEffect() * lap.fuelMass();
        double innovation = lap.lapSeconds() - expectedLap;
        double gain = predictedVariance / (predictedVariance + observationVariance);
        mean = predictedMean + gain * innovation;
        variance = (1.0 - gain) * predictedVariance;
      }
      estimates.add(new LatentPaceEstimate(lap.lapNumber(), lap.stint(), profile.name(), mean, variance));
    }
    log.debug("Filtered {} laps; latest pace {}", estimates.size(),
        estimates.isEmpty() ? "n/a" : estimates.get(estimates.size() - 1).mean());
    return new LatentPaceHistory(driver, estimates);
  }
}
