package io.pitwall.tyre.application.model;

import io.pitwall.tyre.application.port.MetricsPort;
import io.pitwall.tyre.application.stats.RobustStatistics;
import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.health.TyreHealth;
import io.pitwall.tyre.domain.lap.LapRecord;
import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.domain.tyre.TyreProfile;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Closed-form 0–100 tyre health score for a driver at a lap.
 * <p><strong>Why:</strong> The replay overlay asks for every driver on every frame; the score must be cheap and
 * deterministic, so it is computed from fitted profile parameters rather than replaying the Kalman filter.</p>
 * <p><strong>Role:</strong> Query side of the model.</p>
 * <p><strong>Thread-safety:</strong> Results are cached in a {@link ConcurrentHashMap}; safe for concurrent queries.</p>
 * <p><strong>Observability:</strong> Counts {@code tyre.predict.cache.hit}, {@code tyre.predict.cache.miss} and
 * {@code tyre.predict.empty}.</p>
 *
 * @since 0.1.0
 */
public final class TyreHealthPredictor {
  /** Floor on effective degradation when computing the lap budget. */
  static final double MIN_EFFECTIVE_DEGRADATION = 0.001;
  /** Penalty points that double the effective lap count. */
  static final double MISMATCH_SCALE = 5.0;

  private final ModelConfig config;
  private final TyreProfileRegistry registry;
  private final MetricsPort metrics;
  private final ConcurrentMap<CacheKey, TyreHealth> cache = new ConcurrentHashMap<>();

  public TyreHealthPredictor(ModelConfig config, TyreProfileRegistry registry, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  Optional<TyreHealth> predict(
      FittedSession session, String driver, int lapNumber, Optional<TrackCondition> condition) {
    CacheKey key = new CacheKey(driver, lapNumber, condition.orElse(null));
    TyreHealth cached = cache.get(key);
    if (cached != null) {
      metrics.increment("tyre.predict.cache.hit");
      return Optional.of(cached);
    }
    metrics.increment("tyre.predict.cache.miss");
    Optional<TyreHealth> result = score(
        session.lapsByDriver().getOrDefault(driver, List.of()), lapNumber, condition, session.trackAbrasion());
    if (result.isEmpty()) {
      metrics.increment("tyre.predict.empty");
      return result;
    }
    TyreHealth existing = cache.putIfAbsent(key, result.get());
    return Optional.of(existing != null ? existing : result.get());
  }

  /**
   * Scores health without touching the cache.
   *
   * @param driverLaps one driver's session laps sorted by lap number
   * @param lapNumber query lap
   * @param condition explicit condition; empty uses the lap's own label, then DRY
   * @param trackAbrasion abrasion factor
   * @return health, or empty when no lap precedes the query or the compound is unknown
   */
  Optional<TyreHealth> score(
      List<LapRecord> driverLaps, int lapNumber, Optional<TrackCondition> condition, double trackAbrasion) {
    LapRecord latest = null;
    for (LapRecord lap : driverLaps) {
      if (lap.lapNumber() > lapNumber) {
        break;
      }
      latest = lap;
    }
    if (latest == null) {
      return Optional.empty();
    }
    LapRecord last = latest;
    Optional<TyreProfile> maybeProfile = registry.find(last.compound());
    if (maybeProfile.isEmpty()) {
      return Optional.empty();
    }
    TyreProfile profile = maybeProfile.get();
    int stint = last.stint();
    int lapsOnTyre = (int) driverLaps.stream()
        .filter(lap -> lap.lapNumber() <= lapNumber && lap.stint() == stint)
        .count();

    double effectiveDegradation = profile.degradationRate() * trackAbrasion;
    TrackCondition resolved = condition.orElseGet(() -> TrackCondition.resolve(last.trackCondition()).condition());
    double penalty = config.mismatchPenalties().penalty(profile.category(), resolved);
    double maxLaps = profile.maxDegradation() / Math.max(effectiveDegradation, MIN_EFFECTIVE_DEGRADATION);
    double effectiveLaps = lapsOnTyre * (1.0 + penalty / MISMATCH_SCALE);
    double health = RobustStatistics.clamp(100.0 * (1.0 - effectiveLaps / maxLaps), 0.0, 100.0);
    double projectedPace = profile.resetPace() + (lapsOnTyre - 1) * effectiveDegradation;

    return Optional.of(new TyreHealth(
        (int) health,
        lapsOnTyre,
        last.compound(),
        effectiveDegradation,
        penalty,
        resolved,
        profile.category(),
        trackAbrasion,
        projectedPace));
  }

  void clearCache() {
    cache.clear();
  }

  int cacheSize() {
    return cache.size();
  }

  private record CacheKey(String driver, int lapNumber, TrackCondition condition) {}
}
