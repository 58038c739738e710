package io.pitwall.tyre.application.model;

import io.pitwall.tyre.application.port.MetricsPort;
import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.health.LatentPaceHistory;
import io.pitwall.tyre.domain.health.TyreHealth;
import io.pitwall.tyre.domain.lap.LapRecord;
import io.pitwall.tyre.domain.lap.PreparedLaps;
import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.domain.tyre.TyreProfile;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import io.pitwall.tyre.logging.LoggingConfigurator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-driver, per-stint tyre degradation model with a 0–100 health query.
 * <p><strong>Why:</strong> Separates tyre wear from fuel burn-off and surface abrasion so a replay can show how much life
 * each driver's current set has left.</p>
 * <p><strong>Role:</strong> Application facade. {@link #fit(List)} runs lap preparation, abrasion estimation, rate
 * refinement and the latent pace filter once; {@link #predict(String, int)} then answers independent queries.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the compound registry and write fitted rates into it.</li>
 *   <li>Publish an immutable fitted snapshot for queries.</li>
 *   <li>Cache health results until {@link #clearCache()} or the next fit.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@code fit} is synchronized and must not overlap queries; once it returns,
 * {@code predict} may be called from any number of threads.</p>
 * <p><strong>Observability:</strong> Emits {@code tyre.fit.*} and {@code tyre.predict.*} metrics and logs fitted rates
 * at INFO.</p>
 *
 * @since 0.1.0
 */
public final class TyreDegradationModel {
  private static final Logger log = LoggerFactory.getLogger(TyreDegradationModel.class);

  private final ModelConfig config;
  private final TyreProfileRegistry registry;
  private final MetricsPort metrics;
  private final LapDataPreparer preparer;
  private final TrackAbrasionEstimator abrasionEstimator;
  private final DegradationRateEstimator rateEstimator;
  private final LatentPaceFilter paceFilter;
  private final TyreHealthPredictor predictor;
  private volatile FittedSession session;

  /** Creates a model with default configuration, default priors and no metrics. */
  public TyreDegradationModel() {
    this(ModelConfig.defaults(), TyreProfileRegistry.defaults(), MetricsPort.NO_OP);
  }

  public TyreDegradationModel(ModelConfig config) {
    this(config, TyreProfileRegistry.defaults(), MetricsPort.NO_OP);
  }

  /**
   * Creates a model with explicit dependencies.
   *
   * @param config model tuning; must not be {@code null}
   * @param registry compound priors; owned by the model from here on; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public TyreDegradationModel(ModelConfig config, TyreProfileRegistry registry, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.preparer = new LapDataPreparer(config);
    this.abrasionEstimator = new TrackAbrasionEstimator(config, registry);
    this.rateEstimator = new DegradationRateEstimator(config, registry);
    this.paceFilter = new LatentPaceFilter(config, registry);
    this.predictor = new TyreHealthPredictor(config, registry, metrics);
    if (config.debugLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Fits the model to a session's laps for every driver.
   *
   * @param laps caller-owned lap table; not modified
   * @see #fit(List, String)
   */
  public void fit(List<LapRecord> laps) {
    fit(laps, null);
  }

  /**
   * Fits the model to a session's laps.
   *
   * <p>Compound rates are restored to their priors first, so fitting the same table twice gives the same result.
   * When no lap survives preparation the call is a no-op and the model keeps its previous state.</p>
   *
   * @param laps caller-owned lap table; not modified; must not be {@code null}
   * @param driver optional driver filter; {@code null} fits every driver
   */
  public synchronized void fit(List<LapRecord> laps, String driver) {
    Objects.requireNonNull(laps, "laps");
    PreparedLaps prepared = preparer.prepare(laps, driver);
    metrics.observe("tyre.fit.laps.prepared", prepared.laps().size());
    metrics.observe("tyre.fit.conditions.normalized", prepared.normalizedConditions());
    if (prepared.isEmpty()) {
      log.info("No usable laps among {} records; model left {}", laps.size(), isFitted() ? "as fitted" : "unfitted");
      metrics.increment("tyre.fit.skipped");
      return;
    }

    registry.resetToPriors();
    double abrasion = config.enableTrackAbrasion()
        ? abrasionEstimator.estimate(prepared.laps())
        : TrackAbrasionEstimator.NEUTRAL;
    rateEstimator.refine(prepared.laps());
    Map<String, LatentPaceHistory> latent = paceFilter.run(prepared.laps(), abrasion);

    List<LapRecord> sessionLaps = driver == null
        ? laps
        : laps.stream().filter(lap -> driver.equals(lap.driver())).toList();
    session = new FittedSession(abrasion, FittedSession.indexByDriver(sessionLaps), latent);
    predictor.clearCache();
    metrics.increment("tyre.fit.completed");

    log.info("Fitted tyre model on {} laps across {} drivers; track abrasion {}",
        prepared.laps().size(), latent.size(), String.format("%.3f", abrasion));
    registry.asMap().forEach((name, profile) ->
        log.info("  {}: {} s/lap", name, String.format("%.4f", profile.degradationRate())));
  }

  /**
   * Predicts tyre health using the condition recorded on the driver's latest lap.
   *
   * @param driver driver identifier
   * @param lapNumber query lap
   * @return health, or empty when the driver has no lap at or before {@code lapNumber} or the compound is unknown
   * @throws ModelNotFittedException if no fit has completed
   */
  public Optional<TyreHealth> predict(String driver, int lapNumber) {
    return predict(driver, lapNumber, Optional.empty());
  }

  /**
   * Predicts tyre health for a driver at a lap.
   *
   * @param driver driver identifier; must not be {@code null}
   * @param lapNumber query lap
   * @param trackCondition explicit condition overriding the lap's own label
   * @return health, or empty when the driver has no lap at or before {@code lapNumber} or the compound is unknown
   * @throws ModelNotFittedException if no fit has completed
   */
  public Optional<TyreHealth> predict(String driver, int lapNumber, Optional<TrackCondition> trackCondition) {
    Objects.requireNonNull(driver, "driver");
    Objects.requireNonNull(trackCondition, "trackCondition");
    FittedSession current = session;
    if (current == null) {
      throw new ModelNotFittedException();
    }
    return predictor.predict(current, driver, lapNumber, trackCondition);
  }

  /** Drops every cached health result; call when playback restarts. */
  public void clearCache() {
    predictor.clearCache();
  }

  /** Returns {@code true} once a fit pass has completed. */
  public boolean isFitted() {
    return session != null;
  }

  /** Returns the abrasion factor of the last fit, or {@code 1.0} before any fit. */
  public double trackAbrasion() {
    FittedSession current = session;
    return current == null ? TrackAbrasionEstimator.NEUTRAL : current.trackAbrasion();
  }

  /** Returns compound profiles with their current (fitted or prior) rates; the map is unmodifiable. */
  public Map<String, TyreProfile> profiles() {
    return registry.asMap();
  }

  /**
   * Returns the latent pace history computed for a driver during the last fit.
   *
   * @param driver driver identifier
   * @return history, or empty before a fit or for drivers without prepared laps
   */
  public Optional<LatentPaceHistory> latentPaceHistory(String driver) {
    FittedSession current = session;
    return current == null ? Optional.empty() : Optional.ofNullable(current.latentPace().get(driver));
  }

  public ModelConfig config() {
    return config;
  }

  int cachedPredictions() {
    return predictor.cacheSize();
  }
}
