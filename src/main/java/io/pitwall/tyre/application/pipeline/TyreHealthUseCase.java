package io.pitwall.tyre.application.pipeline;

import io.pitwall.tyre.application.model.TyreDegradationModel;
import io.pitwall.tyre.application.port.MetricsPort;
import io.pitwall.tyre.domain.health.TyreHealth;
import io.pitwall.tyre.domain.lap.LapRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Connects a session's lap table to the degradation model for a replay consumer.
 * <p><strong>Why:</strong> A long-running viewer must never crash on odd session data; this use case fits once, reports
 * failure as {@code false}, and answers per-frame health lookups with an empty result when it cannot help.</p>
 * <p><strong>Role:</strong> Application-layer use case sitting between the session collaborator and the model.</p>
 * <p><strong>Thread-safety:</strong> {@link #initialize(List)} must complete before {@link #healthFor(String, int)} is
 * called from other threads.</p>
 * <p><strong>Observability:</strong> Logs the lap count and fitted rates at INFO; counts
 * {@code tyre.session.initialized} and {@code tyre.session.failed}.</p>
 *
 * @since 0.1.0
 */
public final class TyreHealthUseCase {
  private static final Logger log = LoggerFactory.getLogger(TyreHealthUseCase.class);

  private final TyreDegradationModel model;
  private final MetricsPort metrics;
  private volatile boolean initialized;

  public TyreHealthUseCase(TyreDegradationModel model, MetricsPort metrics) {
    this.model = Objects.requireNonNull(model, "model");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Fits the model on a session's laps.
   *
   * @param laps session lap table; {@code null} or empty reports failure
   * @return {@code true} when the model is ready for queries
   */
  public boolean initialize(List<LapRecord> laps) {
    if (laps == null || laps.isEmpty()) {
      log.warn("Tyre model not initialized: empty lap table");
      metrics.increment("tyre.session.failed");
      return false;
    }
    log.info("Fitting tyre model on {} laps", laps.size());
    try {
      model.fit(laps);
    } catch (RuntimeException ex) {
      log.error("Tyre model initialization failed", ex);
      metrics.increment("tyre.session.failed");
      return false;
    }
    if (!model.isFitted()) {
      log.warn("Tyre model not initialized: no usable laps among {} records", laps.size());
      metrics.increment("tyre.session.failed");
      return false;
    }
    initialized = true;
    metrics.increment("tyre.session.initialized");
    return true;
  }

  /**
   * Returns tyre health for a driver at the replay's current lap.
   *
   * @param driver driver identifier; {@code null} yields empty
   * @param lapNumber current lap of that driver
   * @return health, or empty before initialization or when no prediction is available
   */
  public Optional<TyreHealth> healthFor(String driver, int lapNumber) {
    if (!initialized || driver == null) {
      return Optional.empty();
    }
    return model.predict(driver, lapNumber);
  }

  /**
   * Returns the overlay label for a driver, {@code "N/A"} when no health is available.
   *
   * @param driver driver identifier
   * @param lapNumber current lap of that driver
   * @return label such as {@code "SOFT (L4): 88%"}
   */
  public String labelFor(String driver, int lapNumber) {
    return TyreHealth.summaryOf(healthFor(driver, lapNumber));
  }

  /** Drops cached health results; call when playback is rewound. */
  public void clearCache() {
    model.clearCache();
  }

  public boolean isInitialized() {
    return initialized;
  }
}
