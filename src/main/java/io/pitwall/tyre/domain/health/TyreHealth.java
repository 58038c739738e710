package io.pitwall.tyre.domain.health;

import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.domain.tyre.TyreCategory;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Health summary for one driver at one lap, with the diagnostics behind the figure.
 * <p><strong>Why:</strong> The replay overlay shows the health bar and needs the compound and stint age to label it.</p>
 * <p><strong>Role:</strong> Domain value returned by the health predictor and cached per (driver, lap).</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param health remaining tyre life in {@code [0, 100]}
 * @param lapsOnTyre laps completed on the current stint up to the query lap
 * @param compound compound name as recorded on the lap
 * @param effectiveDegradation fitted rate multiplied by track abrasion, seconds per lap
 * @param mismatchPenalty penalty applied for the category/condition pair
 * @param trackCondition condition used for the penalty lookup
 * @param category compound family
 * @param trackAbrasion abrasion factor in force for the fitted session
 * @param projectedPace reset pace plus accumulated degradation, seconds
 * @since 0.1.0
 */
public record TyreHealth(
    int health,
    int lapsOnTyre,
    String compound,
    double effectiveDegradation,
    double mismatchPenalty,
    TrackCondition trackCondition,
    TyreCategory category,
    double trackAbrasion,
    double projectedPace) {

  private static final String NOT_AVAILABLE = "N/A";

  public TyreHealth {
    if (health < 0 || health > 100) {
      throw new IllegalArgumentException("health must be between 0 and 100 (was " + health + ")");
    }
    Objects.requireNonNull(compound, "compound");
    Objects.requireNonNull(trackCondition, "trackCondition");
    Objects.requireNonNull(category, "category");
  }

  /** Returns the display band for {@link #health()}. */
  public HealthBand band() {
    return HealthBand.of(health);
  }

  /** Renders the overlay label, e.g. {@code "MEDIUM (L6): 91%"}. */
  public String summary() {
    return compound + " (L" + lapsOnTyre + "): " + health + "%";
  }

  /**
   * Renders the overlay label for an optional result.
   *
   * @param health prediction outcome
   * @return summary text, or {@code "N/A"} when no prediction was available
   */
  public static String summaryOf(Optional<TyreHealth> health) {
    return health.map(TyreHealth::summary).orElse(NOT_AVAILABLE);
  }
}
