package io.pitwall.tyre.config;

import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.domain.tyre.MismatchPenaltyTable;
import io.pitwall.tyre.domain.tyre.TyreCategory;
import io.pitwall.tyre.validation.Numbers;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable tuning knobs for the tyre degradation model.
 * <p><strong>Why:</strong> Keeps noise terms, fuel assumptions and mismatch penalties reproducible across sessions and
 * lets circuits override them from YAML without code changes.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code TyreDegradationModel}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 * <p><strong>Observability:</strong> {@link #debugLogging()} raises the {@code io.pitwall.tyre} logger to DEBUG when
 * the model is built.</p>
 *
 * @param observationNoise lap-timing noise standard deviation σ<sub>ε</sub> in seconds; must be positive
 * @param processNoise latent pace drift standard deviation σ<sub>η</sub> in seconds; must be non-negative
 * @param fuelEffect seconds lost per kilogram of fuel on board
 * @param startingFuel fuel mass at lap one in kilograms
 * @param fuelBurnRate fuel burned per lap in kilograms
 * @param enableWarmup warm-up modelling flag; carried in configuration only, degradation regression always fits every
 *     lap of a qualifying stint
 * @param enableTrackAbrasion whether to estimate a track abrasion factor; {@code false} pins it to {@code 1.0}
 * @param debugLogging whether to raise the {@code io.pitwall.tyre} logger to DEBUG
 * @param priorWeight weight kept on the prior rate when blending with the observed median, in {@code [0, 1]}
 * @param mismatchPenalties category/condition penalty table
 * @since 0.1.0
 */
public record ModelConfig(
    double observationNoise,
    double processNoise,
    double fuelEffect,
    double startingFuel,
    double fuelBurnRate,
    boolean enableWarmup,
    boolean enableTrackAbrasion,
    boolean debugLogging,
    double priorWeight,
    MismatchPenaltyTable mismatchPenalties) {

  private static final String PENALTY_PREFIX = "mismatchPenalties.";

  public ModelConfig {
    Numbers.requireRange("observationNoise", observationNoise, Double.MIN_VALUE, Double.MAX_VALUE);
    Numbers.requireNonNegative("processNoise", processNoise);
    Numbers.requireNonNegative("fuelEffect", fuelEffect);
    Numbers.requireNonNegative("startingFuel", startingFuel);
    Numbers.requireNonNegative("fuelBurnRate", fuelBurnRate);
    Numbers.requireRange("priorWeight", priorWeight, 0.0, 1.0);
    Objects.requireNonNull(mismatchPenalties, "mismatchPenalties");
  }

  /**
   * Provides the default tuning used when no configuration is supplied.
   *
   * @return default configuration record
   */
  public static ModelConfig defaults() {
    return new ModelConfig(0.3, 0.1, 0.032, 110.0, 1.6, true, true, false, 0.3,
        MismatchPenaltyTable.defaults());
  }

  /**
   * Builds a configuration from flat key/value pairs, filling absent keys from {@link #defaults()}.
   *
   * <p>Penalty overrides use {@code mismatchPenalties.<CATEGORY>.<CONDITION>} keys, for example
   * {@code mismatchPenalties.SLICK.WET=6.5}.</p>
   *
   * @param values flat configuration map, typically from {@link YamlConfigLoader}; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or violates a bound
   */
  public static ModelConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ModelConfig base = defaults();
    MismatchPenaltyTable penalties = base.mismatchPenalties();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey().startsWith(PENALTY_PREFIX)) {
        penalties = applyPenalty(penalties, entry.getKey(), entry.getValue());
      }
    }
    return new ModelConfig(
        doubleValue(values, "observationNoise", base.observationNoise()),
        doubleValue(values, "processNoise", base.processNoise()),
        doubleValue(values, "fuelEffect", base.fuelEffect()),
        doubleValue(values, "startingFuel", base.startingFuel()),
        doubleValue(values, "fuelBurnRate", base.fuelBurnRate()),
        booleanValue(values, "enableWarmup", base.enableWarmup()),
        booleanValue(values, "enableTrackAbrasion", base.enableTrackAbrasion()),
        booleanValue(values, "debugLogging", base.debugLogging()),
        doubleValue(values, "priorWeight", base.priorWeight()),
        penalties);
  }

  /**
   * Returns the fuel mass on board at a lap, decaying linearly from {@link #startingFuel()} and floored at zero.
   *
   * @param lapNumber 1-based lap number
   * @return fuel mass in kilograms
   */
  public double fuelMassAt(int lapNumber) {
    return Math.max(0.0, startingFuel - (lapNumber - 1) * fuelBurnRate);
  }

  private static MismatchPenaltyTable applyPenalty(MismatchPenaltyTable table, String key, String raw) {
    String[] parts = key.substring(PENALTY_PREFIX.length()).split("\\.");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Penalty key must be " + PENALTY_PREFIX + "<CATEGORY>.<CONDITION>: " + key);
    }
    TyreCategory category = TyreCategory.fromString(parts[0]);
    TrackCondition condition;
    try {
      condition = TrackCondition.valueOf(parts[1].trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown track condition in key " + key, ex);
    }
    return table.with(category, condition, parseDouble(key, raw));
  }

  private static double doubleValue(Map<String, String> values, String key, double fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return parseDouble(key, raw);
  }

  private static double parseDouble(String key, String raw) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be numeric (was '" + raw + "')", ex);
    }
  }

  private static boolean booleanValue(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was '" + raw + "')");
    };
  }
}
