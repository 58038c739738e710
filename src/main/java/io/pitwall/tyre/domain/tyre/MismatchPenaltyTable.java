package io.pitwall.tyre.domain.tyre;

import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.validation.Numbers;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Extra-wear penalties for running a compound family on an unsuited surface.
 * <p><strong>Why:</strong> A slick on a wet track or a full wet on a dry one wears far faster than its dry-weather
 * profile suggests; the health scorer scales effective laps by this penalty.</p>
 * <p><strong>Role:</strong> Immutable value held by {@code ModelConfig}; built once, never recomputed per lookup.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 */
public final class MismatchPenaltyTable {
  private static final MismatchPenaltyTable DEFAULTS = new MismatchPenaltyTable(defaultEntries());

  private final Map<TyreCategory, Map<TrackCondition, Double>> penalties;

  private MismatchPenaltyTable(Map<TyreCategory, Map<TrackCondition, Double>> source) {
    Map<TyreCategory, Map<TrackCondition, Double>> copy = new EnumMap<>(TyreCategory.class);
    for (TyreCategory category : TyreCategory.values()) {
      Map<TrackCondition, Double> row = new EnumMap<>(TrackCondition.class);
      Map<TrackCondition, Double> sourceRow = source.getOrDefault(category, Map.of());
      for (TrackCondition condition : TrackCondition.values()) {
        double value = sourceRow.getOrDefault(condition, 0.0);
        row.put(condition, Numbers.requireNonNegative(
            "mismatchPenalties." + category + "." + condition, value));
      }
      copy.put(category, Collections.unmodifiableMap(row));
    }
    this.penalties = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns the default nine-entry table; matched pairs are {@code 0.0} and SLICK on WET is the maximum {@code 8.0}.
   *
   * @return shared default table
   */
  public static MismatchPenaltyTable defaults() {
    return DEFAULTS;
  }

  /**
   * Returns the penalty for a category/condition pair.
   *
   * @param category compound family; must not be {@code null}
   * @param condition track condition; must not be {@code null}
   * @return non-negative penalty
   */
  public double penalty(TyreCategory category, TrackCondition condition) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(condition, "condition");
    return penalties.get(category).get(condition);
  }

  /**
   * Returns a copy of this table with one entry replaced.
   *
   * @param category compound family
   * @param condition track condition
   * @param penalty replacement penalty; must be non-negative
   * @return new table
   * @throws IllegalArgumentException if {@code penalty} is negative
   */
  public MismatchPenaltyTable with(TyreCategory category, TrackCondition condition, double penalty) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(condition, "condition");
    Map<TyreCategory, Map<TrackCondition, Double>> next = new EnumMap<>(TyreCategory.class);
    penalties.forEach((cat, row) -> next.put(cat, new EnumMap<>(row)));
    next.get(category).put(condition, penalty);
    return new MismatchPenaltyTable(next);
  }

  /** Returns the full table; unmodifiable. */
  public Map<TyreCategory, Map<TrackCondition, Double>> asMap() {
    return penalties;
  }

  private static Map<TyreCategory, Map<TrackCondition, Double>> defaultEntries() {
    Map<TyreCategory, Map<TrackCondition, Double>> entries = new EnumMap<>(TyreCategory.class);
    entries.put(TyreCategory.SLICK, Map.of(
        TrackCondition.DRY, 0.0, TrackCondition.DAMP, 2.0, TrackCondition.WET, 8.0));
    entries.put(TyreCategory.INTER, Map.of(
        TrackCondition.DRY, 1.5, TrackCondition.DAMP, 0.0, TrackCondition.WET, 0.5));
    entries.put(TyreCategory.WET, Map.of(
        TrackCondition.DRY, 4.0, TrackCondition.DAMP, 1.0, TrackCondition.WET, 0.0));
    return entries;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MismatchPenaltyTable table && penalties.equals(table.penalties);
  }

  @Override
  public int hashCode() {
    return penalties.hashCode();
  }

  @Override
  public String toString() {
    return "MismatchPenaltyTable" + penalties;
  }
}
