package io.pitwall.tyre.domain.lap;

/**
 * <strong>What:</strong> Track wetness states recognised by the degradation model.
 * <p><strong>Why:</strong> Mismatch penalties are keyed by condition, so free-text labels from timing feeds
 * must collapse onto a closed set.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum TrackCondition {
  /** Dry surface. */
  DRY,
  /** Drying or lightly wet surface. */
  DAMP,
  /** Standing water. */
  WET;

  /**
   * Resolves a timing-feed label, falling back to {@link #DRY} for anything other than an exact {@code DRY},
   * {@code DAMP} or {@code WET}. Matching is case-sensitive; {@code "wet"} resolves to {@link #DRY}.
   *
   * @param label raw label; may be {@code null}
   * @return resolution carrying the condition and whether the fallback was applied
   */
  public static Resolution resolve(String label) {
    if (label == null) {
      return new Resolution(DRY, true);
    }
    for (TrackCondition condition : values()) {
      if (condition.name().equals(label)) {
        return new Resolution(condition, false);
      }
    }
    return new Resolution(DRY, true);
  }

  /**
   * Outcome of resolving a condition label.
   *
   * @param condition resolved condition; never {@code null}
   * @param fallback {@code true} when the label was blank or unrecognised and {@link #DRY} was substituted
   */
  public record Resolution(TrackCondition condition, boolean fallback) {}
}
