package io.pitwall.tyre.domain.tyre;

import java.util.Locale;

/**
 * Construction family of a compound, used to look up track-condition mismatch penalties.
 *
 * @since 0.1.0
 */
public enum TyreCategory {
  /** Dry-weather slick (HARD, MEDIUM, SOFT). */
  SLICK,
  /** Intermediate. */
  INTER,
  /** Full wet. */
  WET;

  /**
   * Parses a category name, accepting {@code INTERMEDIATE} as an alias of {@link #INTER}.
   *
   * @param value textual category
   * @return parsed category
   * @throws IllegalArgumentException if the value is blank or unknown
   */
  public static TyreCategory fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("tyre category must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("INTERMEDIATE")) {
      return INTER;
    }
    try {
      return TyreCategory.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown tyre category: " + value, ex);
    }
  }
}
