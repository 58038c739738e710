package io.pitwall.tyre.domain.health;

/**
 * <strong>What:</strong> Coarse health buckets with the colour the replay overlay paints for each.
 * <p><strong>Role:</strong> Presentation hint attached to every {@link TyreHealth}; the model never renders.</p>
 *
 * @since 0.1.0
 */
public enum HealthBand {
  GOOD(75, 0, 220, 0),
  FAIR(50, 200, 220, 0),
  WORN(25, 220, 180, 0),
  CRITICAL(0, 220, 50, 0);

  private final int threshold;
  private final int red;
  private final int green;
  private final int blue;

  HealthBand(int threshold, int red, int green, int blue) {
    this.threshold = threshold;
    this.red = red;
    this.green = green;
    this.blue = blue;
  }

  /**
   * Maps a health figure to its band; values outside {@code [0, 100]} are clamped first.
   *
   * @param health health percentage
   * @return matching band
   */
  public static HealthBand of(int health) {
    int clamped = Math.max(0, Math.min(100, health));
    for (HealthBand band : values()) {
      if (clamped >= band.threshold) {
        return band;
      }
    }
    return CRITICAL;
  }

  /** Lowest health (inclusive) that falls in this band. */
  public int threshold() {
    return threshold;
  }

  /** Display colour packed as {@code 0xRRGGBB}. */
  public int rgb() {
    return (red << 16) | (green << 8) | blue;
  }
}
