package io.pitwall.tyre.domain.lap;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> One timed lap for one driver, as supplied by the session/telemetry collaborator.
 * <p><strong>Why:</strong> The degradation model is fed an already-assembled lap table and never owns how it was
 * obtained.</p>
 * <p><strong>Role:</strong> Domain input value consumed by {@code TyreDegradationModel#fit}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param driver driver identifier (e.g., {@code "VER"}); never {@code null}
 * @param lapNumber 1-based lap number
 * @param lapTime lap duration or {@code null} when the lap was not timed
 * @param compound compound name (e.g., {@code "MEDIUM"}) or {@code null} when unknown
 * @param stint stint identifier; increments on every tyre change
 * @param trackCondition raw condition label ({@code DRY}/{@code DAMP}/{@code WET}) or {@code null}
 * @since 0.1.0
 */
public record LapRecord(
    String driver,
    int lapNumber,
    Duration lapTime,
    String compound,
    int stint,
    String trackCondition) {

  public LapRecord {
    Objects.requireNonNull(driver, "driver");
  }

  /**
   * Creates a lap record without a track condition label.
   *
   * @param driver driver identifier
   * @param lapNumber 1-based lap number
   * @param lapTime lap duration; may be {@code null}
   * @param compound compound name; may be {@code null}
   * @param stint stint identifier
   */
  public LapRecord(String driver, int lapNumber, Duration lapTime, String compound, int stint) {
    this(driver, lapNumber, lapTime, compound, stint, null);
  }
}
