package io.pitwall.tyre.domain.lap;

/**
 * <strong>What:</strong> Lap augmented with resolved condition, lap seconds and remaining fuel mass.
 * <p><strong>Role:</strong> Working value created by the lap preparer; only lives for the duration of a fit.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param driver driver identifier
 * @param lapNumber 1-based lap number
 * @param lapSeconds lap time in seconds
 * @param compound compound name as recorded (not case-normalised)
 * @param stint stint identifier
 * @param condition resolved track condition
 * @param fuelMass estimated fuel mass on board at this lap in kilograms; never negative
 * @since 0.1.0
 */
public record PreparedLap(
    String driver,
    int lapNumber,
    double lapSeconds,
    String compound,
    int stint,
    TrackCondition condition,
    double fuelMass) {

  /**
   * Returns the lap time with the fuel-load contribution removed.
   *
   * @param fuelEffect seconds lost per kilogram of fuel
   * @return fuel-corrected lap seconds
   */
  public double fuelCorrectedSeconds(double fuelEffect) {
    return lapSeconds - fuelEffect * fuelMass;
  }
}
