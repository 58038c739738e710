package io.pitwall.tyre.application.model;

import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.LapRecord;
import io.pitwall.tyre.domain.lap.PreparedLap;
import io.pitwall.tyre.domain.lap.PreparedLaps;
import io.pitwall.tyre.domain.lap.TrackCondition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Filters raw lap records and annotates them with lap seconds and fuel mass.
 * <p><strong>Why:</strong> Out-laps, untimed laps and laps without a compound carry no degradation signal; fuel mass must
 * be known before lap times can be corrected.</p>
 * <p><strong>Role:</strong> First stage of the fit pass.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration.</p>
 *
 * @since 0.1.0
 */
public final class LapDataPreparer {
  private static final Logger log = LoggerFactory.getLogger(LapDataPreparer.class);
  private static final Comparator<PreparedLap> DRIVER_THEN_LAP =
      Comparator.comparing(PreparedLap::driver).thenComparingInt(PreparedLap::lapNumber);

  private final ModelConfig config;

  public LapDataPreparer(ModelConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Prepares a lap table for fitting. The input list and its records are left untouched.
   *
   * @param records caller-owned lap records; must not be {@code null}
   * @param driver optional driver filter; {@code null} keeps every driver
   * @return prepared laps sorted by driver then lap number, with the count of condition fallbacks
   */
  public PreparedLaps prepare(List<LapRecord> records, String driver) {
    Objects.requireNonNull(records, "records");
    List<PreparedLap> prepared = new ArrayList<>(records.size());
    int normalized = 0;
    int dropped = 0;
    for (LapRecord record : records) {
      if (driver != null && !driver.equals(record.driver())) {
        continue;
      }
      if (record.lapNumber() <= 1 || record.lapTime() == null || record.compound() == null) {
        dropped++;
        continue;
      }
      TrackCondition.Resolution condition = TrackCondition.resolve(record.trackCondition());
      if (condition.fallback()) {
        normalized++;
      }
      prepared.add(new PreparedLap(
          record.driver(),
          record.lapNumber(),
          record.lapTime().toNanos() / 1_000_000_000.0,
          record.compound(),
          record.stint(),
          condition.condition(),
          config.fuelMassAt(record.lapNumber())));
    }
    prepared.sort(DRIVER_THEN_LAP);
    log.debug("Prepared {} laps ({} dropped, {} condition labels defaulted to DRY)",
        prepared.size(), dropped, normalized);
    return new PreparedLaps(prepared, normalized);
  }
}
