package io.pitwall.tyre.application.model;

import io.pitwall.tyre.domain.lap.PreparedLap;
import io.pitwall.tyre.domain.tyre.TyreProfile;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One driver's laps on one stint of one compound, with fuel-corrected deltas from the stint's first lap.
 *
 * <p>Lap-on-tyre is 1-based and counts laps in the prepared table, so warm-up laps removed by preparation are
 * not counted.</p>
 */
final class StintSeries {
  private final TyreProfile profile;
  private final String driver;
  private final int stint;
  private final List<PreparedLap> laps;

  private StintSeries(TyreProfile profile, String driver, int stint, List<PreparedLap> laps) {
    this.profile = profile;
    this.driver = driver;
    this.stint = stint;
    this.laps = List.copyOf(laps);
  }

  /**
   * Splits prepared laps into per-compound, per-driver, per-stint series. Laps on compounds missing from the
   * registry are dropped.
   *
   * @param laps prepared laps sorted by driver then lap number
   * @param registry compound registry
   * @return series grouped by upper-case compound name, in registry order
   */
  static Map<String, List<StintSeries>> group(List<PreparedLap> laps, TyreProfileRegistry registry) {
    Map<String, Map<String, Map<Integer, List<PreparedLap>>>> nested = new LinkedHashMap<>();
    for (String compound : registry.asMap().keySet()) {
      nested.put(compound, new LinkedHashMap<>());
    }
    for (PreparedLap lap : laps) {
      registry.find(lap.compound()).ifPresent(profile -> nested
          .get(profile.name().trim().toUpperCase(Locale.ROOT))
          .computeIfAbsent(lap.driver(), d -> new LinkedHashMap<>())
          .computeIfAbsent(lap.stint(), s -> new ArrayList<>())
          .add(lap));
    }
    Map<String, List<StintSeries>> grouped = new LinkedHashMap<>();
    nested.forEach((compound, byDriver) -> {
      TyreProfile profile = registry.asMap().get(compound);
      List<StintSeries> series = new ArrayList<>();
      byDriver.forEach((driver, byStint) ->
          byStint.forEach((stint, stintLaps) -> series.add(new StintSeries(profile, driver, stint, stintLaps))));
      grouped.put(compound, series);
    });
    return grouped;
  }

  TyreProfile profile() {
    return profile;
  }

  String driver() {
    return driver;
  }

  int stint() {
    return stint;
  }

  int size() {
    return laps.size();
  }

  /** Returns 1-based lap-on-tyre indices. */
  double[] lapsOnTyre() {
    double[] x = new double[laps.size()];
    for (int i = 0; i < x.length; i++) {
      x[i] = i + 1;
    }
    return x;
  }

  /** Returns fuel-corrected lap time minus the fuel-corrected time of the stint's first lap. */
  double[] deltasFromFirst(double fuelEffect) {
    double[] deltas = new double[laps.size()];
    if (deltas.length == 0) {
      return deltas;
    }
    double first = laps.get(0).fuelCorrectedSeconds(fuelEffect);
    for (int i = 0; i < deltas.length; i++) {
      deltas[i] = laps.get(i).fuelCorrectedSeconds(fuelEffect) - first;
    }
    return deltas;
  }
}
