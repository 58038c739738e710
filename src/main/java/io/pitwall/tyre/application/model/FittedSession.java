package io.pitwall.tyre.application.model;

import io.pitwall.tyre.domain.health.LatentPaceHistory;
import io.pitwall.tyre.domain.lap.LapRecord;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable result of one fit pass, published to query threads in a single volatile write.
 *
 * @param trackAbrasion abrasion factor in force
 * @param lapsByDriver session laps per driver sorted by lap number; the table health queries are answered from
 * @param latentPace Kalman histories per driver
 */
record FittedSession(
    double trackAbrasion,
    Map<String, List<LapRecord>> lapsByDriver,
    Map<String, LatentPaceHistory> latentPace) {

  FittedSession {
    lapsByDriver = Map.copyOf(lapsByDriver);
    latentPace = Map.copyOf(latentPace);
  }

  static Map<String, List<LapRecord>> indexByDriver(List<LapRecord> records) {
    Map<String, List<LapRecord>> grouped = records.stream()
        .collect(Collectors.groupingBy(LapRecord::driver, LinkedHashMap::new, Collectors.toList()));
    grouped.replaceAll((driver, laps) -> laps.stream()
        .sorted(Comparator.comparingInt(LapRecord::lapNumber))
        .toList());
    return grouped;
  }
}
