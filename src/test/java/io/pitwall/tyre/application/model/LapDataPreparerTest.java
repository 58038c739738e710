package io.pitwall.tyre.application.model;

import static io.pitwall.tyre.testutil.LapFixtures.lap;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.LapRecord;
import io.pitwall.tyre.domain.lap.PreparedLap;
import io.pitwall.tyre.domain.lap.PreparedLaps;
import io.pitwall.tyre.domain.lap.TrackCondition;
import io.pitwall.tyre.testutil.LapFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LapDataPreparerTest {
  private final LapDataPreparer preparer = new LapDataPreparer(ModelConfig.defaults());

  @Test
  void dropsWarmupUntimedAndCompoundlessLaps() {
    List<LapRecord> records = List.of(
        lap("HAM", 1, 95.0, "SOFT", 1),
        new LapRecord("HAM", 2, null, "SOFT", 1),
        new LapRecord("HAM", 3, LapFixtures.seconds(91.0), null, 1),
        lap("HAM", 4, 90.5, "SOFT", 1));

    PreparedLaps prepared = preparer.prepare(records, null);

    assertEquals(1, prepared.laps().size());
    assertEquals(4, prepared.laps().get(0).lapNumber());
  }

  @Test
  void computesLapSecondsAndFuelMass() {
    PreparedLap prepared = preparer.prepare(List.of(lap("HAM", 11, 90.25, "SOFT", 1)), null).laps().get(0);

    assertEquals(90.25, prepared.lapSeconds(), 1e-9);
    assertEquals(110.0 - 10 * 1.6, prepared.fuelMass(), 1e-9);
    assertEquals(90.25 - 0.032 * 94.0, prepared.fuelCorrectedSeconds(0.032), 1e-9);
  }

  @Test
  void fuelMassFlooredAtZero() {
    PreparedLap prepared = preparer.prepare(List.of(lap("HAM", 90, 88.0, "HARD", 3)), null).laps().get(0);

    assertEquals(0.0, prepared.fuelMass());
  }

  @Test
  void normalizesUnknownConditionsAndCountsThem() {
    List<LapRecord> records = List.of(
        lap("HAM", 2, 90.0, "SOFT", 1, "WET"),
        lap("HAM", 3, 90.0, "SOFT", 1, "MUDDY"),
        lap("HAM", 4, 90.0, "SOFT", 1, null));

    PreparedLaps prepared = preparer.prepare(records, null);

    assertEquals(2, prepared.normalizedConditions());
    assertEquals(TrackCondition.WET, prepared.laps().get(0).condition());
    assertEquals(TrackCondition.DRY, prepared.laps().get(1).condition());
    assertEquals(TrackCondition.DRY, prepared.laps().get(2).condition());
  }

  @Test
  void sortsByDriverThenLapAndAppliesDriverFilter() {
    List<LapRecord> records = List.of(
        lap("VER", 3, 90.0, "SOFT", 1),
        lap("HAM", 5, 90.0, "SOFT", 1),
        lap("HAM", 2, 90.0, "SOFT", 1),
        lap("VER", 2, 90.0, "SOFT", 1));

    List<PreparedLap> all = preparer.prepare(records, null).laps();
    List<PreparedLap> onlyVer = preparer.prepare(records, "VER").laps();

    assertEquals(List.of("HAM", "HAM", "VER", "VER"), all.stream().map(PreparedLap::driver).toList());
    assertEquals(List.of(2, 5, 2, 3), all.stream().map(PreparedLap::lapNumber).toList());
    assertEquals(2, onlyVer.size());
    assertTrue(onlyVer.stream().allMatch(l -> l.driver().equals("VER")));
  }

  @Test
  void leavesInputUntouched() {
    List<LapRecord> records = new ArrayList<>(List.of(lap("VER", 3, 90.0, "SOFT", 1), lap("VER", 1, 99.0, "SOFT", 1)));
    List<LapRecord> snapshot = List.copyOf(records);

    preparer.prepare(records, null);

    assertEquals(snapshot, records);
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertTrue(preparer.prepare(List.of(), null).isEmpty());
  }
}
