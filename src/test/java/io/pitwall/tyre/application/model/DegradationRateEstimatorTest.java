package io.pitwall.tyre.application.model;

import static io.pitwall.tyre.testutil.LapFixtures.concat;
import static io.pitwall.tyre.testutil.LapFixtures.lap;
import static io.pitwall.tyre.testutil.LapFixtures.stint;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.pitwall.tyre.config.ModelConfig;
import io.pitwall.tyre.domain.lap.LapRecord;
import io.pitwall.tyre.domain.tyre.MismatchPenaltyTable;
import io.pitwall.tyre.domain.tyre.TyreProfileRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DegradationRateEstimatorTest {
  private final ModelConfig config = ModelConfig.defaults();

  @Test
  void softStintBlendsPriorWithObservedSlope() {
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = stint(config, "HAM", "SOFT", 1, 2, 6, 0.08);

    Map<String, Double> observed = refine(config, registry, laps);

    assertEquals(0.08, observed.get("SOFT"), 1e-6);
    double rate = registry.find("SOFT").orElseThrow().degradationRate();
    assertEquals(0.3 * 0.05 + 0.7 * 0.08, rate, 1e-6);
    assertTrue(rate > 0.05 && rate < 0.08);
  }

  @Test
  void medianAcrossStintsIsUsed() {
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = concat(
        stint(config, "HAM", "HARD", 1, 2, 12, 0.02),
        stint(config, "VER", "HARD", 1, 2, 12, 0.04),
        stint(config, "LEC", "HARD", 1, 2, 12, 0.09));

    refine(config, registry, laps);

    assertEquals(0.3 * 0.01 + 0.7 * 0.04, registry.find("HARD").orElseThrow().degradationRate(), 1e-6);
  }

  @Test
  void negativeSlopesAreDiscardedNotClamped() {
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = stint(config, "HAM", "SOFT", 1, 2, 8, -0.05);

    Map<String, Double> observed = refine(config, registry, laps);

    assertFalse(observed.containsKey("SOFT"));
    assertEquals(0.05, registry.find("SOFT").orElseThrow().degradationRate());
  }

  @Test
  void shortStintsKeepThePrior() {
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = concat(
        stint(config, "HAM", "SOFT", 1, 2, 4, 0.2),
        stint(config, "VER", "SOFT", 1, 2, 4, 0.2));

    refine(config, registry, laps);

    assertEquals(0.05, registry.find("SOFT").orElseThrow().degradationRate());
  }

  @Test
  void fiveLapStintUsesEveryLapOnTyre() {
    List<LapRecord> laps = stint(config, "HAM", "MEDIUM", 1, 2, 5, 0.06);

    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    Map<String, Double> observed = refine(config, registry, laps);

    assertEquals(0.06, observed.get("MEDIUM"), 1e-6);
    assertEquals(0.3 * 0.03 + 0.7 * 0.06, registry.find("MEDIUM").orElseThrow().degradationRate(), 1e-6);
  }

  @Test
  void warmupToggleDoesNotChangeFittedLaps() {
    List<LapRecord> laps = stint(config, "HAM", "HARD", 1, 2, 6, 0.04);
    ModelConfig noWarmup = new ModelConfig(0.3, 0.1, 0.032, 110.0, 1.6, false, true, false, 0.3,
        MismatchPenaltyTable.defaults());

    TyreProfileRegistry withWarmup = TyreProfileRegistry.defaults();
    TyreProfileRegistry withoutWarmup = TyreProfileRegistry.defaults();
    refine(config, withWarmup, laps);
    refine(noWarmup, withoutWarmup, laps);

    assertEquals(withoutWarmup.find("HARD").orElseThrow().degradationRate(),
        withWarmup.find("HARD").orElseThrow().degradationRate(), 1e-12);
  }

  @Test
  void longSoftStintKeepsLapsBeyondTenth() {
    List<LapRecord> laps = new ArrayList<>();
    for (int lapOnTyre = 1; lapOnTyre <= 16; lapOnTyre++) {
      int lapNumber = lapOnTyre + 1;
      double delta = lapOnTyre <= 10 ? 0.02 * (lapOnTyre - 1) : 0.18 + 0.3 * (lapOnTyre - 10);
      double seconds = 90.0 + config.fuelEffect() * config.fuelMassAt(lapNumber) + delta;
      laps.add(lap("HAM", lapNumber, seconds, "SOFT", 1));
    }
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();

    Map<String, Double> observed = refine(config, registry, laps);

    // Median of the 120 pairwise slopes: (0.104 + 0.10615...) / 2.
    double median = (0.104 + 0.69 / 6.5) / 2;
    assertEquals(median, observed.get("SOFT"), 1e-6);
    assertEquals(0.3 * 0.05 + 0.7 * median, registry.find("SOFT").orElseThrow().degradationRate(), 1e-6);
  }

  @Test
  void constantLapTimesAreSkipped() {
    ModelConfig noFuel = new ModelConfig(0.3, 0.1, 0.0, 110.0, 1.6, true, true, false, 0.3,
        MismatchPenaltyTable.defaults());
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = stint(noFuel, "HAM", "HARD", 1, 2, 10, 0.0);

    Map<String, Double> observed = refine(noFuel, registry, laps);

    assertTrue(observed.isEmpty());
    assertEquals(0.01, registry.find("HARD").orElseThrow().degradationRate());
  }

  @Test
  void unknownCompoundsContributeNothing() {
    TyreProfileRegistry registry = TyreProfileRegistry.defaults();
    List<LapRecord> laps = stint(config, "HAM", "HYPERSOFT", 1, 2, 10, 0.1);

    assertTrue(refine(config, registry, laps).isEmpty());
  }

  private static Map<String, Double> refine(ModelConfig config, TyreProfileRegistry registry, List<LapRecord> laps) {
    return new DegradationRateEstimator(config, registry)
        .refine(new LapDataPreparer(config).prepare(laps, null).laps());
  }
}
