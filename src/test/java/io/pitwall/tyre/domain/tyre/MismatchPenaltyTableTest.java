package io.pitwall.tyre.domain.tyre;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.pitwall.tyre.domain.lap.TrackCondition;
import org.junit.jupiter.api.Test;

class MismatchPenaltyTableTest {
  private final MismatchPenaltyTable table = MismatchPenaltyTable.defaults();

  @Test
  void matchedPairsCarryNoPenalty() {
    assertEquals(0.0, table.penalty(TyreCategory.SLICK, TrackCondition.DRY));
    assertEquals(0.0, table.penalty(TyreCategory.INTER, TrackCondition.DAMP));
    assertEquals(0.0, table.penalty(TyreCategory.WET, TrackCondition.WET));
  }

  @Test
  void slickOnWetIsTheMaximumPenalty() {
    assertEquals(8.0, table.penalty(TyreCategory.SLICK, TrackCondition.WET));
    double max = table.asMap().values().stream()
        .flatMap(row -> row.values().stream())
        .mapToDouble(Double::doubleValue)
        .max()
        .orElseThrow();
    assertEquals(8.0, max);
  }

  @Test
  void defaultTableCoversAllNinePairs() {
    assertEquals(2.0, table.penalty(TyreCategory.SLICK, TrackCondition.DAMP));
    assertEquals(1.5, table.penalty(TyreCategory.INTER, TrackCondition.DRY));
    assertEquals(0.5, table.penalty(TyreCategory.INTER, TrackCondition.WET));
    assertEquals(4.0, table.penalty(TyreCategory.WET, TrackCondition.DRY));
    assertEquals(1.0, table.penalty(TyreCategory.WET, TrackCondition.DAMP));
  }

  @Test
  void withReplacesSingleEntryWithoutTouchingDefaults() {
    MismatchPenaltyTable custom = table.with(TyreCategory.SLICK, TrackCondition.WET, 6.0);

    assertEquals(6.0, custom.penalty(TyreCategory.SLICK, TrackCondition.WET));
    assertEquals(8.0, MismatchPenaltyTable.defaults().penalty(TyreCategory.SLICK, TrackCondition.WET));
    assertEquals(2.0, custom.penalty(TyreCategory.SLICK, TrackCondition.DAMP));
  }

  @Test
  void negativePenaltyRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> table.with(TyreCategory.WET, TrackCondition.DRY, -1.0));
  }
}
