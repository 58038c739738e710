package io.pitwall.tyre.domain.lap;

import java.util.List;

/**
 * Output of lap preparation: the filtered, sorted laps plus how many condition labels fell back to
 * {@link TrackCondition#DRY}.
 *
 * @param laps prepared laps sorted by driver then lap number; immutable
 * @param normalizedConditions number of kept laps whose condition label was blank or unrecognised
 * @since 0.1.0
 */
public record PreparedLaps(List<PreparedLap> laps, int normalizedConditions) {

  public PreparedLaps {
    laps = List.copyOf(laps);
  }

  /** Returns {@code true} when no lap survived preparation. */
  public boolean isEmpty() {
    return laps.isEmpty();
  }
}
