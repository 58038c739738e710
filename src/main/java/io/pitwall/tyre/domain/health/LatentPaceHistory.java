package io.pitwall.tyre.domain.health;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable per-driver sequence of latent pace estimates, indexed by processing order.
 * <p><strong>Why:</strong> Kept for diagnostics; health scoring uses the closed-form profile estimate instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable snapshot published once the fit pass completes.</p>
 *
 * @param driver driver identifier
 * @param estimates estimates in lap order; one per processed lap with a known compound
 * @since 0.1.0
 */
public record LatentPaceHistory(String driver, List<LatentPaceEstimate> estimates) {

  public LatentPaceHistory {
    Objects.requireNonNull(driver, "driver");
    estimates = List.copyOf(estimates);
  }

  /** Returns the number of processed laps. */
  public int size() {
    return estimates.size();
  }

  /** Returns the estimate at a processing index. */
  public LatentPaceEstimate get(int index) {
    return estimates.get(index);
  }

  /** Returns the estimate produced by the given lap, if that lap was processed. */
  public Optional<LatentPaceEstimate> atLap(int lapNumber) {
    return estimates.stream().filter(e -> e.lapNumber() == lapNumber).findFirst();
  }

  /** Returns the last estimate, if any lap was processed. */
  public Optional<LatentPaceEstimate> latest() {
    return estimates.isEmpty() ? Optional.empty() : Optional.of(estimates.get(estimates.size() - 1));
  }
}
