package io.pitwall.tyre.domain.tyre;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Registry of compound profiles keyed by upper-case compound name.
 * <p><strong>Why:</strong> Gives the estimators one place to resolve a lap's compound and to write fitted rates.</p>
 * <p><strong>Role:</strong> Domain aggregate owned by the degradation model; exposed read-only to callers.</p>
 * <p><strong>Thread-safety:</strong> The compound set is fixed at construction; see {@link TyreProfile} for rate
 * visibility.</p>
 *
 * @since 0.1.0
 */
public final class TyreProfileRegistry {
  private final Map<String, TyreProfile> profiles;

  /**
   * Creates a registry over the supplied profiles, preserving iteration order.
   *
   * @param profiles profiles to register; names must be unique ignoring case
   * @throws IllegalArgumentException on duplicate compound names
   */
  public TyreProfileRegistry(Collection<TyreProfile> profiles) {
    Objects.requireNonNull(profiles, "profiles");
    Map<String, TyreProfile> byName = new LinkedHashMap<>();
    for (TyreProfile profile : profiles) {
      String key = normalize(profile.name());
      if (byName.putIfAbsent(key, profile) != null) {
        throw new IllegalArgumentException("Duplicate tyre profile: " + profile.name());
      }
    }
    this.profiles = Collections.unmodifiableMap(byName);
  }

  /**
   * Builds the registry of hard-coded priors for the five current compounds.
   *
   * @return fresh registry; each call returns independent profile instances
   */
  public static TyreProfileRegistry defaults() {
    return new TyreProfileRegistry(List.of(
        new TyreProfile("HARD", TyreCategory.SLICK, 0.01, 69.5, 3, null, 2.0),
        new TyreProfile("MEDIUM", TyreCategory.SLICK, 0.03, 69.0, 3, null, 2.0),
        new TyreProfile("SOFT", TyreCategory.SLICK, 0.05, 68.5, 1, 10, 2.0),
        new TyreProfile("INTERMEDIATE", TyreCategory.INTER, 0.04, 75.0, 2, null, 3.0),
        new TyreProfile("WET", TyreCategory.WET, 0.02, 80.0, 2, null, 2.5)));
  }

  /**
   * Looks up a compound ignoring case and surrounding whitespace.
   *
   * @param compound compound name; may be {@code null}
   * @return matching profile, or empty for unknown or missing compounds
   */
  public Optional<TyreProfile> find(String compound) {
    if (compound == null || compound.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(profiles.get(normalize(compound)));
  }

  /** Returns the registered profiles keyed by upper-case compound name; unmodifiable. */
  public Map<String, TyreProfile> asMap() {
    return profiles;
  }

  /** Restores every profile's degradation rate to its prior. */
  public void resetToPriors() {
    profiles.values().forEach(TyreProfile::resetToPrior);
  }

  private static String normalize(String compound) {
    return compound.trim().toUpperCase(Locale.ROOT);
  }
}
