package io.pitwall.tyre.domain.health;

/**
 * Filter belief about a driver's fuel-free tyre pace after processing one lap.
 *
 * @param lapNumber lap that produced this estimate
 * @param stint stint the lap belongs to
 * @param compound compound fitted on that stint
 * @param mean posterior mean pace in seconds
 * @param variance posterior variance in seconds squared
 * @since 0.1.0
 */
public record LatentPaceEstimate(int lapNumber, int stint, String compound, double mean, double variance) {}
