/**
 * Compound profiles, categories and the track-condition mismatch table.
 * <p><strong>Concurrency:</strong> Profiles carry one mutable field (the fitted degradation rate), written only during
 * an exclusive fit pass; everything else is immutable.</p>
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.domain.tyre;
