/**
 * Health summaries and latent pace diagnostics produced by the degradation model.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.domain.health;
