/**
 * <strong>Purpose:</strong> The tyre degradation model: lap preparation, track abrasion, degradation-rate refinement,
 * latent pace filtering and health scoring.
 * <p><strong>Pipeline role:</strong> {@code fit} runs the stages once per session; {@code predict} answers repeated
 * queries from the fitted snapshot.</p>
 * <p><strong>Concurrency:</strong> Fit requires exclusive access; queries are safe to run concurrently afterwards.</p>
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.application.model;
