/**
 * Use cases wiring session data into the tyre model for replay consumers.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.application.pipeline;
