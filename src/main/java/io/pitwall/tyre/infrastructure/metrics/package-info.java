/**
 * OpenTelemetry-backed implementation of {@link io.pitwall.tyre.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.infrastructure.metrics;
