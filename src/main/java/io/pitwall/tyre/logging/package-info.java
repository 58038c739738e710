/**
 * Logging helpers for the tyre model; SLF4J API with a Logback backend.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.logging;
