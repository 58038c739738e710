/**
 * Ports the tyre model depends on; implemented by infrastructure adapters.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.application.port;
