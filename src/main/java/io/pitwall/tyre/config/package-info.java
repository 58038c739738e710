/**
 * <strong>Purpose:</strong> Model configuration records and the YAML loader that feeds them.
 * <p><strong>Role:</strong> Adapter-side configuration; resolves circuit overrides before a model is built.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.</p>
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.config;
