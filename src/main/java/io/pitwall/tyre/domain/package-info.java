/**
 * Core domain model for the tyre degradation engine: lap inputs, compound profiles and health outputs.
 * <p><strong>Role:</strong> Domain layer values with no dependency on logging, metrics or configuration files.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package io.pitwall.tyre.domain;
