/**
 * Application layer for the tyre degradation engine.
 * <p><strong>Role:</strong> Hosts the model facade, its estimators, the metrics port and the session use case.</p>
 * <p><strong>Concurrency:</strong> Fit passes run on one thread; health queries may run concurrently afterwards.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code tyre.fit.*}, {@code tyre.predict.*} and {@code tyre.session.*}.</p>
 */
package io.pitwall.tyre.application;
