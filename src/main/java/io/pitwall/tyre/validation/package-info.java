/**
 * <strong>Purpose:</strong> Validation helpers used during configuration bootstrap and tyre profile updates.
 * <p><strong>Role:</strong> Domain support; rejects invalid model parameters before a fit pass starts.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.validation;
