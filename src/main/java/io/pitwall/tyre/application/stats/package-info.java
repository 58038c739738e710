/**
 * Robust statistics shared by the abrasion and degradation-rate estimators.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.application.stats;
