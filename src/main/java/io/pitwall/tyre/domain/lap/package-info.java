/**
 * Lap records supplied by the session collaborator and their prepared, fuel-annotated form.
 *
 * @since 0.1.0
 */
package io.pitwall.tyre.domain.lap;
