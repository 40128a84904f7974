/**
 * Error taxonomy of the provenance engine.
 * <p>Per-artifact parse and annotation problems are collected rather than thrown; registry errors abort
 * the whole operation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.domain.error;
