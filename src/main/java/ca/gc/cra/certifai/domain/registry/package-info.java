/**
 * Registry value types: finalized entries, archive traces and the mutable snapshot they live in.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.domain.registry;
