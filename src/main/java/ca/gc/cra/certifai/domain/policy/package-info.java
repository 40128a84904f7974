/**
 * Policy evaluation results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.domain.policy;
