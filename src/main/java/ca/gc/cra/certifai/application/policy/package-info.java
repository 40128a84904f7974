/**
 * Pure policy evaluation: coverage, agent credit and enforcement violations over artifact records.
 */
package ca.gc.cra.certifai.application.policy;
