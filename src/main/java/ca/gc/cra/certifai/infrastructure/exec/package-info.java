/**
 * Executor factories for the scan worker pool.
 */
package ca.gc.cra.certifai.infrastructure.exec;
