/**
 * Metrics adapters implementing {@link ca.gc.cra.certifai.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Adapters are safe for concurrent updates from scan workers.</p>
 */
package ca.gc.cra.certifai.infrastructure.metrics;
