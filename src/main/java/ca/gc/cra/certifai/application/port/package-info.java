/**
 * <strong>Purpose:</strong> Ports between lifecycle use cases and the outside world: source scanning, inline
 * annotation encoding and rewriting, the registry store, attribution, clock and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume validated inputs from configuration modules.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.application.port;
