/**
 * <strong>Purpose:</strong> Lifecycle use cases: the state machine, the engine facade exposed to collaborators and
 * the reconciler that keeps inline annotations and the registry consistent.
 * <p><strong>Concurrency:</strong> Registry reads and the write of one transition or batch happen under a single
 * registry lock.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.application.lifecycle;
