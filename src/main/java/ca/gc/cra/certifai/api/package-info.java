/**
 * CLI entry points that drive the provenance engine: scan, annotate, certify, finalize, reconcile and check.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses {@code key=value} arguments, configures
 * logging, and maps engine outcomes to exit codes.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded; scanning spawns its own workers.</p>
 * <p><strong>Output:</strong> Reports go to stdout (JSON with {@code --json}); logs go to stderr.</p>
 */
package ca.gc.cra.certifai.api;
