/**
 * JavaParser adapters: source scanning, canonical digests, {@code @Certifai} encoding and source rewriting.
 *
 * <p>Parsers are created per task; digesting and encoding are thread-safe.</p>
 */
package ca.gc.cra.certifai.infrastructure.java;
