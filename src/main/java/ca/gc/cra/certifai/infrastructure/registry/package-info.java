/**
 * YAML registry store with bounded, file-backed locking.
 */
package ca.gc.cra.certifai.infrastructure.registry;
