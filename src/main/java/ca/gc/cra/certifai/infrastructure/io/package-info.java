/**
 * File-system helpers shared by the source rewriter and the registry store.
 */
package ca.gc.cra.certifai.infrastructure.io;
