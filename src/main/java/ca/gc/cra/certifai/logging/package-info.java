/**
 * Logging helpers: runtime level changes for the CLI and bounded rendering of free text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.logging;
