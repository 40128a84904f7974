/**
 * Policy and engine configuration plus the composition root wiring CERTIFAI adapters.
 * <p><strong>Role:</strong> Bootstrap layer turning YAML and CLI overrides into immutable settings.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Validation:</strong> Invalid values surface as {@link java.lang.IllegalArgumentException} naming the
 * offending key; relies on {@code ca.gc.cra.certifai.validation} utilities.</p>
 */
package ca.gc.cra.certifai.config;
