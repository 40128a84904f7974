/**
 * Source-level annotation type used to carry provenance records inline.
 * <p><strong>Role:</strong> Public surface consumed by annotated code bases; has no runtime behaviour.
 * <p><strong>Security:</strong> Reviewer identities are opaque strings supplied by trusted callers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.annotation;
