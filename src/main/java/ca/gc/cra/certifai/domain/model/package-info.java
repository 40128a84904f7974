/**
 * Provenance domain model: artifacts, metadata records, reviewers and lifecycle stages.
 * <p><strong>Role:</strong> Immutable value types shared by every layer.
 * <p><strong>Concurrency:</strong> Records are immutable and safe to share between scan workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.certifai.domain.model;
