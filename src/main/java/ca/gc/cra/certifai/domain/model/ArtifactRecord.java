package ca.gc.cra.certifai.domain.model;

import java.util.Objects;

/**
 * Artifact paired with its effective provenance, as handed to collaborators and the policy evaluator.
 *
 * <p>For finalized artifacts {@code metadata} is the full record from the registry, not the inline
 * projection.</p>
 *
 * @param artifact scanned artifact; never {@code null}
 * @param metadata effective metadata; {@code null} when Pristine
 * @param stage derived lifecycle stage; never {@code null}
 * @since 0.1.0
 */
public record ArtifactRecord(Artifact artifact, TagMetadata metadata, LifecycleStage stage) {
  public ArtifactRecord {
    artifact = Objects.requireNonNull(artifact, "artifact");
    stage = Objects.requireNonNull(stage, "stage");
  }

  public ArtifactId id() {
    return artifact.id();
  }

  public boolean isPristine() {
    return metadata == null;
  }
}
