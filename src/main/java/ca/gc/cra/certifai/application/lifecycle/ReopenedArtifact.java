package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.util.Objects;

/**
 * Finalized artifact returned to review because its implementation drifted.
 *
 * @param id artifact identity
 * @param previousDigest digest stored at finalization
 * @param currentDigest live digest
 * @param restored metadata written back inline
 * @since 0.1.0
 */
public record ReopenedArtifact(ArtifactId id, String previousDigest, String currentDigest, TagMetadata restored) {
  public ReopenedArtifact {
    id = Objects.requireNonNull(id, "id");
    previousDigest = Objects.requireNonNull(previousDigest, "previousDigest");
    currentDigest = Objects.requireNonNull(currentDigest, "currentDigest");
    restored = Objects.requireNonNull(restored, "restored");
  }
}
