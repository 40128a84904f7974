package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.util.Objects;

/**
 * Replacement of one artifact's inline annotation, or its insertion when the artifact is Pristine.
 *
 * @param artifact artifact as scanned from the current file content
 * @param metadata metadata to write
 * @since 0.1.0
 */
public record InlineEdit(Artifact artifact, TagMetadata metadata) {
  public InlineEdit {
    artifact = Objects.requireNonNull(artifact, "artifact");
    metadata = Objects.requireNonNull(metadata, "metadata");
  }
}
