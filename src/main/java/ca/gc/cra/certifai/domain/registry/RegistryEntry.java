package ca.gc.cra.certifai.domain.registry;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.time.Instant;
import java.util.Objects;

/**
 * Finalized provenance record held out-of-band for one artifact.
 *
 * <p>Created only by Finalize and removed only by Reopen; never updated in place.</p>
 *
 * @param id artifact identity; never {@code null}
 * @param digest implementation digest at finalization; never {@code null}
 * @param metadata full metadata snapshot, including the {@code finalized} history event; never {@code null}
 * @param finalizedAt finalization instant; never {@code null}
 * @since 0.1.0
 */
public record RegistryEntry(ArtifactId id, String digest, TagMetadata metadata, Instant finalizedAt) {
  public RegistryEntry {
    id = Objects.requireNonNull(id, "id");
    digest = Objects.requireNonNull(digest, "digest");
    metadata = Objects.requireNonNull(metadata, "metadata");
    finalizedAt = Objects.requireNonNull(finalizedAt, "finalizedAt");
  }
}
