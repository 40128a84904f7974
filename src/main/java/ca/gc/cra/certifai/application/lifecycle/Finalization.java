package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.util.Objects;

/**
 * Outcome of the Finalize transition: the registry entry to commit and the projection left inline.
 *
 * @param entry new registry entry holding the full metadata
 * @param inline minimal inline projection ({@code done=true}, {@code humanCertified})
 * @since 0.1.0
 */
public record Finalization(RegistryEntry entry, TagMetadata inline) {
  public Finalization {
    entry = Objects.requireNonNull(entry, "entry");
    inline = Objects.requireNonNull(inline, "inline");
  }
}
