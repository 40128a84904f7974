package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.Objects;

/**
 * Inconsistency between inline state and the registry that needs manual repair.
 *
 * @param id artifact identity
 * @param kind inconsistency
 * @param message human-readable description
 * @since 0.1.0
 */
public record CorruptionFinding(ArtifactId id, Kind kind, String message) {
  public CorruptionFinding {
    id = Objects.requireNonNull(id, "id");
    kind = Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
  }

  /** Inconsistency kinds. */
  public enum Kind {
    /** The inline annotation says {@code done=true} but the registry holds no entry. */
    MISSING_REGISTRY_ENTRY
  }
}
