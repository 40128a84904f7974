package ca.gc.cra.certifai.domain.registry;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.time.Instant;
import java.util.Objects;

/**
 * Trace of a registry entry removed by a reopening.
 *
 * @param id artifact identity; never {@code null}
 * @param archivedAt removal instant; never {@code null}
 * @param reason why the entry was removed (e.g. {@code digest-mismatch}); never {@code null}
 * @param oldDigest digest stored at finalization; never {@code null}
 * @param newDigest live digest that triggered the reopening; may be {@code null}
 * @since 0.1.0
 */
public record ArchiveRecord(ArtifactId id, Instant archivedAt, String reason, String oldDigest, String newDigest) {
  public ArchiveRecord {
    id = Objects.requireNonNull(id, "id");
    archivedAt = Objects.requireNonNull(archivedAt, "archivedAt");
    reason = Objects.requireNonNull(reason, "reason");
    oldDigest = Objects.requireNonNull(oldDigest, "oldDigest");
  }
}
