package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.LifecycleStage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Artifact records of a repository with their effective metadata.
 *
 * @param records one record per scanned artifact, finalized ones carrying the registry snapshot
 * @param problems files and artifacts the scan skipped
 * @param orphans registry identities without a live artifact
 * @since 0.1.0
 */
public record ScanReport(List<ArtifactRecord> records, List<ScanProblem> problems, List<ArtifactId> orphans) {
  public ScanReport {
    records = records == null ? List.of() : List.copyOf(records);
    problems = problems == null ? List.of() : List.copyOf(problems);
    orphans = orphans == null ? List.of() : List.copyOf(orphans);
  }

  public Optional<ArtifactRecord> find(ArtifactId id) {
    for (ArtifactRecord record : records) {
      if (record.id().equals(id)) {
        return Optional.of(record);
      }
    }
    return Optional.empty();
  }

  public List<ArtifactRecord> inStage(LifecycleStage stage) {
    List<ArtifactRecord> matching = new ArrayList<>();
    for (ArtifactRecord record : records) {
      if (record.stage() == stage) {
        matching.add(record);
      }
    }
    return matching;
  }
}
