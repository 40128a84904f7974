package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one reconciliation pass.
 *
 * @param reopened finalized artifacts whose digest drifted, now back under review
 * @param orphans registry entries without a live artifact
 * @param recovered registry entries removed because the inline annotation was not finalized (interrupted
 *     Finalize or Reopen)
 * @param corruption inconsistencies left for manual repair
 * @param problems files and artifacts the scan skipped
 * @since 0.1.0
 */
public record ReconcileReport(
    List<ReopenedArtifact> reopened,
    List<ReopenConflict> orphans,
    List<ArtifactId> recovered,
    List<CorruptionFinding> corruption,
    List<ScanProblem> problems) {

  public ReconcileReport {
    reopened = reopened == null ? List.of() : List.copyOf(reopened);
    orphans = orphans == null ? List.of() : List.copyOf(orphans);
    recovered = recovered == null ? List.of() : List.copyOf(recovered);
    corruption = corruption == null ? List.of() : List.copyOf(corruption);
    problems = problems == null ? List.of() : List.copyOf(problems);
  }

  /**
   * Indicates whether the pass changed nothing and found nothing to report.
   *
   * @return {@code true} when every list is empty
   */
  public boolean isClean() {
    return reopened.isEmpty() && orphans.isEmpty() && recovered.isEmpty() && corruption.isEmpty()
        && problems.isEmpty();
  }

  public List<ArtifactId> orphanIds() {
    List<ArtifactId> ids = new ArrayList<>(orphans.size());
    for (ReopenConflict orphan : orphans) {
      ids.add(orphan.entry().id());
    }
    return ids;
  }
}
