package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Artifacts found by a scan, next to the problems that prevented scanning the rest.
 *
 * @param artifacts successfully scanned artifacts in path and source order
 * @param problems skipped files and artifacts
 * @since 0.1.0
 */
public record ScanResult(List<Artifact> artifacts, List<ScanProblem> problems) {
  public ScanResult {
    artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    problems = problems == null ? List.of() : List.copyOf(problems);
  }

  public Optional<Artifact> find(ArtifactId id) {
    for (Artifact artifact : artifacts) {
      if (artifact.id().equals(id)) {
        return Optional.of(artifact);
      }
    }
    return Optional.empty();
  }

  /**
   * Indicates whether an identity belongs to a file that failed to parse.
   *
   * @param id identity to test
   * @return {@code true} when the file of {@code id} was skipped entirely
   */
  public boolean isUnreadable(ArtifactId id) {
    for (ScanProblem problem : problems) {
      if (problem.kind() == ScanProblem.Kind.PARSE && sameFile(problem, id)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Indicates whether the inline annotation of an identity was rejected as malformed.
   *
   * @param id identity to test
   * @return {@code true} when the artifact was skipped because of its annotation
   */
  public boolean hasAnnotationProblem(ArtifactId id) {
    for (ScanProblem problem : problems) {
      if (problem.kind() == ScanProblem.Kind.ANNOTATION
          && id.qualifiedName().equals(problem.artifact())
          && sameFile(problem, id)) {
        return true;
      }
    }
    return false;
  }

  private static boolean sameFile(ScanProblem problem, ArtifactId id) {
    String file = problem.file().toString().replace('\\', '/');
    return file.equals(id.path()) || file.endsWith("/" + id.path());
  }

  /**
   * Concatenates two results.
   *
   * @param other result to append
   * @return combined result
   */
  public ScanResult merge(ScanResult other) {
    List<Artifact> mergedArtifacts = new ArrayList<>(artifacts);
    mergedArtifacts.addAll(other.artifacts);
    List<ScanProblem> mergedProblems = new ArrayList<>(problems);
    mergedProblems.addAll(other.problems);
    return new ScanResult(mergedArtifacts, mergedProblems);
  }
}
