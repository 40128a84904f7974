package ca.gc.cra.certifai.domain.policy;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.List;

/**
 * Outcome of evaluating a policy over a set of artifact records.
 *
 * @param coverageRatio certified / eligible, {@code 1.0} when nothing is eligible
 * @param certifiedCount eligible artifacts meeting certification criteria
 * @param eligibleCount artifacts counted towards coverage
 * @param violations violations in detection order; never {@code null}
 * @param pending eligible artifacts still awaiting certification, in identity order; never {@code null}
 * @param agentRatio eligible artifacts carrying a qualifying agent review / eligible
 * @since 0.1.0
 */
public record PolicyReport(
    double coverageRatio,
    int certifiedCount,
    int eligibleCount,
    List<PolicyViolation> violations,
    List<ArtifactId> pending,
    double agentRatio) {

  public PolicyReport {
    violations = violations == null ? List.of() : List.copyOf(violations);
    pending = pending == null ? List.of() : List.copyOf(pending);
  }

  public boolean passed() {
    return violations.isEmpty();
  }

  public List<PolicyViolation> violationsOf(ViolationKind kind) {
    return violations.stream().filter(v -> v.kind() == kind).toList();
  }
}
