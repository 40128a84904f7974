package ca.gc.cra.certifai.application.policy;

import ca.gc.cra.certifai.config.AgentPermission;
import ca.gc.cra.certifai.config.EnforcementSettings;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.policy.PolicyViolation;
import ca.gc.cra.certifai.domain.policy.ViolationKind;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns artifact records and a policy into coverage figures and violations.
 * <p><strong>Why:</strong> CI gates and reports need one verdict computed the same way everywhere.</p>
 * <p><strong>Role:</strong> Pure application service; performs no I/O and mutates nothing.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PolicyEvaluator {
  private static final double EPSILON = 1e-12;

  /**
   * Evaluates records without orphan information.
   *
   * @param records artifact records with effective metadata
   * @param policy policy to apply
   * @return policy report
   */
  public PolicyReport evaluate(List<ArtifactRecord> records, PolicyConfig policy) {
    return evaluate(records, List.of(), policy);
  }

  /**
   * Evaluates records and orphaned registry entries.
   *
   * @param records artifact records with effective metadata
   * @param orphans identities of registry entries with no live artifact
   * @param policy policy to apply
   * @return policy report; violations ordered ai-composed, coverage, orphans
   */
  public PolicyReport evaluate(List<ArtifactRecord> records, List<ArtifactId> orphans, PolicyConfig policy) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(policy, "policy");
    EnforcementSettings enforcement = policy.enforcement();

    int eligible = 0;
    int certified = 0;
    int agentCredited = 0;
    List<ArtifactId> pending = new ArrayList<>();
    List<PolicyViolation> violations = new ArrayList<>();

    for (ArtifactRecord record : records) {
      TagMetadata metadata = record.metadata();
      if (metadata == null && enforcement.ignoreUnannotated()) {
        continue;
      }
      eligible++;
      boolean staleCounts = enforcement.reopenedCountsAsCertified();
      List<ReviewerInfo> reviewers = metadata == null
          ? List.of()
          : staleCounts ? metadata.reviewers() : metadata.currentReviewers();
      boolean humanCurrent = metadata != null && (staleCounts || !metadata.isHumanCertificationStale());
      boolean agentReviewed = qualifyingAgentReview(reviewers, policy, null).isPresent();
      if (agentReviewed) {
        agentCredited++;
      }
      boolean isCertified = (humanCurrent && !metadata.isPendingCertification())
          || (agentReviewed && policy.agents().allowCoverageCredit());
      if (isCertified) {
        certified++;
      } else {
        pending.add(record.id());
      }

      if (enforcement.aiComposedRequiresHighScrutiny() && metadata != null && metadata.isAiComposed()) {
        boolean highHuman = humanCurrent && metadata.scrutiny() == Scrutiny.HIGH;
        boolean highAgent = qualifyingAgentReview(reviewers, policy, Scrutiny.HIGH).isPresent();
        if (!highHuman && !highAgent) {
          violations.add(new PolicyViolation(ViolationKind.AI_COMPOSED_REQUIRES_HIGH_SCRUTINY, record.id(),
              record.id() + " is composed by " + metadata.aiComposed() + " but reviewed at scrutiny "
                  + (humanCurrent ? metadata.scrutiny().wireName() : "stale") + "; high is required"));
        }
      }
    }

    double ratio = eligible == 0 ? 1.0d : (double) certified / eligible;
    double agentRatio = eligible == 0 ? 0.0d : (double) agentCredited / eligible;
    Double minCoverage = enforcement.minCoverage();
    if (minCoverage != null && ratio + EPSILON < minCoverage) {
      violations.add(new PolicyViolation(ViolationKind.MIN_COVERAGE, null, String.format(Locale.ROOT,
          "Coverage %d/%d (%.2f%%) below required %s%%",
          certified, eligible, ratio * 100d, percent(minCoverage))));
    }
    if (enforcement.failOnOrphans() && orphans != null) {
      for (ArtifactId orphan : orphans) {
        violations.add(new PolicyViolation(ViolationKind.ORPHANED_REGISTRY_ENTRY, orphan,
            "Registry entry " + orphan + " has no matching artifact"));
      }
    }
    Collections.sort(pending);
    return new PolicyReport(ratio, certified, eligible, violations, pending, agentRatio);
  }

  private static Optional<ReviewerInfo> qualifyingAgentReview(
      List<ReviewerInfo> reviewers, PolicyConfig policy, Scrutiny required) {
    for (ReviewerInfo reviewer : reviewers) {
      if (!reviewer.isAgent()) {
        continue;
      }
      Optional<AgentPermission> permission = policy.agents().permission(reviewer.id());
      if (permission.isEmpty() || !reviewer.scrutiny().atMost(permission.get().maxScrutiny())) {
        continue;
      }
      if (required == null || reviewer.scrutiny() == required) {
        return Optional.of(reviewer);
      }
    }
    return Optional.empty();
  }

  private static String percent(double fraction) {
    return BigDecimal.valueOf(fraction).movePointRight(2).stripTrailingZeros().toPlainString();
  }
}
