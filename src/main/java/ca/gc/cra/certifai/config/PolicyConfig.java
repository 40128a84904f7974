package ca.gc.cra.certifai.config;

import java.util.List;
import java.util.Objects;

/**
 * Parsed policy: enforcement flags, the human reviewer allow-list and agent permissions.
 *
 * <p>Owned by collaborators and consumed read-only by the engine.</p>
 *
 * @param enforcement enforcement flags; never {@code null}
 * @param reviewers human reviewer allow-list; empty admits any reviewer
 * @param agents agent integration settings; never {@code null}
 * @since 0.1.0
 */
public record PolicyConfig(EnforcementSettings enforcement, List<String> reviewers, AgentSettings agents) {
  public PolicyConfig {
    enforcement = Objects.requireNonNull(enforcement, "enforcement");
    reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
    agents = Objects.requireNonNull(agents, "agents");
  }

  public static PolicyConfig defaults() {
    return new PolicyConfig(EnforcementSettings.defaults(), List.of(), AgentSettings.disabled());
  }

  /**
   * Indicates whether a human reviewer is admitted by the allow-list.
   *
   * @param reviewerId reviewer identity
   * @return {@code true} when the allow-list is empty or contains {@code reviewerId}
   */
  public boolean admitsReviewer(String reviewerId) {
    return reviewers.isEmpty() || reviewers.contains(reviewerId);
  }
}
