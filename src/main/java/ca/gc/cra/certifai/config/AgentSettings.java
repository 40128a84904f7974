package ca.gc.cra.certifai.config;

import ca.gc.cra.certifai.domain.model.Scrutiny;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@code integrations.agents} section of the policy.
 *
 * @param enabled whether agent certification is accepted at all
 * @param allowedIds optional extra allow-list; empty means every agent with a permission entry
 * @param allowCoverageCredit whether qualifying agent reviews count towards coverage
 * @param defaultScrutiny scrutiny applied when an agent does not request one; may be {@code null}
 * @param reviewers per-agent permissions; never {@code null}
 * @since 0.1.0
 */
public record AgentSettings(
    boolean enabled,
    Set<String> allowedIds,
    boolean allowCoverageCredit,
    Scrutiny defaultScrutiny,
    List<AgentPermission> reviewers) {

  public AgentSettings {
    allowedIds = allowedIds == null ? Set.of() : Set.copyOf(allowedIds);
    reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
  }

  public static AgentSettings disabled() {
    return new AgentSettings(false, Set.of(), false, null, List.of());
  }

  /**
   * Resolves the permission of an allow-listed agent.
   *
   * @param agentId agent identity; may be {@code null}
   * @return permission when agents are enabled and {@code agentId} is allow-listed
   */
  public Optional<AgentPermission> permission(String agentId) {
    if (!enabled || agentId == null) {
      return Optional.empty();
    }
    if (!allowedIds.isEmpty() && !allowedIds.contains(agentId)) {
      return Optional.empty();
    }
    for (AgentPermission permission : reviewers) {
      if (Objects.equals(permission.id(), agentId)) {
        return Optional.of(permission);
      }
    }
    return Optional.empty();
  }
}
