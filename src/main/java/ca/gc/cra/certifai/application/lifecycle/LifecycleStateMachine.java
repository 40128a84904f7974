package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.config.AgentPermission;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.error.AgentPermissionException;
import ca.gc.cra.certifai.domain.error.LifecycleException;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.Attribution;
import ca.gc.cra.certifai.domain.model.HistoryEntries;
import ca.gc.cra.certifai.domain.model.LifecycleAction;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Authoritative rules for moving {@link TagMetadata} between certification stages.
 * <p><strong>Why:</strong> Every transition is a pure function of the current record, the policy and an instant,
 * so preconditions fail before any file or registry is touched.</p>
 * <p><strong>Role:</strong> Application service used by {@link ProvenanceEngine} and {@link Reconciler}.</p>
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code history} and {@code reviewers} only grow; each transition appends exactly one history entry.</li>
 *   <li>Failed preconditions throw and return nothing, so callers never observe a partial mutation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LifecycleStateMachine {
  static final String UNKNOWN_COMMIT = "unknown";

  private final PolicyConfig policy;

  public LifecycleStateMachine(PolicyConfig policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  /**
   * Annotate: creates the first provenance record of a Pristine artifact.
   *
   * @param aiComposed composing model or agent; blank means {@value TagMetadata#PENDING}
   * @param notes optional notes
   * @param attribution source-control attribution, if known
   * @param now transition instant
   * @return new metadata with one {@code annotated} history entry
   */
  public TagMetadata annotate(String aiComposed, String notes, Optional<Attribution> attribution, Instant now) {
    Map<String, String> attributes = new LinkedHashMap<>();
    String composer = aiComposed == null || aiComposed.isBlank() ? TagMetadata.PENDING : aiComposed.trim();
    attributes.put("ai_composed", composer);
    if (attribution.isPresent()) {
      attributes.put("last_commit", attribution.get().shortCommit());
      attributes.put("author", attribution.get().author());
    } else {
      attributes.put("last_commit", UNKNOWN_COMMIT);
    }
    return TagMetadata.builder()
        .aiComposed(composer)
        .humanCertified(TagMetadata.PENDING)
        .scrutiny(Scrutiny.AUTO)
        .notes(notes)
        .addHistory(HistoryEntries.format(now, LifecycleAction.ANNOTATED, attributes))
        .build();
  }

  /**
   * Certify (human): records a human approval.
   *
   * @param current current inline metadata; must not be finalized
   * @param reviewer reviewer identity, already validated
   * @param scrutiny scrutiny applied
   * @param notes optional notes; existing notes are kept when {@code null}
   * @param includeExisting allow refreshing an artifact that is already certified
   * @param now transition instant
   * @return certified metadata
   * @throws LifecycleException when the artifact is finalized, already certified without {@code includeExisting},
   *     or the reviewer is not on the allow-list
   */
  public TagMetadata certify(
      TagMetadata current,
      String reviewer,
      Scrutiny scrutiny,
      String notes,
      boolean includeExisting,
      Instant now) throws LifecycleException {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(scrutiny, "scrutiny");
    if (!policy.admitsReviewer(reviewer)) {
      throw new LifecycleException("Reviewer " + reviewer + " is not on the reviewer allow-list");
    }
    if (current.done()) {
      throw new LifecycleException("Artifact is finalized; reopen it before certifying");
    }
    if (!includeExisting && !current.isPendingCertification() && !current.isHumanCertificationStale()) {
      throw new LifecycleException("Artifact already certified by " + current.humanCertified()
          + "; pass includeExisting to refresh");
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("reviewer", reviewer);
    attributes.put("scrutiny", scrutiny.wireName());
    TagMetadata.Builder builder = current.toBuilder()
        .humanCertified(reviewer)
        .scrutiny(scrutiny)
        .date(now)
        .done(false)
        .addReviewer(ReviewerInfo.human(reviewer, scrutiny, now, notes))
        .addHistory(HistoryEntries.format(now, LifecycleAction.CERTIFIED, attributes));
    if (notes != null) {
      builder.notes(notes);
    }
    return builder.build();
  }

  /**
   * Certify (agent): records an automated approval bounded by the agent's permission.
   *
   * @param current current inline metadata; must not be finalized
   * @param agentId agent identity, already validated
   * @param requested requested scrutiny; {@code null} falls back to policy defaults
   * @param notes optional notes
   * @param now transition instant
   * @return metadata with the agent review appended
   * @throws AgentPermissionException when agents are disabled, the agent is not allow-listed, or the scrutiny
   *     exceeds its {@code max_scrutiny}
   * @throws LifecycleException when the artifact is finalized
   */
  public TagMetadata certifyAgent(
      TagMetadata current,
      String agentId,
      Scrutiny requested,
      String notes,
      Instant now) throws AgentPermissionException, LifecycleException {
    Objects.requireNonNull(current, "current");
    if (current.done()) {
      throw new LifecycleException("Artifact is finalized; agent certification requires a reopened artifact");
    }
    AgentPermission permission = permission(agentId);
    Scrutiny scrutiny = resolveAgentScrutiny(permission, requested);
    if (!scrutiny.atMost(permission.maxScrutiny())) {
      throw new AgentPermissionException(agentId, "requested scrutiny " + scrutiny.wireName()
          + " exceeds max_scrutiny " + permission.maxScrutiny().wireName());
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("agent", agentId);
    attributes.put("scrutiny", scrutiny.wireName());
    TagMetadata.Builder builder = current.toBuilder()
        .date(now)
        .done(false)
        .addReviewer(ReviewerInfo.agent(agentId, scrutiny, now, notes))
        .addHistory(HistoryEntries.format(now, LifecycleAction.AGENT_CERTIFIED, attributes));
    if (notes != null) {
      builder.notes(notes);
    }
    return builder.build();
  }

  /**
   * Resolves the scrutiny an agent review is recorded with: requested, else {@code default_scrutiny}, else the
   * permission's {@code max_scrutiny}, else {@code auto}.
   *
   * @param permission agent permission
   * @param requested requested scrutiny; may be {@code null}
   * @return effective scrutiny
   */
  public Scrutiny resolveAgentScrutiny(AgentPermission permission, Scrutiny requested) {
    if (requested != null) {
      return requested;
    }
    if (policy.agents().defaultScrutiny() != null) {
      return policy.agents().defaultScrutiny();
    }
    return permission.maxScrutiny() != null ? permission.maxScrutiny() : Scrutiny.AUTO;
  }

  /**
   * Finalize: moves the full record to a registry entry and leaves a minimal projection inline.
   *
   * @param id artifact identity
   * @param current current inline metadata
   * @param digest live digest of the artifact
   * @param now transition instant
   * @return registry entry and inline projection
   * @throws AgentPermissionException when the latest reviewer is an agent without {@code allow_finalize}
   * @throws LifecycleException when the artifact is finalized already, its reviews are stale, or no reviewer
   *     added since the latest reopening satisfies the policy
   */
  public Finalization finalize(ArtifactId id, TagMetadata current, String digest, Instant now)
      throws AgentPermissionException, LifecycleException {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(digest, "digest");
    if (current.done()) {
      throw new LifecycleException("Artifact " + id + " is already finalized");
    }
    List<ReviewerInfo> reviewers = policy.enforcement().reopenedCountsAsCertified()
        ? current.reviewers()
        : current.currentReviewers();
    if (reviewers.isEmpty() && !current.reviewers().isEmpty()) {
      throw new LifecycleException("Reviews of " + id + " predate its reopening; re-certify before finalizing");
    }
    boolean qualified = false;
    for (ReviewerInfo reviewer : reviewers) {
      if (qualifies(reviewer)) {
        qualified = true;
        break;
      }
    }
    if (!qualified) {
      throw new LifecycleException("Artifact " + id + " has no reviewer that satisfies the policy");
    }
    ReviewerInfo latest = current.latestReviewer().orElseThrow();
    if (latest.isAgent()) {
      Optional<AgentPermission> permission = policy.agents().permission(latest.id());
      if (permission.isEmpty()) {
        throw new AgentPermissionException(latest.id(), "is not allow-listed and cannot finalize " + id);
      }
      if (!permission.get().allowFinalize()) {
        throw new AgentPermissionException(latest.id(), "lacks allow_finalize for " + id);
      }
    }
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("digest", digest);
    TagMetadata full = current.toBuilder()
        .done(true)
        .addHistory(HistoryEntries.format(now, LifecycleAction.FINALIZED, attributes))
        .build();
    return new Finalization(new RegistryEntry(id, digest, full, now), full.finalizedProjection());
  }

  /**
   * Reopen: restores the full record of a registry entry for inline use.
   *
   * @param entry registry entry being removed
   * @param currentDigest live digest
   * @param reason reopening reason, e.g. {@code digest-mismatch} or {@code recertify}
   * @param now transition instant
   * @return restored metadata with {@code done=false} and one {@code reopened} entry appended
   */
  public TagMetadata reopen(RegistryEntry entry, String currentDigest, String reason, Instant now) {
    Objects.requireNonNull(entry, "entry");
    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put("reason", reason);
    attributes.put("previous_digest", entry.digest());
    attributes.put("digest", currentDigest);
    return entry.metadata().toBuilder()
        .done(false)
        .addHistory(HistoryEntries.format(now, LifecycleAction.REOPENED, attributes))
        .build();
  }

  /**
   * Indicates whether a reviewer entry satisfies the policy: a human on the allow-list (or any human when the
   * list is empty), or an allow-listed agent within its {@code max_scrutiny}.
   *
   * @param reviewer reviewer entry
   * @return {@code true} when the review counts
   */
  public boolean qualifies(ReviewerInfo reviewer) {
    if (!reviewer.isAgent()) {
      return policy.admitsReviewer(reviewer.id());
    }
    return policy.agents().permission(reviewer.id())
        .map(permission -> reviewer.scrutiny().atMost(permission.maxScrutiny()))
        .orElse(false);
  }

  private AgentPermission permission(String agentId) throws AgentPermissionException {
    if (!policy.agents().enabled()) {
      throw new AgentPermissionException(agentId, "cannot certify: agent certification is disabled");
    }
    return policy.agents().permission(agentId)
        .orElseThrow(() -> new AgentPermissionException(agentId, "is not allow-listed"));
  }
}
