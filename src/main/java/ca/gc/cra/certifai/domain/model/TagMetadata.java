package ca.gc.cra.certifai.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Provenance record attached to one artifact.
 *
 * <p>Instances are immutable. Lifecycle transitions derive new instances through {@link #toBuilder()};
 * {@code history} and {@code reviewers} only ever grow across transitions. {@code extras} keeps
 * unrecognised inline members in their original order so they are re-emitted unchanged.</p>
 *
 * @param aiComposed composing model or agent, {@value #PENDING} when unknown; never {@code null}
 * @param humanCertified human certifier, {@value #PENDING} until certified; never {@code null}
 * @param scrutiny current scrutiny level; never {@code null}
 * @param date last certification change; may be {@code null}
 * @param notes reviewer notes; may be {@code null}
 * @param history ordered lifecycle events; never {@code null}
 * @param reviewers ordered approvals; never {@code null}
 * @param done {@code true} only while the artifact is finalized
 * @param extras unrecognised members keyed by name, values kept as source text; never {@code null}
 * @since 0.1.0
 */
public record TagMetadata(
    String aiComposed,
    String humanCertified,
    Scrutiny scrutiny,
    Instant date,
    String notes,
    List<String> history,
    List<ReviewerInfo> reviewers,
    boolean done,
    Map<String, String> extras) {

  /** Placeholder for authorship or certification that has not happened yet. */
  public static final String PENDING = "pending";

  public TagMetadata {
    aiComposed = blankToPending(aiComposed);
    humanCertified = blankToPending(humanCertified);
    scrutiny = scrutiny == null ? Scrutiny.AUTO : scrutiny;
    notes = notes == null || notes.isBlank() ? null : notes;
    history = history == null ? List.of() : List.copyOf(history);
    reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
    extras = extras == null || extras.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
  }

  /**
   * Returns a record with every field at its default.
   *
   * @return empty metadata
   */
  public static TagMetadata empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Indicates whether no human has certified the artifact yet.
   *
   * @return {@code true} when {@code humanCertified} is {@value #PENDING}
   */
  public boolean isPendingCertification() {
    return isPending(humanCertified);
  }

  /**
   * Indicates whether an AI system is recorded as the author.
   *
   * @return {@code true} when {@code aiComposed} is set to something other than {@value #PENDING}
   */
  public boolean isAiComposed() {
    return !isPending(aiComposed);
  }

  public Optional<ReviewerInfo> latestReviewer() {
    return reviewers.isEmpty() ? Optional.empty() : Optional.of(reviewers.get(reviewers.size() - 1));
  }

  /**
   * Indicates whether the last review-relevant event was a reopening, i.e. existing reviews predate the
   * current implementation.
   *
   * @return {@code true} when reviews are stale pending re-certification
   */
  public boolean isStale() {
    for (int i = history.size() - 1; i >= 0; i--) {
      Optional<LifecycleAction> action = HistoryEntries.action(history.get(i));
      if (action.isEmpty()) {
        continue;
      }
      switch (action.get()) {
        case REOPENED:
          return true;
        case CERTIFIED:
        case AGENT_CERTIFIED:
          return false;
        default:
          break;
      }
    }
    return false;
  }

  /**
   * Indicates whether {@code humanCertified} and {@code scrutiny} were recorded before the latest reopening.
   * Only a human {@code certified} event after the reopening makes them current again.
   *
   * @return {@code true} when the human certification predates the latest reopening
   */
  public boolean isHumanCertificationStale() {
    int reopened = lastReopenedIndex();
    if (reopened < 0) {
      return false;
    }
    for (int i = reopened + 1; i < history.size(); i++) {
      if (HistoryEntries.action(history.get(i)).orElse(null) == LifecycleAction.CERTIFIED) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reviewers appended since the latest reopening, or all reviewers when the artifact was never reopened.
   * Each certification appends one reviewer and one history event, so the count of review events after the
   * reopening selects the trailing reviewers.
   *
   * @return current reviewers in append order
   */
  public List<ReviewerInfo> currentReviewers() {
    int reopened = lastReopenedIndex();
    if (reopened < 0) {
      return reviewers;
    }
    int recent = 0;
    for (int i = reopened + 1; i < history.size(); i++) {
      LifecycleAction action = HistoryEntries.action(history.get(i)).orElse(null);
      if (action == LifecycleAction.CERTIFIED || action == LifecycleAction.AGENT_CERTIFIED) {
        recent++;
      }
    }
    int from = Math.max(0, reviewers.size() - recent);
    return reviewers.subList(from, reviewers.size());
  }

  private int lastReopenedIndex() {
    for (int i = history.size() - 1; i >= 0; i--) {
      if (HistoryEntries.action(history.get(i)).orElse(null) == LifecycleAction.REOPENED) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Projection kept inline while the full record lives in the registry.
   *
   * @return metadata carrying only {@code done=true} and {@code humanCertified}
   */
  public TagMetadata finalizedProjection() {
    return builder().humanCertified(humanCertified).done(true).build();
  }

  static boolean isPending(String value) {
    return value == null || value.isBlank() || PENDING.equalsIgnoreCase(value.trim());
  }

  private static String blankToPending(String value) {
    return value == null || value.isBlank() ? PENDING : value;
  }

  /**
   * Mutable builder used by codecs and lifecycle transitions.
   */
  public static final class Builder {
    private String aiComposed = PENDING;
    private String humanCertified = PENDING;
    private Scrutiny scrutiny = Scrutiny.AUTO;
    private Instant date;
    private String notes;
    private final List<String> history = new ArrayList<>();
    private final List<ReviewerInfo> reviewers = new ArrayList<>();
    private boolean done;
    private final Map<String, String> extras = new LinkedHashMap<>();

    private Builder() {}

    private Builder(TagMetadata source) {
      this.aiComposed = source.aiComposed;
      this.humanCertified = source.humanCertified;
      this.scrutiny = source.scrutiny;
      this.date = source.date;
      this.notes = source.notes;
      this.history.addAll(source.history);
      this.reviewers.addAll(source.reviewers);
      this.done = source.done;
      this.extras.putAll(source.extras);
    }

    public Builder aiComposed(String value) {
      this.aiComposed = value;
      return this;
    }

    public Builder humanCertified(String value) {
      this.humanCertified = value;
      return this;
    }

    public Builder scrutiny(Scrutiny value) {
      this.scrutiny = value;
      return this;
    }

    public Builder date(Instant value) {
      this.date = value;
      return this;
    }

    public Builder notes(String value) {
      this.notes = value;
      return this;
    }

    public Builder addHistory(String entry) {
      this.history.add(Objects.requireNonNull(entry, "entry"));
      return this;
    }

    public Builder addReviewer(ReviewerInfo reviewer) {
      this.reviewers.add(Objects.requireNonNull(reviewer, "reviewer"));
      return this;
    }

    public Builder done(boolean value) {
      this.done = value;
      return this;
    }

    public Builder putExtra(String key, String sourceText) {
      this.extras.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(sourceText, "sourceText"));
      return this;
    }

    public TagMetadata build() {
      return new TagMetadata(aiComposed, humanCertified, scrutiny, date, notes, history, reviewers, done, extras);
    }
  }
}
