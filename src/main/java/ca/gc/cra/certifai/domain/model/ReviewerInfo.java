package ca.gc.cra.certifai.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One approval recorded against an artifact.
 *
 * @param kind human or agent; never {@code null}
 * @param id opaque reviewer identity; never {@code null}
 * @param scrutiny scrutiny applied by the reviewer; never {@code null}
 * @param timestamp approval instant; may be {@code null} for hand-written entries
 * @param notes optional reviewer notes; may be {@code null}
 * @since 0.1.0
 */
public record ReviewerInfo(
    ReviewerKind kind,
    String id,
    Scrutiny scrutiny,
    Instant timestamp,
    String notes) {

  public ReviewerInfo {
    kind = Objects.requireNonNull(kind, "kind");
    id = Objects.requireNonNull(id, "id");
    scrutiny = Objects.requireNonNull(scrutiny, "scrutiny");
  }

  public static ReviewerInfo human(String id, Scrutiny scrutiny, Instant timestamp, String notes) {
    return new ReviewerInfo(ReviewerKind.HUMAN, id, scrutiny, timestamp, notes);
  }

  public static ReviewerInfo agent(String id, Scrutiny scrutiny, Instant timestamp, String notes) {
    return new ReviewerInfo(ReviewerKind.AGENT, id, scrutiny, timestamp, notes);
  }

  public boolean isAgent() {
    return kind == ReviewerKind.AGENT;
  }
}
