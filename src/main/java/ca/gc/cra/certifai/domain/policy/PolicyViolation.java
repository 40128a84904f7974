package ca.gc.cra.certifai.domain.policy;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.Objects;

/**
 * Structured policy violation; a report item, not an exception.
 *
 * @param kind violation category; never {@code null}
 * @param artifact offending artifact; {@code null} for repository-wide violations such as coverage
 * @param message human-readable description; never {@code null}
 * @since 0.1.0
 */
public record PolicyViolation(ViolationKind kind, ArtifactId artifact, String message) {
  public PolicyViolation {
    kind = Objects.requireNonNull(kind, "kind");
    message = Objects.requireNonNull(message, "message");
  }
}
