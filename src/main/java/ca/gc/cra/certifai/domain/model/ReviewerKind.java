package ca.gc.cra.certifai.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of reviewer that approved an artifact.
 *
 * @since 0.1.0
 */
public enum ReviewerKind {
  HUMAN,
  AGENT;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ReviewerKind> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (ReviewerKind candidate : values()) {
      if (candidate.name().equals(normalized)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
