package ca.gc.cra.certifai.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered review depth: {@code auto < low < medium < high}.
 *
 * @since 0.1.0
 */
public enum Scrutiny {
  AUTO,
  LOW,
  MEDIUM,
  HIGH;

  /**
   * Returns the lower-case wire name used in annotations, YAML and history entries.
   *
   * @return wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Indicates whether this level does not exceed {@code limit}.
   *
   * @param limit upper bound; must not be {@code null}
   * @return {@code true} when {@code this <= limit}
   */
  public boolean atMost(Scrutiny limit) {
    return compareTo(limit) <= 0;
  }

  /**
   * Parses a wire name, ignoring case and surrounding whitespace.
   *
   * @param value candidate text; may be {@code null}
   * @return parsed level, or empty when {@code value} is blank or unknown
   */
  public static Optional<Scrutiny> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (Scrutiny candidate : values()) {
      if (candidate.name().equals(normalized)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
