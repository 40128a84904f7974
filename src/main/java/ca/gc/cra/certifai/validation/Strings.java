package ca.gc.cra.certifai.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for identities and free text supplied to the engine.
 * <p><strong>Why:</strong> Reviewer, agent and model identities end up in history entries and the registry,
 * so they must be single-line tokens without control characters.</p>
 * <p><strong>Role:</strong> Support utilities invoked by lifecycle use cases and the CLI before any file is touched.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an identity that is recorded as a single history token.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identity
   * @return trimmed identity
   * @throws IllegalArgumentException if the identity is blank, contains control characters or whitespace
   */
  public static String requireIdentity(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isWhitespace(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain whitespace"));
      }
    }
    return trimmed;
  }

  /**
   * Normalizes optional free text: {@code null} and blank become {@code null}, control characters are rejected.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; may be {@code null}
   * @return trimmed text or {@code null}
   */
  public static String optionalText(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (Character.isISOControl(c) && c != '\n' && c != '\t') {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
