package ca.gc.cra.certifai.domain.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Formats and inspects history entries of the form {@code <instant> <action> key=value ...}.
 *
 * <p>Values never contain whitespace; runs of whitespace are folded to {@code _} when formatting.</p>
 *
 * @since 0.1.0
 */
public final class HistoryEntries {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private HistoryEntries() {
    // Utility
  }

  /**
   * Builds a history entry.
   *
   * @param timestamp event instant; must not be {@code null}
   * @param action lifecycle action; must not be {@code null}
   * @param attributes ordered attributes; {@code null} values are skipped
   * @return formatted entry
   */
  public static String format(Instant timestamp, LifecycleAction action, Map<String, String> attributes) {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(action, "action");
    StringBuilder entry = new StringBuilder(64)
        .append(timestamp)
        .append(' ')
        .append(action.wireName());
    if (attributes != null) {
      for (Map.Entry<String, String> attribute : attributes.entrySet()) {
        if (attribute.getValue() == null) {
          continue;
        }
        entry.append(' ')
            .append(attribute.getKey())
            .append('=')
            .append(fold(attribute.getValue()));
      }
    }
    return entry.toString();
  }

  /**
   * Extracts the lifecycle action of an entry.
   *
   * @param entry history entry; may be {@code null}
   * @return action, or empty for free-form or legacy entries
   */
  public static Optional<LifecycleAction> action(String entry) {
    String[] tokens = tokens(entry);
    if (tokens.length < 2) {
      return Optional.empty();
    }
    return LifecycleAction.fromWireName(tokens[1]);
  }

  /**
   * Extracts the {@code key=value} attributes of an entry.
   *
   * @param entry history entry; may be {@code null}
   * @return ordered attributes, empty when none
   */
  public static Map<String, String> attributes(String entry) {
    Map<String, String> attributes = new LinkedHashMap<>();
    String[] tokens = tokens(entry);
    for (int i = 2; i < tokens.length; i++) {
      int idx = tokens[i].indexOf('=');
      if (idx > 0) {
        attributes.put(tokens[i].substring(0, idx), tokens[i].substring(idx + 1));
      }
    }
    return attributes;
  }

  private static String[] tokens(String entry) {
    if (entry == null || entry.isBlank()) {
      return new String[0];
    }
    return WHITESPACE.split(entry.trim());
  }

  private static String fold(String value) {
    String trimmed = value.trim();
    return trimmed.isEmpty() ? "-" : WHITESPACE.matcher(trimmed).replaceAll("_");
  }
}
