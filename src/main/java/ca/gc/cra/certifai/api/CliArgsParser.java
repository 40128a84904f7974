package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Utility for turning {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}. Artifact identities such as
   * {@code src/A.java::p.A.run(int)} contain no {@code '='} and pass through unchanged.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the argument prefix prior to {@code '='}, in argument order
   * @throws IllegalArgumentException when an argument is malformed or a key repeats
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      if (map.put(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }

  /**
   * Removes the named keys from {@code args} and returns them separately.
   *
   * @param args parsed arguments; modified in place
   * @param keys keys owned by the calling command
   * @return extracted arguments, in argument order
   */
  public static Map<String, String> extract(Map<String, String> args, Set<String> keys) {
    Map<String, String> extracted = new LinkedHashMap<>();
    for (String key : keys) {
      String value = args.remove(key);
      if (value != null) {
        extracted.put(key, value);
      }
    }
    return extracted;
  }

  /**
   * Rejects keys outside an allowed set.
   *
   * @param args parsed arguments
   * @param allowed accepted keys
   * @throws IllegalArgumentException naming every unknown key
   */
  public static void requireKnown(Map<String, String> args, Set<String> allowed) {
    Set<String> unknown = new TreeSet<>(args.keySet());
    unknown.removeAll(allowed);
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("unknown argument(s): " + String.join(", ", unknown));
    }
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    Strings.requireNonBlank(key, value);
  }
}
