package ca.gc.cra.certifai.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges engine configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param yaml optional YAML-derived settings from the {@code engine} section
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults, see {@link EngineConfig#defaults()}
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    requirePositiveLong(effective, "lockTimeoutMillis");
    requirePositiveLong(effective, "scanThreads");
    String registry = trim(effective.get("registry"));
    if (registry.endsWith("/") || registry.endsWith("\\")) {
      throw new IllegalArgumentException("registry must name a file, not a directory: " + registry);
    }
  }

  private static void requirePositiveLong(Map<String, String> effective, String key) {
    String raw = trim(effective.get(key));
    if (raw.isEmpty()) {
      return;
    }
    long value;
    try {
      value = Long.parseLong(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
    if (value <= 0) {
      throw new IllegalArgumentException(key + " must be positive (was " + value + ")");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
