package ca.gc.cra.certifai.config;

import ca.gc.cra.certifai.validation.Numbers;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime settings for one engine invocation.
 *
 * @param root repository root that is scanned and against which identities are relativized
 * @param registryFile registry document location
 * @param lockTimeout bounded wait for the registry lock
 * @param scanThreads worker threads used to parse source files
 * @param excludes glob patterns (matched against root-relative paths) that are never scanned
 * @since 0.1.0
 */
public record EngineConfig(
    Path root,
    Path registryFile,
    Duration lockTimeout,
    int scanThreads,
    List<String> excludes) {

  /** Registry location relative to the root when none is configured. */
  public static final String DEFAULT_REGISTRY = ".certifai/registry.yml";
  public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 10_000L;
  public static final String DEFAULT_EXCLUDES = "**/target/**,**/.git/**";

  public EngineConfig {
    root = Objects.requireNonNull(root, "root");
    registryFile = Objects.requireNonNull(registryFile, "registryFile");
    lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }
    if (scanThreads < 1) {
      throw new IllegalArgumentException("scanThreads must be >= 1");
    }
    excludes = excludes == null ? List.of() : List.copyOf(excludes);
  }

  /**
   * Creates a configuration with defaults for everything except the root.
   *
   * @param root repository root
   * @return engine configuration
   */
  public static EngineConfig forRoot(Path root) {
    Path normalized = root.toAbsolutePath().normalize();
    return new EngineConfig(
        normalized,
        normalized.resolve(DEFAULT_REGISTRY),
        Duration.ofMillis(DEFAULT_LOCK_TIMEOUT_MILLIS),
        defaultThreads(),
        splitList(DEFAULT_EXCLUDES));
  }

  /**
   * Embedded defaults fed to {@link ConfigMerger}.
   *
   * @return immutable default map
   */
  public static Map<String, String> defaults() {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("root", ".");
    defaults.put("registry", "");
    defaults.put("lockTimeoutMillis", Long.toString(DEFAULT_LOCK_TIMEOUT_MILLIS));
    defaults.put("scanThreads", Integer.toString(defaultThreads()));
    defaults.put("exclude", DEFAULT_EXCLUDES);
    return Map.copyOf(defaults);
  }

  /**
   * Builds a configuration from a merged flat map.
   *
   * @param values merged settings; keys as documented on {@link #defaults()}
   * @return engine configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String rootValue = values.getOrDefault("root", ".");
    Path root = Path.of(rootValue.isBlank() ? "." : rootValue.trim()).toAbsolutePath().normalize();

    String registryValue = values.getOrDefault("registry", "").trim();
    Path registry = registryValue.isEmpty() ? root.resolve(DEFAULT_REGISTRY) : root.resolve(registryValue).normalize();

    long timeoutMillis = parseLong(values.get("lockTimeoutMillis"), DEFAULT_LOCK_TIMEOUT_MILLIS, "lockTimeoutMillis");
    Numbers.requireRange("lockTimeoutMillis", timeoutMillis, 1, Duration.ofHours(1).toMillis());
    long threads = parseLong(values.get("scanThreads"), defaultThreads(), "scanThreads");
    Numbers.requireRange("scanThreads", threads, 1, 256);

    String excludeValue = values.get("exclude");
    List<String> excludes = splitList(excludeValue == null ? DEFAULT_EXCLUDES : excludeValue);
    return new EngineConfig(root, registry, Duration.ofMillis(timeoutMillis), (int) threads, excludes);
  }

  /**
   * Returns a copy rooted elsewhere, keeping a default registry location relative to the new root.
   *
   * @param newRoot replacement root
   * @return engine configuration
   */
  public EngineConfig withRoot(Path newRoot) {
    Path normalized = newRoot.toAbsolutePath().normalize();
    Path registry = registryFile.startsWith(root)
        ? normalized.resolve(root.relativize(registryFile))
        : registryFile;
    return new EngineConfig(normalized, registry, lockTimeout, scanThreads, excludes);
  }

  private static int defaultThreads() {
    return Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors()));
  }

  private static long parseLong(String raw, long fallback, String key) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static List<String> splitList(String raw) {
    List<String> parts = new ArrayList<>();
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return List.copyOf(parts);
  }
}
