package ca.gc.cra.certifai.config;

import ca.gc.cra.certifai.domain.model.Scrutiny;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the certification policy from a YAML document.
 *
 * <p>Recognised sections are {@code enforcement}, {@code reviewers} and {@code integrations.agents};
 * other top-level sections (for example {@code engine}) are ignored here.</p>
 *
 * @since 0.1.0
 */
public final class PolicyConfigLoader {
  /** Candidate policy file names, probed in order at the repository root. */
  public static final List<String> DEFAULT_FILE_NAMES = List.of(".certifai.yml", "certifai.yml");

  private PolicyConfigLoader() {}

  /**
   * Finds the policy file of a repository root.
   *
   * @param root repository root
   * @return first existing candidate file, if any
   */
  public static Optional<Path> locate(Path root) {
    Objects.requireNonNull(root, "root");
    for (String name : DEFAULT_FILE_NAMES) {
      Path candidate = root.resolve(name);
      if (Files.isRegularFile(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  /**
   * Loads the policy found at the repository root, or the default policy when none exists.
   *
   * @param root repository root
   * @return parsed policy
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static PolicyConfig loadFromRoot(Path root) throws IOException {
    Optional<Path> located = locate(root);
    return located.isPresent() ? load(located.get()) : PolicyConfig.defaults();
  }

  /**
   * Loads a policy file.
   *
   * @param path policy file; a missing file yields {@link PolicyConfig#defaults()}
   * @return parsed policy
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static PolicyConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return PolicyConfig.defaults();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return PolicyConfig.defaults();
      }
      return parse(asMap(document, "root"));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML policy at " + path, ex);
    }
  }

  static PolicyConfig parse(Map<String, Object> root) {
    EnforcementSettings enforcement = parseEnforcement(asMapOrEmpty(root.get("enforcement"), "enforcement"));
    List<String> reviewers = toStringList(root.get("reviewers"), "reviewers");
    Map<String, Object> integrations = asMapOrEmpty(root.get("integrations"), "integrations");
    AgentSettings agents = parseAgents(asMapOrEmpty(integrations.get("agents"), "integrations.agents"));
    return new PolicyConfig(enforcement, reviewers, agents);
  }

  private static EnforcementSettings parseEnforcement(Map<String, Object> map) {
    EnforcementSettings defaults = EnforcementSettings.defaults();
    Object coverageNode = map.get("min_coverage");
    Double minCoverage = coverageNode == null ? null : toDouble(coverageNode, "enforcement.min_coverage");
    return new EnforcementSettings(
        toBoolean(map.get("ai_composed_requires_high_scrutiny"),
            defaults.aiComposedRequiresHighScrutiny(), "enforcement.ai_composed_requires_high_scrutiny"),
        minCoverage,
        toBoolean(map.get("ignore_unannotated"), defaults.ignoreUnannotated(), "enforcement.ignore_unannotated"),
        toBoolean(map.get("reopened_counts_as_certified"),
            defaults.reopenedCountsAsCertified(), "enforcement.reopened_counts_as_certified"),
        toBoolean(map.get("fail_on_orphans"), defaults.failOnOrphans(), "enforcement.fail_on_orphans"));
  }

  private static AgentSettings parseAgents(Map<String, Object> map) {
    if (map.isEmpty()) {
      return AgentSettings.disabled();
    }
    boolean enabled = toBoolean(map.get("enabled"), false, "integrations.agents.enabled");
    Set<String> allowedIds = new LinkedHashSet<>(toStringList(map.get("allowed_ids"), "integrations.agents.allowed_ids"));
    boolean coverageCredit = toBoolean(map.get("allow_coverage_credit"), false, "integrations.agents.allow_coverage_credit");
    Scrutiny defaultScrutiny = toOptionalScrutiny(map.get("default_scrutiny"), "integrations.agents.default_scrutiny");

    List<AgentPermission> permissions = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    Object reviewersNode = map.get("reviewers");
    if (reviewersNode != null) {
      if (!(reviewersNode instanceof Iterable<?> iterable)) {
        throw new IllegalArgumentException("integrations.agents.reviewers must be a list");
      }
      for (Object node : iterable) {
        AgentPermission permission = parsePermission(asMap(node, "integrations.agents.reviewers[]"));
        if (!seen.add(permission.id())) {
          throw new IllegalArgumentException("Duplicate agent permission id: " + permission.id());
        }
        permissions.add(permission);
      }
    }
    return new AgentSettings(enabled, allowedIds, coverageCredit, defaultScrutiny, permissions);
  }

  private static AgentPermission parsePermission(Map<String, Object> map) {
    Object idNode = map.get("id");
    if (idNode == null || idNode.toString().isBlank()) {
      throw new IllegalArgumentException("Agent permission requires an id");
    }
    String id = idNode.toString().trim();
    Scrutiny max = toOptionalScrutiny(map.get("max_scrutiny"), "max_scrutiny of agent " + id);
    boolean allowFinalize = toBoolean(map.get("allow_finalize"), false, "allow_finalize of agent " + id);
    Object notes = map.get("notes");
    return new AgentPermission(id, max == null ? Scrutiny.AUTO : max, allowFinalize, notes == null ? null : notes.toString());
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Map<String, Object> asMapOrEmpty(Object node, String context) {
    return node == null ? Map.of() : asMap(node, context);
  }

  private static List<String> toStringList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new IllegalArgumentException(context + " must be a list");
    }
    List<String> values = new ArrayList<>();
    for (Object value : iterable) {
      if (value != null && !value.toString().isBlank()) {
        values.add(value.toString().trim());
      }
    }
    return List.copyOf(values);
  }

  private static boolean toBoolean(Object value, boolean defaultValue, String context) {
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return Boolean.parseBoolean(str.trim());
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }

  private static double toDouble(Object value, String context) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Double.parseDouble(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid number for " + context + ": " + value);
  }

  private static Scrutiny toOptionalScrutiny(Object value, String context) {
    if (value == null || value.toString().isBlank()) {
      return null;
    }
    return Scrutiny.parse(value.toString())
        .orElseThrow(() -> new IllegalArgumentException("Invalid scrutiny for " + context + ": " + value));
  }
}
