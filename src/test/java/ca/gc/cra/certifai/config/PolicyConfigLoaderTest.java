package ca.gc.cra.certifai.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.certifai.domain.model.Scrutiny;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PolicyConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadReadsEveryPolicySection() throws IOException {
    Path yaml = tempDir.resolve(".certifai.yml");
    Files.writeString(yaml, """
        engine:
          scanThreads: 2
        enforcement:
          ai_composed_requires_high_scrutiny: false
          min_coverage: 0.75
          ignore_unannotated: true
          reopened_counts_as_certified: true
          fail_on_orphans: true
        reviewers:
          - alice
          - bob
        integrations:
          agents:
            enabled: true
            allowed_ids: [review-bot]
            allow_coverage_credit: true
            default_scrutiny: low
            reviewers:
              - id: review-bot
                max_scrutiny: medium
                allow_finalize: true
                notes: nightly lint pass
        """);

    PolicyConfig policy = PolicyConfigLoader.load(yaml);

    EnforcementSettings enforcement = policy.enforcement();
    assertFalse(enforcement.aiComposedRequiresHighScrutiny());
    assertEquals(0.75d, enforcement.minCoverage());
    assertTrue(enforcement.ignoreUnannotated());
    assertTrue(enforcement.reopenedCountsAsCertified());
    assertTrue(enforcement.failOnOrphans());
    assertEquals(List.of("alice", "bob"), policy.reviewers());
    assertFalse(policy.admitsReviewer("carol"));

    AgentSettings agents = policy.agents();
    assertTrue(agents.enabled());
    assertEquals(Set.of("review-bot"), agents.allowedIds());
    assertTrue(agents.allowCoverageCredit());
    assertEquals(Scrutiny.LOW, agents.defaultScrutiny());
    AgentPermission permission = agents.permission("review-bot").orElseThrow();
    assertEquals(Scrutiny.MEDIUM, permission.maxScrutiny());
    assertTrue(permission.allowFinalize());
    assertEquals("nightly lint pass", permission.notes());
  }

  @Test
  void missingOrEmptyFileYieldsDefaults() throws IOException {
    Path empty = tempDir.resolve("certifai.yml");
    Files.writeString(empty, "");

    assertEquals(PolicyConfig.defaults(), PolicyConfigLoader.load(tempDir.resolve("absent.yml")));
    assertEquals(PolicyConfig.defaults(), PolicyConfigLoader.load(empty));
  }

  @Test
  void defaultsRequireHighScrutinyForAiComposedCode() {
    PolicyConfig defaults = PolicyConfig.defaults();

    assertTrue(defaults.enforcement().aiComposedRequiresHighScrutiny());
    assertNull(defaults.enforcement().minCoverage());
    assertFalse(defaults.agents().enabled());
    assertTrue(defaults.admitsReviewer("anyone"));
  }

  @Test
  void locatePrefersDotFile() throws IOException {
    assertTrue(PolicyConfigLoader.locate(tempDir).isEmpty());
    Files.writeString(tempDir.resolve("certifai.yml"), "reviewers: [bob]\n");
    assertEquals(tempDir.resolve("certifai.yml"), PolicyConfigLoader.locate(tempDir).orElseThrow());

    Files.writeString(tempDir.resolve(".certifai.yml"), "reviewers: [alice]\n");

    assertEquals(tempDir.resolve(".certifai.yml"), PolicyConfigLoader.locate(tempDir).orElseThrow());
    assertEquals(List.of("alice"), PolicyConfigLoader.loadFromRoot(tempDir).reviewers());
  }

  @Test
  void agentWithoutMaxScrutinyIsCappedAtAuto() {
    PolicyConfig policy = PolicyConfigLoader.parse(Map.of("integrations",
        Map.of("agents", Map.of("enabled", true, "reviewers", List.of(Map.of("id", "bot"))))));

    assertEquals(Scrutiny.AUTO, policy.agents().permission("bot").orElseThrow().maxScrutiny());
  }

  @Test
  void invalidStructuresAreRejected() throws IOException {
    assertThrows(IllegalArgumentException.class,
        () -> PolicyConfigLoader.parse(Map.of("enforcement", Map.of("min_coverage", 1.5))));
    assertThrows(IllegalArgumentException.class,
        () -> PolicyConfigLoader.parse(Map.of("enforcement", Map.of("min_coverage", "most"))));
    assertThrows(IllegalArgumentException.class,
        () -> PolicyConfigLoader.parse(Map.of("reviewers", "alice")));
    assertThrows(IllegalArgumentException.class, () -> PolicyConfigLoader.parse(Map.of("integrations",
        Map.of("agents", Map.of("reviewers", List.of(Map.of("id", "bot", "max_scrutiny", "extreme")))))));
    assertThrows(IllegalArgumentException.class, () -> PolicyConfigLoader.parse(Map.of("integrations",
        Map.of("agents", Map.of("reviewers", List.of(Map.of("id", "bot"), Map.of("id", "bot")))))));

    Path malformed = tempDir.resolve("broken.yml");
    Files.writeString(malformed, "enforcement: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> PolicyConfigLoader.load(malformed));
  }
}
