package ca.gc.cra.certifai.application.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.certifai.config.AgentPermission;
import ca.gc.cra.certifai.config.AgentSettings;
import ca.gc.cra.certifai.config.EnforcementSettings;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactKind;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.HistoryEntries;
import ca.gc.cra.certifai.domain.model.LifecycleAction;
import ca.gc.cra.certifai.domain.model.LifecycleStage;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.SourceSpan;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.policy.PolicyViolation;
import ca.gc.cra.certifai.domain.policy.ViolationKind;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PolicyEvaluatorTest {
  private static final Instant T0 = Instant.parse("2026-02-02T12:00:00Z");
  private static final SourceSpan SPAN = new SourceSpan(3, 3, 5, 3);
  private static final SourceSpan ANNOTATION_SPAN = new SourceSpan(2, 3, 2, 40);

  private final PolicyEvaluator evaluator = new PolicyEvaluator();

  @Test
  void agentCoverageCreditCountsQualifyingAgentReviews() {
    List<ArtifactRecord> records = tenArtifacts();

    PolicyReport atThreshold = evaluator.evaluate(records, policy(0.8, true));
    PolicyReport aboveThreshold = evaluator.evaluate(records, policy(0.9, true));

    assertEquals(0.8d, atThreshold.coverageRatio(), 1e-9);
    assertEquals(8, atThreshold.certifiedCount());
    assertEquals(10, atThreshold.eligibleCount());
    assertEquals(0.2d, atThreshold.agentRatio(), 1e-9);
    assertTrue(atThreshold.passed(), atThreshold.violations().toString());
    assertEquals(List.of(id("M8"), id("M9")), atThreshold.pending());

    assertEquals(1, aboveThreshold.violations().size());
    PolicyViolation violation = aboveThreshold.violations().get(0);
    assertEquals(ViolationKind.MIN_COVERAGE, violation.kind());
    assertEquals("Coverage 8/10 (80.00%) below required 90%", violation.message());
  }

  @Test
  void agentReviewsDoNotCountWithoutCoverageCredit() {
    PolicyReport report = evaluator.evaluate(tenArtifacts(), policy(0.8, false));

    assertEquals(6, report.certifiedCount());
    assertEquals(0.2d, report.agentRatio(), 1e-9);
    assertEquals(1, report.violationsOf(ViolationKind.MIN_COVERAGE).size());
  }

  @Test
  void aiComposedArtifactsNeedHighScrutiny() {
    PolicyConfig policy = new PolicyConfig(EnforcementSettings.defaults(), List.of(), agents(false));
    List<ArtifactRecord> records = List.of(
        record("Medium", human("gpt", "alice", Scrutiny.MEDIUM)),
        record("High", human("gpt", "alice", Scrutiny.HIGH)),
        record("Handwritten", human(TagMetadata.PENDING, "alice", Scrutiny.LOW)),
        record("AgentHigh", agent("gpt", "bot", Scrutiny.HIGH)),
        record("Pristine", null));

    PolicyReport report = evaluator.evaluate(records, policy);

    List<PolicyViolation> violations = report.violationsOf(ViolationKind.AI_COMPOSED_REQUIRES_HIGH_SCRUTINY);
    assertEquals(1, violations.size());
    assertEquals(id("Medium"), violations.get(0).artifact());
  }

  @Test
  void staleReviewsCountOnlyWhenConfigured() {
    TagMetadata reopened = human(TagMetadata.PENDING, "alice", Scrutiny.HIGH).toBuilder()
        .addHistory(HistoryEntries.format(T0.plusSeconds(60), LifecycleAction.REOPENED,
            Map.of("reason", "digest-mismatch")))
        .build();
    List<ArtifactRecord> records = List.of(record("Reopened", reopened));

    PolicyReport strict = evaluator.evaluate(records,
        new PolicyConfig(new EnforcementSettings(false, null, false, false, false), List.of(), agents(false)));
    PolicyReport lenient = evaluator.evaluate(records,
        new PolicyConfig(new EnforcementSettings(false, null, false, true, false), List.of(), agents(false)));

    assertEquals(0, strict.certifiedCount());
    assertEquals(1, lenient.certifiedCount());
  }

  @Test
  void agentReviewAfterReopenDoesNotRevivePriorHumanCertification() {
    TagMetadata reviewedByAgent = human("gpt", "alice", Scrutiny.HIGH).toBuilder()
        .addHistory(HistoryEntries.format(T0.plusSeconds(60), LifecycleAction.REOPENED,
            Map.of("reason", "digest-mismatch")))
        .addReviewer(ReviewerInfo.agent("bot", Scrutiny.AUTO, T0.plusSeconds(120), null))
        .addHistory(HistoryEntries.format(T0.plusSeconds(120), LifecycleAction.AGENT_CERTIFIED,
            Map.of("agent", "bot", "scrutiny", "auto")))
        .build();
    List<ArtifactRecord> records = List.of(record("Drifted", reviewedByAgent));

    PolicyReport withoutCredit = evaluator.evaluate(records, new PolicyConfig(
        new EnforcementSettings(true, 1.0, false, false, false), List.of(), agents(false)));
    PolicyReport withCredit = evaluator.evaluate(records, new PolicyConfig(
        new EnforcementSettings(true, 1.0, false, false, false), List.of(), agents(true)));

    assertEquals(0, withoutCredit.certifiedCount());
    assertEquals(List.of(id("Drifted")), withoutCredit.pending());
    assertEquals(1, withoutCredit.violationsOf(ViolationKind.AI_COMPOSED_REQUIRES_HIGH_SCRUTINY).size());
    assertEquals(1, withoutCredit.violationsOf(ViolationKind.MIN_COVERAGE).size());

    assertEquals(1, withCredit.certifiedCount());
    assertEquals(1, withCredit.violationsOf(ViolationKind.AI_COMPOSED_REQUIRES_HIGH_SCRUTINY).size());
  }

  @Test
  void humanRecertificationAfterReopenIsCurrent() {
    TagMetadata recertified = human("gpt", "alice", Scrutiny.LOW).toBuilder()
        .addHistory(HistoryEntries.format(T0.plusSeconds(60), LifecycleAction.REOPENED,
            Map.of("reason", "digest-mismatch")))
        .humanCertified("bob")
        .scrutiny(Scrutiny.HIGH)
        .addReviewer(ReviewerInfo.human("bob", Scrutiny.HIGH, T0.plusSeconds(120), null))
        .addHistory(HistoryEntries.format(T0.plusSeconds(120), LifecycleAction.CERTIFIED,
            Map.of("reviewer", "bob")))
        .build();

    PolicyReport report = evaluator.evaluate(List.of(record("Recertified", recertified)), new PolicyConfig(
        new EnforcementSettings(true, 1.0, false, false, false), List.of(), agents(false)));

    assertEquals(1, report.certifiedCount());
    assertTrue(report.passed(), report.violations().toString());
  }

  @Test
  void unannotatedArtifactsAreExcludedWhenIgnored() {
    List<ArtifactRecord> records = List.of(
        record("Certified", human(TagMetadata.PENDING, "alice", Scrutiny.LOW)),
        record("Pristine", null));

    PolicyReport counted = evaluator.evaluate(records,
        new PolicyConfig(new EnforcementSettings(false, null, false, false, false), List.of(), agents(false)));
    PolicyReport ignored = evaluator.evaluate(records,
        new PolicyConfig(new EnforcementSettings(false, null, true, false, false), List.of(), agents(false)));

    assertEquals(2, counted.eligibleCount());
    assertEquals(List.of(id("Pristine")), counted.pending());
    assertEquals(1, ignored.eligibleCount());
    assertEquals(1.0d, ignored.coverageRatio(), 1e-9);
  }

  @Test
  void orphansFailOnlyWhenConfigured() {
    List<ArtifactId> orphans = List.of(ArtifactId.parse("src/Gone.java::Gone"));

    PolicyReport reported = evaluator.evaluate(List.of(), orphans,
        new PolicyConfig(new EnforcementSettings(true, null, false, false, true), List.of(), agents(false)));
    PolicyReport tolerated = evaluator.evaluate(List.of(), orphans, PolicyConfig.defaults());

    assertEquals(1, reported.violationsOf(ViolationKind.ORPHANED_REGISTRY_ENTRY).size());
    assertEquals(orphans.get(0), reported.violations().get(0).artifact());
    assertTrue(tolerated.passed());
  }

  @Test
  void emptyInputIsFullyCovered() {
    PolicyReport report = evaluator.evaluate(List.of(), policy(1.0, true));

    assertEquals(1.0d, report.coverageRatio(), 1e-9);
    assertEquals(0.0d, report.agentRatio(), 1e-9);
    assertEquals(0, report.eligibleCount());
    assertTrue(report.passed());
  }

  @Test
  void agentOverItsMaxScrutinyDoesNotQualify() {
    List<ArtifactRecord> records = List.of(record("Overreach", agent(TagMetadata.PENDING, "bot-low", Scrutiny.HIGH)));
    AgentSettings agents = new AgentSettings(true, Set.of(), true, null,
        List.of(new AgentPermission("bot-low", Scrutiny.LOW, false, null)));

    PolicyReport report = evaluator.evaluate(records,
        new PolicyConfig(new EnforcementSettings(false, null, false, false, false), List.of(), agents));

    assertEquals(0, report.certifiedCount());
    assertEquals(0.0d, report.agentRatio(), 1e-9);
  }

  private static List<ArtifactRecord> tenArtifacts() {
    List<ArtifactRecord> records = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      records.add(record("M" + i, human("gpt", "alice", Scrutiny.HIGH)));
    }
    records.add(record("M6", agent("gpt", "bot", Scrutiny.MEDIUM)));
    records.add(record("M7", agent("gpt", "bot", Scrutiny.LOW)));
    records.add(record("M8", annotated()));
    records.add(record("M9", annotated()));
    return records;
  }

  private static PolicyConfig policy(double minCoverage, boolean coverageCredit) {
    return new PolicyConfig(new EnforcementSettings(false, minCoverage, false, false, false), List.of(),
        new AgentSettings(true, Set.of("bot"), coverageCredit, null,
            List.of(new AgentPermission("bot", Scrutiny.HIGH, false, null))));
  }

  private static AgentSettings agents(boolean coverageCredit) {
    return new AgentSettings(true, Set.of("bot"), coverageCredit, null,
        List.of(new AgentPermission("bot", Scrutiny.HIGH, false, null)));
  }

  private static TagMetadata annotated() {
    return TagMetadata.builder()
        .aiComposed("gpt")
        .addHistory(HistoryEntries.format(T0, LifecycleAction.ANNOTATED, Map.of("ai_composed", "gpt")))
        .build();
  }

  private static TagMetadata human(String aiComposed, String reviewer, Scrutiny scrutiny) {
    return TagMetadata.builder()
        .aiComposed(aiComposed)
        .humanCertified(reviewer)
        .scrutiny(scrutiny)
        .date(T0)
        .addReviewer(ReviewerInfo.human(reviewer, scrutiny, T0, null))
        .addHistory(HistoryEntries.format(T0, LifecycleAction.CERTIFIED, Map.of("reviewer", reviewer)))
        .build();
  }

  private static TagMetadata agent(String aiComposed, String agentId, Scrutiny scrutiny) {
    return TagMetadata.builder()
        .aiComposed(aiComposed)
        .addReviewer(ReviewerInfo.agent(agentId, scrutiny, T0, null))
        .addHistory(HistoryEntries.format(T0, LifecycleAction.AGENT_CERTIFIED, Map.of("agent", agentId)))
        .build();
  }

  private static ArtifactId id(String name) {
    return new ArtifactId("src/p/Sample.java", "p.Sample." + name + "()");
  }

  private static ArtifactRecord record(String name, TagMetadata metadata) {
    Artifact artifact = new Artifact(id(name), Path.of("/repo/src/p/Sample.java"), ArtifactKind.METHOD, SPAN,
        metadata == null ? null : ANNOTATION_SPAN, metadata, "a".repeat(64));
    return new ArtifactRecord(artifact, metadata, LifecycleStage.of(metadata, false));
  }
}
