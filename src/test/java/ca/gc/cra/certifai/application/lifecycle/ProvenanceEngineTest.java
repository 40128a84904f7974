package ca.gc.cra.certifai.application.lifecycle;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.certifai.application.port.AttributionPort;
import ca.gc.cra.certifai.config.AgentPermission;
import ca.gc.cra.certifai.config.AgentSettings;
import ca.gc.cra.certifai.config.EnforcementSettings;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.error.AgentPermissionException;
import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.error.LifecycleException;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.Attribution;
import ca.gc.cra.certifai.domain.model.HistoryEntries;
import ca.gc.cra.certifai.domain.model.LifecycleAction;
import ca.gc.cra.certifai.domain.model.LifecycleStage;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.policy.ViolationKind;
import ca.gc.cra.certifai.domain.registry.Registry;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import ca.gc.cra.certifai.infrastructure.java.CertifaiAnnotationCodec;
import ca.gc.cra.certifai.infrastructure.java.JavaSourceRewriter;
import ca.gc.cra.certifai.infrastructure.java.JavaSourceScanner;
import ca.gc.cra.certifai.infrastructure.registry.YamlRegistryStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProvenanceEngineTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
  private static final String CALC = """
      package p;

      /** Arithmetic helpers. */
      public class Calc {
        public int add(int a, int b) {
          return a + b;
        }

        public int sub(int a, int b) {
          return a - b;
        }
      }
      """;
  private static final ArtifactId TYPE = ArtifactId.parse("src/p/Calc.java::p.Calc");
  private static final ArtifactId ADD = ArtifactId.parse("src/p/Calc.java::p.Calc.add(int, int)");
  private static final ArtifactId SUB = ArtifactId.parse("src/p/Calc.java::p.Calc.sub(int, int)");

  @TempDir Path root;

  private Path source;
  private YamlRegistryStore store;
  private FixedClock clock;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() throws IOException {
    source = root.resolve("src/p/Calc.java");
    Files.createDirectories(source.getParent());
    Files.writeString(source, CALC, StandardCharsets.UTF_8);
    store = new YamlRegistryStore(root.resolve(".certifai/registry.yml"), Duration.ofSeconds(5));
    clock = new FixedClock(T0);
    metrics = new RecordingMetricsPort();
  }

  @Test
  void artifactMovesThroughEveryStage() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    assertEquals(LifecycleStage.PRISTINE, stage(engine, ADD));

    TagMetadata annotated = engine.annotate(ADD, "gpt-4o", "first draft");
    assertEquals(LifecycleStage.ANNOTATED, stage(engine, ADD));
    assertEquals(annotated, record(engine, ADD).metadata());

    clock.advance(Duration.ofHours(1));
    engine.certify(ADD, "alice", Scrutiny.HIGH, "reviewed", false);
    assertEquals(LifecycleStage.UNDER_REVIEW, stage(engine, ADD));

    clock.advance(Duration.ofHours(1));
    RegistryEntry entry = engine.finalize(ADD);
    assertEquals(LifecycleStage.FINALIZED, stage(engine, ADD));
    assertEquals(LifecycleStage.PRISTINE, stage(engine, TYPE));

    Registry registry = store.load();
    assertEquals(entry, registry.get(ADD).orElseThrow());
    assertEquals(3, entry.metadata().history().size());
    assertEquals(entry.metadata(), record(engine, ADD).metadata());
    String text = Files.readString(source, StandardCharsets.UTF_8);
    assertTrue(text.contains("  @Certifai(humanCertified = \"alice\", done = true)\n  public int add("), text);
    assertTrue(text.contains("import ca.gc.cra.certifai.annotation.Certifai;"), text);
    assertEquals(1, metrics.count("certifai.transition.annotated"));
    assertEquals(1, metrics.count("certifai.transition.certified"));
    assertEquals(1, metrics.count("certifai.transition.finalized"));
  }

  @Test
  void annotateRecordsAttributionWhenAvailable() throws Exception {
    ProvenanceEngine engine = new ProvenanceEngine(root, scanner(), writer(), store,
        (file, span) -> Optional.of(new Attribution("feedbeef1234", "dana")), clock, metrics, PolicyConfig.defaults());

    TagMetadata annotated = engine.annotate(SUB, "gpt", null);

    assertEquals("feedbee", HistoryEntries.attributes(annotated.history().get(0)).get("last_commit"));
    assertEquals("dana", HistoryEntries.attributes(annotated.history().get(0)).get("author"));
  }

  @Test
  void reconcileWithoutEditsChangesNothing() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    finalizeAdd(engine);
    byte[] registryBefore = Files.readAllBytes(store.location());
    byte[] sourceBefore = Files.readAllBytes(source);

    ReconcileReport report = engine.reconcile();

    assertTrue(report.isClean(), report.toString());
    assertArrayEquals(registryBefore, Files.readAllBytes(store.location()));
    assertArrayEquals(sourceBefore, Files.readAllBytes(source));
  }

  @Test
  void editedFinalizedArtifactIsReopenedWithFullRecord() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    RegistryEntry entry = finalizeAdd(engine);
    edit("return a + b;", "return b + a;");
    clock.advance(Duration.ofDays(1));

    ReconcileReport report = engine.reconcile();

    assertEquals(1, report.reopened().size());
    ReopenedArtifact reopened = report.reopened().get(0);
    assertEquals(ADD, reopened.id());
    assertEquals(entry.digest(), reopened.previousDigest());
    assertFalse(store.load().contains(ADD));
    assertEquals("digest-mismatch", store.load().archive().get(0).reason());

    TagMetadata inline = record(engine, ADD).metadata();
    assertFalse(inline.done());
    assertTrue(inline.isStale());
    assertEquals(entry.metadata().reviewers(), inline.reviewers());
    assertEquals(entry.metadata().history(), inline.history().subList(0, entry.metadata().history().size()));
    assertEquals(entry.metadata().history().size() + 1, inline.history().size());
    assertEquals(LifecycleStage.ANNOTATED, stage(engine, ADD));
    assertEquals(1, metrics.count("certifai.reconcile.reopened"));

    assertTrue(engine.reconcile().isClean());
  }

  @Test
  void reopenedArtifactMustBeRecertifiedBeforeFinalizing() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    finalizeAdd(engine);
    edit("return a + b;", "return a + b + 0;");
    engine.reconcile();

    assertThrows(LifecycleException.class, () -> engine.finalize(ADD));

    engine.certify(ADD, "bob", Scrutiny.HIGH, null, false);
    RegistryEntry second = engine.finalize(ADD);
    assertEquals("bob", second.metadata().humanCertified());
  }

  @Test
  void agentReviewAfterReopenLeavesPriorHumanCertificationStale() throws Exception {
    PolicyConfig policy = new PolicyConfig(new EnforcementSettings(true, 1.0, true, false, false), List.of(),
        new AgentSettings(true, Set.of("bot-x"), false, null,
            List.of(new AgentPermission("bot-x", Scrutiny.MEDIUM, false, null))));
    ProvenanceEngine engine = engine(policy);
    finalizeAdd(engine);
    assertTrue(engine.check().passed());
    edit("return a + b;", "return a - b;");
    engine.reconcile();

    engine.certifyAgent(ADD, "bot-x", Scrutiny.AUTO, null);

    TagMetadata inline = record(engine, ADD).metadata();
    assertFalse(inline.isStale());
    assertTrue(inline.isHumanCertificationStale());
    assertEquals(1, inline.currentReviewers().size());
    PolicyReport report = engine.check();
    assertEquals(0, report.certifiedCount());
    assertEquals(List.of(ADD), report.pending());
    assertEquals(1, report.violationsOf(ViolationKind.AI_COMPOSED_REQUIRES_HIGH_SCRUTINY).size());
    assertThrows(AgentPermissionException.class, () -> engine.finalize(ADD));
    assertFalse(store.load().contains(ADD));

    engine.certify(ADD, "bob", Scrutiny.HIGH, null, false);
    assertTrue(engine.check().passed());
    assertEquals("bob", engine.finalize(ADD).metadata().humanCertified());
  }

  @Test
  void recertifyingFinalizedArtifactRestoresItFromRegistry() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    RegistryEntry entry = finalizeAdd(engine);

    assertThrows(LifecycleException.class, () -> engine.certify(ADD, "bob", Scrutiny.HIGH, null, false));

    TagMetadata recertified = engine.certify(ADD, "bob", Scrutiny.HIGH, "second look", true);

    assertEquals("bob", recertified.humanCertified());
    assertFalse(recertified.isStale());
    assertEquals(entry.metadata().history().size() + 2, recertified.history().size());
    String reopenedEntry = recertified.history().get(entry.metadata().history().size());
    assertEquals(Optional.of(LifecycleAction.REOPENED), HistoryEntries.action(reopenedEntry));
    assertEquals("recertify", HistoryEntries.attributes(reopenedEntry).get("reason"));
    Registry registry = store.load();
    assertFalse(registry.contains(ADD));
    assertEquals("recertify", registry.archive().get(0).reason());
    assertEquals(recertified, record(engine, ADD).metadata());
  }

  @Test
  void agentAboveMaxScrutinyLeavesSourceUntouched() throws Exception {
    ProvenanceEngine engine = engine(agentPolicy(false));
    engine.annotate(ADD, "gpt", null);
    byte[] before = Files.readAllBytes(source);

    assertThrows(AgentPermissionException.class, () -> engine.certifyAgent(ADD, "bot-x", Scrutiny.HIGH));

    assertArrayEquals(before, Files.readAllBytes(source));
    assertEquals(1, metrics.count("certifai.transition.denied"));
  }

  @Test
  void agentReviewWithinLimitsIsRecordedInline() throws Exception {
    ProvenanceEngine engine = engine(agentPolicy(true));
    engine.annotate(ADD, "gpt", null);

    TagMetadata reviewed = engine.certifyAgent(ADD, "bot-x", null, "automated");

    assertEquals(Scrutiny.MEDIUM, reviewed.latestReviewer().orElseThrow().scrutiny());
    assertEquals(reviewed, record(engine, ADD).metadata());
    assertEquals(1, metrics.count("certifai.transition.agent-certified"));
    assertTrue(engine.finalize(ADD).metadata().done());
  }

  @Test
  void invalidRequestsAreRejected() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());

    assertThrows(LifecycleException.class, () -> engine.certify(ADD, "alice", Scrutiny.HIGH, null, false));
    assertThrows(LifecycleException.class,
        () -> engine.annotate(ArtifactId.parse("src/p/Calc.java::p.Calc.mul(int, int)"), "gpt", null));
    assertThrows(IllegalArgumentException.class,
        () -> engine.annotate(ArtifactId.parse("../Outside.java::Outside"), "gpt", null));
    engine.annotate(ADD, "gpt", null);
    assertThrows(LifecycleException.class, () -> engine.annotate(ADD, "gpt", null));
    assertThrows(IllegalArgumentException.class, () -> engine.certify(ADD, "alice smith", Scrutiny.HIGH, null, false));
    assertThrows(LifecycleException.class, () -> engine.finalize(ADD));
  }

  @Test
  void finalizingTwiceIsRejected() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    finalizeAdd(engine);

    assertThrows(LifecycleException.class, () -> engine.finalize(ADD));
  }

  @Test
  void malformedAnnotationIsReportedForThatArtifact() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    edit("  public int add(", "  @Certifai(scrutiny = \"extreme\")\n  public int add(");

    assertThrows(AnnotationCorruptionException.class, () -> engine.certify(ADD, "alice", Scrutiny.HIGH, null, false));
    ScanReport report = engine.scan();
    assertTrue(report.find(ADD).isEmpty());
    assertTrue(report.find(SUB).isPresent());
    assertEquals(1, report.problems().size());
  }

  @Test
  void annotateAllCoversEveryPristineArtifactOnce() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    engine.annotate(SUB, "human", null);

    List<ArtifactId> annotated = engine.annotateAll("gpt", "batch");

    assertEquals(List.of(TYPE, ADD), annotated);
    assertEquals("human", record(engine, SUB).metadata().aiComposed());
    assertEquals("gpt", record(engine, TYPE).metadata().aiComposed());
    assertTrue(engine.annotateAll("gpt", null).isEmpty());
  }

  @Test
  void annotateAllIsNoOpWhenUnannotatedArtifactsAreIgnored() throws Exception {
    ProvenanceEngine engine = engine(new PolicyConfig(
        new EnforcementSettings(true, null, true, false, false), List.of(), AgentSettings.disabled()));

    assertTrue(engine.annotateAll("gpt", null).isEmpty());
    assertEquals(CALC, Files.readString(source, StandardCharsets.UTF_8));
  }

  @Test
  void finalizeAllSkipsArtifactsThatDoNotQualify() throws Exception {
    ProvenanceEngine engine = engine(PolicyConfig.defaults());
    engine.annotateAll("gpt", null);
    engine.certify(SUB, "alice", Scrutiny.HIGH, null, false);
    engine.certify(TYPE, "alice", Scrutiny.HIGH, null, false);

    List<RegistryEntry> created = engine.finalizeAll();

    assertEquals(List.of(TYPE, SUB), created.stream().map(RegistryEntry::id).toList());
    assertEquals(LifecycleStage.ANNOTATED, stage(engine, ADD));
    assertEquals(LifecycleStage.FINALIZED, stage(engine, SUB));
    assertEquals(LifecycleStage.FINALIZED, stage(engine, TYPE));
    assertEquals(2, store.load().size());
    assertTrue(engine.finalizeAll().isEmpty());
  }

  @Test
  void checkAppliesCoverageThreshold() throws Exception {
    PolicyConfig policy = new PolicyConfig(
        new EnforcementSettings(false, 0.5, false, false, false), List.of(), AgentSettings.disabled());
    ProvenanceEngine engine = engine(policy);
    engine.annotateAll("gpt", null);
    engine.certify(ADD, "alice", Scrutiny.LOW, null, false);

    PolicyReport failing = engine.check();
    assertEquals(1, failing.certifiedCount());
    assertEquals(3, failing.eligibleCount());
    assertEquals(1, failing.violationsOf(ViolationKind.MIN_COVERAGE).size());
    assertEquals(List.of(TYPE, SUB), failing.pending());

    engine.certify(SUB, "alice", Scrutiny.LOW, null, false);
    engine.finalize(SUB);
    PolicyReport passing = engine.check();
    assertTrue(passing.passed(), passing.violations().toString());
    assertEquals(2, passing.certifiedCount());
  }

  @Test
  void checkReportsOrphansWhenConfigured() throws Exception {
    PolicyConfig policy = new PolicyConfig(
        new EnforcementSettings(false, null, true, false, true), List.of(), AgentSettings.disabled());
    ProvenanceEngine engine = engine(policy);
    finalizeAdd(engine);
    Files.delete(source);

    ScanReport scan = engine.scan();
    PolicyReport report = engine.check();

    assertEquals(List.of(ADD), scan.orphans());
    assertEquals(1, report.violationsOf(ViolationKind.ORPHANED_REGISTRY_ENTRY).size());
    assertFalse(report.passed());
  }

  @Test
  void rootMustBeADirectory() {
    assertThrows(IllegalArgumentException.class, () -> new ProvenanceEngine(source, scanner(), writer(), store,
        AttributionPort.NONE, clock, metrics, PolicyConfig.defaults()));
  }

  private RegistryEntry finalizeAdd(ProvenanceEngine engine) throws Exception {
    engine.annotate(ADD, "gpt", null);
    engine.certify(ADD, "alice", Scrutiny.HIGH, null, false);
    return engine.finalize(ADD);
  }

  private void edit(String from, String to) throws IOException {
    String text = Files.readString(source, StandardCharsets.UTF_8);
    assertTrue(text.contains(from), text);
    Files.writeString(source, text.replace(from, to), StandardCharsets.UTF_8);
  }

  private ProvenanceEngine engine(PolicyConfig policy) {
    return new ProvenanceEngine(root, scanner(), writer(), store, AttributionPort.NONE, clock, metrics, policy);
  }

  private JavaSourceScanner scanner() {
    return new JavaSourceScanner(List.of("**/.certifai/**"), 2, metrics);
  }

  private static JavaSourceRewriter writer() {
    return new JavaSourceRewriter(new CertifaiAnnotationCodec());
  }

  private static PolicyConfig agentPolicy(boolean allowFinalize) {
    return new PolicyConfig(EnforcementSettings.defaults(), List.of(), new AgentSettings(true, Set.of("bot-x"), true,
        null, List.of(new AgentPermission("bot-x", Scrutiny.MEDIUM, allowFinalize, null))));
  }

  private static ArtifactRecord record(ProvenanceEngine engine, ArtifactId id) throws IOException {
    return engine.scan().find(id).orElseThrow(() -> new AssertionError("no record for " + id));
  }

  private static LifecycleStage stage(ProvenanceEngine engine, ArtifactId id) throws IOException {
    return record(engine, id).stage();
  }
}
