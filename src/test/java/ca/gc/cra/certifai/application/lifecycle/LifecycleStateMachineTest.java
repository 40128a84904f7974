package ca.gc.cra.certifai.application.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.certifai.config.AgentPermission;
import ca.gc.cra.certifai.config.AgentSettings;
import ca.gc.cra.certifai.config.EnforcementSettings;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.error.AgentPermissionException;
import ca.gc.cra.certifai.domain.error.LifecycleException;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.Attribution;
import ca.gc.cra.certifai.domain.model.HistoryEntries;
import ca.gc.cra.certifai.domain.model.LifecycleAction;
import ca.gc.cra.certifai.domain.model.ReviewerKind;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LifecycleStateMachineTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
  private static final Instant T1 = Instant.parse("2026-03-02T10:00:00Z");
  private static final ArtifactId ID = ArtifactId.parse("src/p/A.java::p.A.run()");

  private final LifecycleStateMachine machine = new LifecycleStateMachine(policy(
      List.of(),
      new AgentSettings(true, Set.of(), false, null, List.of(
          new AgentPermission("bot-x", Scrutiny.MEDIUM, false, null),
          new AgentPermission("bot-final", Scrutiny.HIGH, true, null)))));

  @Test
  void annotateRecordsComposerAndAttribution() {
    TagMetadata metadata = machine.annotate("gpt-4o", "draft",
        Optional.of(new Attribution("0123456789abcdef", "dana")), T0);

    assertEquals("gpt-4o", metadata.aiComposed());
    assertTrue(metadata.isPendingCertification());
    assertEquals(Scrutiny.AUTO, metadata.scrutiny());
    assertEquals("draft", metadata.notes());
    assertEquals(List.of("2026-03-01T10:00:00Z annotated ai_composed=gpt-4o last_commit=0123456 author=dana"),
        metadata.history());
  }

  @Test
  void annotateWithoutAttributionRecordsUnknownCommit() {
    TagMetadata metadata = machine.annotate("  ", null, Optional.empty(), T0);

    assertEquals(TagMetadata.PENDING, metadata.aiComposed());
    assertEquals(Map.of("ai_composed", "pending", "last_commit", "unknown"),
        HistoryEntries.attributes(metadata.history().get(0)));
  }

  @Test
  void certifySetsReviewerAndAppendsHistory() throws Exception {
    TagMetadata annotated = machine.annotate("gpt", null, Optional.empty(), T0);

    TagMetadata certified = machine.certify(annotated, "alice", Scrutiny.HIGH, "checked", false, T1);

    assertEquals("alice", certified.humanCertified());
    assertEquals(Scrutiny.HIGH, certified.scrutiny());
    assertEquals(T1, certified.date());
    assertEquals("checked", certified.notes());
    assertEquals(ReviewerKind.HUMAN, certified.reviewers().get(0).kind());
    assertEquals(annotated.history(), certified.history().subList(0, 1));
    assertEquals(Optional.of(LifecycleAction.CERTIFIED), HistoryEntries.action(certified.history().get(1)));
  }

  @Test
  void certifyRejectsAlreadyCertifiedUnlessIncludeExisting() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", null, Optional.empty(), T0),
        "alice", Scrutiny.LOW, null, false, T0);

    assertThrows(LifecycleException.class,
        () -> machine.certify(certified, "bob", Scrutiny.HIGH, null, false, T1));

    TagMetadata refreshed = machine.certify(certified, "bob", Scrutiny.HIGH, null, true, T1);
    assertEquals("bob", refreshed.humanCertified());
    assertEquals(2, refreshed.reviewers().size());
  }

  @Test
  void certifyRejectsReviewerOutsideAllowList() {
    LifecycleStateMachine strict = new LifecycleStateMachine(policy(List.of("alice"), AgentSettings.disabled()));

    assertThrows(LifecycleException.class,
        () -> strict.certify(TagMetadata.empty(), "mallory", Scrutiny.HIGH, null, false, T0));
  }

  @Test
  void certifyRejectsFinalizedArtifact() {
    TagMetadata done = TagMetadata.builder().humanCertified("alice").done(true).build();

    assertThrows(LifecycleException.class,
        () -> machine.certify(done, "alice", Scrutiny.HIGH, null, true, T0));
  }

  @Test
  void agentAboveMaxScrutinyIsDeniedAndMetadataUnchanged() {
    TagMetadata annotated = machine.annotate("gpt", null, Optional.empty(), T0);
    TagMetadata snapshot = annotated.toBuilder().build();

    AgentPermissionException ex = assertThrows(AgentPermissionException.class,
        () -> machine.certifyAgent(annotated, "bot-x", Scrutiny.HIGH, null, T1));

    assertEquals("bot-x", ex.agentId());
    assertTrue(ex.getMessage().contains("max_scrutiny medium"), ex.getMessage());
    assertEquals(snapshot, annotated);
  }

  @Test
  void agentWithinMaxScrutinyIsRecordedWithoutChangingHumanCertification() throws Exception {
    TagMetadata annotated = machine.annotate("gpt", null, Optional.empty(), T0);

    TagMetadata reviewed = machine.certifyAgent(annotated, "bot-x", Scrutiny.LOW, "lint ok", T1);

    assertTrue(reviewed.isPendingCertification());
    assertEquals(Scrutiny.AUTO, reviewed.scrutiny());
    assertEquals(ReviewerKind.AGENT, reviewed.latestReviewer().orElseThrow().kind());
    assertEquals(Scrutiny.LOW, reviewed.latestReviewer().orElseThrow().scrutiny());
    assertEquals(Optional.of(LifecycleAction.AGENT_CERTIFIED),
        HistoryEntries.action(reviewed.history().get(reviewed.history().size() - 1)));
  }

  @Test
  void agentScrutinyFallsBackToDefaultThenMax() throws Exception {
    LifecycleStateMachine withDefault = new LifecycleStateMachine(policy(List.of(),
        new AgentSettings(true, Set.of(), false, Scrutiny.LOW,
            List.of(new AgentPermission("bot-x", Scrutiny.MEDIUM, false, null)))));

    assertEquals(Scrutiny.LOW,
        withDefault.certifyAgent(TagMetadata.empty(), "bot-x", null, null, T0).reviewers().get(0).scrutiny());
    assertEquals(Scrutiny.MEDIUM,
        machine.certifyAgent(TagMetadata.empty(), "bot-x", null, null, T0).reviewers().get(0).scrutiny());
  }

  @Test
  void unknownOrDisabledAgentsAreDenied() {
    LifecycleStateMachine disabled = new LifecycleStateMachine(policy(List.of(), AgentSettings.disabled()));
    LifecycleStateMachine filtered = new LifecycleStateMachine(policy(List.of(),
        new AgentSettings(true, Set.of("other"), false, null,
            List.of(new AgentPermission("bot-x", Scrutiny.HIGH, true, null)))));

    assertThrows(AgentPermissionException.class,
        () -> machine.certifyAgent(TagMetadata.empty(), "stranger", Scrutiny.LOW, null, T0));
    assertThrows(AgentPermissionException.class,
        () -> disabled.certifyAgent(TagMetadata.empty(), "bot-x", Scrutiny.LOW, null, T0));
    assertThrows(AgentPermissionException.class,
        () -> filtered.certifyAgent(TagMetadata.empty(), "bot-x", Scrutiny.LOW, null, T0));
  }

  @Test
  void finalizeBuildsRegistryEntryAndMinimalProjection() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", null, Optional.empty(), T0),
        "alice", Scrutiny.HIGH, null, false, T0);

    Finalization finalization = machine.finalize(ID, certified, "d1", T1);

    RegistryEntry entry = finalization.entry();
    assertEquals(ID, entry.id());
    assertEquals("d1", entry.digest());
    assertEquals(T1, entry.finalizedAt());
    assertTrue(entry.metadata().done());
    assertEquals(certified.history(), entry.metadata().history().subList(0, certified.history().size()));
    assertEquals("2026-03-02T10:00:00Z finalized digest=d1",
        entry.metadata().history().get(entry.metadata().history().size() - 1));
    assertEquals(TagMetadata.builder().humanCertified("alice").done(true).build(), finalization.inline());
  }

  @Test
  void finalizeRequiresQualifyingReviewer() {
    TagMetadata annotated = machine.annotate("gpt", null, Optional.empty(), T0);

    assertThrows(LifecycleException.class, () -> machine.finalize(ID, annotated, "d1", T1));
  }

  @Test
  void finalizeRejectsAgentWithoutAllowFinalize() throws Exception {
    TagMetadata reviewed = machine.certifyAgent(machine.annotate("gpt", null, Optional.empty(), T0),
        "bot-x", Scrutiny.MEDIUM, null, T0);

    assertThrows(AgentPermissionException.class, () -> machine.finalize(ID, reviewed, "d1", T1));

    TagMetadata finalBot = machine.certifyAgent(reviewed, "bot-final", Scrutiny.HIGH, null, T1);
    assertTrue(machine.finalize(ID, finalBot, "d1", T1).entry().metadata().done());
  }

  @Test
  void finalizeRejectsStaleReviewsUnlessTheyCount() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", null, Optional.empty(), T0),
        "alice", Scrutiny.HIGH, null, false, T0);
    RegistryEntry entry = machine.finalize(ID, certified, "d1", T0).entry();
    TagMetadata reopened = machine.reopen(entry, "d2", "digest-mismatch", T1);

    assertThrows(LifecycleException.class, () -> machine.finalize(ID, reopened, "d2", T1));

    LifecycleStateMachine lenient = new LifecycleStateMachine(new PolicyConfig(
        new EnforcementSettings(true, null, false, true, false), List.of(), AgentSettings.disabled()));
    assertTrue(lenient.finalize(ID, reopened, "d2", T1).entry().metadata().done());
  }

  @Test
  void finalizeCountsOnlyReviewersAddedSinceReopening() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", null, Optional.empty(), T0),
        "alice", Scrutiny.HIGH, null, false, T0);
    RegistryEntry entry = machine.finalize(ID, certified, "d1", T0).entry();
    TagMetadata recertified = machine.certify(machine.reopen(entry, "d2", "digest-mismatch", T1),
        "mallory", Scrutiny.HIGH, null, false, T1);

    LifecycleStateMachine restricted = new LifecycleStateMachine(policy(List.of("alice"), AgentSettings.disabled()));

    assertEquals(List.of("mallory"), recertified.currentReviewers().stream().map(r -> r.id()).toList());
    LifecycleException error = assertThrows(LifecycleException.class,
        () -> restricted.finalize(ID, recertified, "d2", T1));
    assertTrue(error.getMessage().contains("no reviewer that satisfies the policy"), error.getMessage());
  }

  @Test
  void humanMayRecertifyAfterAgentReviewOfReopenedArtifact() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", null, Optional.empty(), T0),
        "alice", Scrutiny.HIGH, null, false, T0);
    RegistryEntry entry = machine.finalize(ID, certified, "d1", T0).entry();
    TagMetadata agentReviewed = machine.certifyAgent(machine.reopen(entry, "d2", "digest-mismatch", T1),
        "bot-x", Scrutiny.AUTO, null, T1);

    assertTrue(agentReviewed.isHumanCertificationStale());
    TagMetadata recertified = machine.certify(agentReviewed, "bob", Scrutiny.HIGH, null, false, T1);
    assertFalse(recertified.isHumanCertificationStale());
    assertEquals(2, recertified.currentReviewers().size());
  }

  @Test
  void finalizeRejectsAlreadyFinalized() {
    TagMetadata done = TagMetadata.builder().humanCertified("alice").done(true).build();

    assertThrows(LifecycleException.class, () -> machine.finalize(ID, done, "d1", T0));
  }

  @Test
  void reopenRestoresFullRecordAndAppendsOneEntry() throws Exception {
    TagMetadata certified = machine.certify(machine.annotate("gpt", "n", Optional.empty(), T0),
        "alice", Scrutiny.HIGH, null, false, T0);
    RegistryEntry entry = machine.finalize(ID, certified, "d1", T0).entry();

    TagMetadata restored = machine.reopen(entry, "d2", "digest-mismatch", T1);

    assertFalse(restored.done());
    assertTrue(restored.isStale());
    assertEquals(entry.metadata().reviewers(), restored.reviewers());
    assertEquals(entry.metadata().history().size() + 1, restored.history().size());
    assertEquals(Map.of("reason", "digest-mismatch", "previous_digest", "d1", "digest", "d2"),
        HistoryEntries.attributes(restored.history().get(restored.history().size() - 1)));
  }

  @Test
  void everyTransitionOnlyAppendsHistory() throws Exception {
    TagMetadata metadata = machine.annotate("gpt", null, Optional.empty(), T0);
    List<String> previous = metadata.history();

    metadata = machine.certifyAgent(metadata, "bot-x", Scrutiny.LOW, null, T0);
    assertHistoryExtends(previous, metadata.history());
    previous = metadata.history();

    metadata = machine.certify(metadata, "alice", Scrutiny.HIGH, null, false, T0);
    assertHistoryExtends(previous, metadata.history());
    previous = metadata.history();

    RegistryEntry entry = machine.finalize(ID, metadata, "d1", T1).entry();
    assertHistoryExtends(previous, entry.metadata().history());
    previous = entry.metadata().history();

    metadata = machine.reopen(entry, "d2", "digest-mismatch", T1);
    assertHistoryExtends(previous, metadata.history());
  }

  private static void assertHistoryExtends(List<String> before, List<String> after) {
    assertEquals(before.size() + 1, after.size());
    assertEquals(before, after.subList(0, before.size()));
  }

  private static PolicyConfig policy(List<String> reviewers, AgentSettings agents) {
    return new PolicyConfig(EnforcementSettings.defaults(), reviewers, agents);
  }
}
