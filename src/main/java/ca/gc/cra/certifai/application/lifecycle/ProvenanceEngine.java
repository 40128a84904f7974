package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.policy.PolicyEvaluator;
import ca.gc.cra.certifai.application.port.AttributionPort;
import ca.gc.cra.certifai.application.port.ClockPort;
import ca.gc.cra.certifai.application.port.InlineAnnotationWriter;
import ca.gc.cra.certifai.application.port.InlineEdit;
import ca.gc.cra.certifai.application.port.MetricsPort;
import ca.gc.cra.certifai.application.port.RegistryLock;
import ca.gc.cra.certifai.application.port.RegistryStore;
import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.application.port.ScanResult;
import ca.gc.cra.certifai.application.port.SourceScanner;
import ca.gc.cra.certifai.config.PolicyConfig;
import ca.gc.cra.certifai.domain.error.AgentPermissionException;
import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.error.CertifaiException;
import ca.gc.cra.certifai.domain.error.LifecycleException;
import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.LifecycleStage;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.registry.ArchiveRecord;
import ca.gc.cra.certifai.domain.registry.Registry;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import ca.gc.cra.certifai.logging.Logs;
import ca.gc.cra.certifai.validation.Paths;
import ca.gc.cra.certifai.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Core API of the provenance lifecycle for one repository root.
 * <p><strong>Why:</strong> Collaborators (CLI, hooks, CI) drive transitions without knowing how annotations are
 * encoded or where finalized records are kept.</p>
 * <p><strong>Role:</strong> Application facade over {@link LifecycleStateMachine}, {@link Reconciler} and
 * {@link PolicyEvaluator}, wired to ports by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate artifacts afresh before each transition and write the resulting annotation back.</li>
 *   <li>Sequence registry and inline writes so an interrupted transition is recoverable by reconciliation.</li>
 *   <li>Merge registry snapshots into scan results to expose effective metadata and stages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe to share; registry mutations serialize on the registry lock, source
 * rewrites are not coordinated between concurrent callers touching the same file.</p>
 * <p><strong>Observability:</strong> Logs each transition at INFO with the {@code artifact} MDC key and increments
 * {@code certifai.transition.<action>}.</p>
 *
 * @since 0.1.0
 */
public final class ProvenanceEngine {
  private static final Logger log = LoggerFactory.getLogger(ProvenanceEngine.class);

  static final String REASON_RECERTIFY = "recertify";

  private final Path root;
  private final SourceScanner scanner;
  private final InlineAnnotationWriter writer;
  private final RegistryStore registry;
  private final AttributionPort attribution;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final PolicyConfig policy;
  private final LifecycleStateMachine machine;
  private final Reconciler reconciler;
  private final PolicyEvaluator evaluator = new PolicyEvaluator();

  /**
   * Creates an engine bound to one repository root.
   *
   * @param root repository root; must be an existing directory
   * @param scanner source scanner
   * @param writer inline annotation writer
   * @param registry registry store of the root
   * @param attribution source-control attribution; {@link AttributionPort#NONE} when unavailable
   * @param clock clock stamping transitions
   * @param metrics metrics sink
   * @param policy policy governing certification and finalization
   * @throws IllegalArgumentException when {@code root} is not a directory
   */
  public ProvenanceEngine(
      Path root,
      SourceScanner scanner,
      InlineAnnotationWriter writer,
      RegistryStore registry,
      AttributionPort attribution,
      ClockPort clock,
      MetricsPort metrics,
      PolicyConfig policy) {
    this.root = Paths.requireDirectory(root);
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.attribution = attribution == null ? AttributionPort.NONE : attribution;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.policy = Objects.requireNonNull(policy, "policy");
    this.machine = new LifecycleStateMachine(policy);
    this.reconciler = new Reconciler(this.root, scanner, writer, registry, machine, clock, this.metrics);
  }

  public Path root() {
    return root;
  }

  public PolicyConfig policy() {
    return policy;
  }

  /**
   * Scans the root and merges finalized records from the registry.
   *
   * @return records with effective metadata and derived stage, scan problems and orphaned entries
   * @throws IOException when the tree cannot be walked or the registry is corrupt
   */
  public ScanReport scan() throws IOException {
    ScanResult result = scanner.scan(root);
    Registry snapshot = registry.load();
    boolean staleCounts = policy.enforcement().reopenedCountsAsCertified();
    List<ArtifactRecord> records = new ArrayList<>(result.artifacts().size());
    for (Artifact artifact : result.artifacts()) {
      TagMetadata effective = artifact.inline();
      if (artifact.isDone()) {
        Optional<RegistryEntry> entry = snapshot.get(artifact.id());
        if (entry.isPresent()) {
          effective = entry.get().metadata();
        }
      }
      records.add(new ArtifactRecord(artifact, effective, LifecycleStage.of(effective, staleCounts)));
    }
    List<ArtifactId> orphans = new ArrayList<>();
    for (RegistryEntry entry : Reconciler.orphaned(snapshot, result)) {
      orphans.add(entry.id());
    }
    log.info("Scanned {}: {} artifacts, {} problems, {} orphaned registry entries",
        root, records.size(), result.problems().size(), orphans.size());
    return new ScanReport(records, result.problems(), orphans);
  }

  /**
   * Annotate: inserts a new provenance annotation above a Pristine artifact.
   *
   * @param id artifact identity
   * @param aiComposed composing model or agent; blank means pending
   * @param notes optional notes
   * @return metadata written inline
   * @throws CertifaiException when the artifact is unknown, already annotated, or its annotation is malformed
   * @throws IOException when the source cannot be read or rewritten
   */
  public TagMetadata annotate(ArtifactId id, String aiComposed, String notes) throws CertifaiException, IOException {
    String cleanNotes = Strings.optionalText("notes", notes);
    Artifact artifact = locate(id);
    if (!artifact.isPristine()) {
      throw new LifecycleException("Artifact " + id + " is already annotated");
    }
    TagMetadata annotated = machine.annotate(aiComposed, cleanNotes,
        attribution.attribute(artifact.file(), artifact.span()), clock.now());
    writer.write(artifact.file(), List.of(new InlineEdit(artifact, annotated)));
    transition(id, "annotated", "ai_composed={} notes={}", annotated.aiComposed(), Logs.notes(cleanNotes));
    return annotated;
  }

  /**
   * Annotates every Pristine artifact under the root. Does nothing when the policy ignores unannotated artifacts.
   *
   * @param aiComposed composing model or agent; blank means pending
   * @param notes optional notes
   * @return identities annotated, in scan order
   * @throws IOException when the tree cannot be walked or a file cannot be rewritten
   */
  public List<ArtifactId> annotateAll(String aiComposed, String notes) throws IOException {
    String cleanNotes = Strings.optionalText("notes", notes);
    if (policy.enforcement().ignoreUnannotated()) {
      log.info("Batch annotation skipped: enforcement.ignore_unannotated is set");
      return List.of();
    }
    ScanResult result = scanner.scan(root);
    Instant now = clock.now();
    Map<Path, List<InlineEdit>> edits = new LinkedHashMap<>();
    List<ArtifactId> annotated = new ArrayList<>();
    for (Artifact artifact : result.artifacts()) {
      if (!artifact.isPristine()) {
        continue;
      }
      TagMetadata metadata = machine.annotate(aiComposed, cleanNotes,
          attribution.attribute(artifact.file(), artifact.span()), now);
      edits.computeIfAbsent(artifact.file(), file -> new ArrayList<>()).add(new InlineEdit(artifact, metadata));
      annotated.add(artifact.id());
    }
    for (Map.Entry<Path, List<InlineEdit>> file : edits.entrySet()) {
      writer.write(file.getKey(), file.getValue());
    }
    annotated.forEach(id -> metrics.increment("certifai.transition.annotated"));
    log.info("Annotated {} artifacts across {} files", annotated.size(), edits.size());
    return annotated;
  }

  /**
   * Certify (human). With {@code includeExisting}, a finalized artifact is first restored from the registry.
   *
   * @param id artifact identity
   * @param reviewer reviewer identity; non-blank, no whitespace
   * @param scrutiny scrutiny applied
   * @param notes optional notes
   * @param includeExisting refresh an artifact that is already certified or finalized
   * @return metadata written inline
   * @throws CertifaiException when a precondition fails
   * @throws IOException when the source or the registry cannot be read or written
   */
  public TagMetadata certify(
      ArtifactId id,
      String reviewer,
      Scrutiny scrutiny,
      String notes,
      boolean includeExisting) throws CertifaiException, IOException {
    String reviewerId = Strings.requireIdentity("reviewer", reviewer);
    Objects.requireNonNull(scrutiny, "scrutiny");
    String cleanNotes = Strings.optionalText("notes", notes);
    Artifact artifact = requireAnnotated(locate(id));
    Instant now = clock.now();

    if (!artifact.isDone()) {
      TagMetadata certified = machine.certify(artifact.inline(), reviewerId, scrutiny, cleanNotes,
          includeExisting, now);
      writer.write(artifact.file(), List.of(new InlineEdit(artifact, certified)));
      transition(id, "certified", "reviewer={} scrutiny={} notes={}", reviewerId, scrutiny.wireName(),
          Logs.notes(cleanNotes));
      return certified;
    }
    if (!includeExisting) {
      throw new LifecycleException("Artifact " + id + " is finalized; pass includeExisting to re-certify it");
    }
    try (RegistryLock lock = registry.lock()) {
      Registry snapshot = lock.read();
      Artifact finalized = requireAnnotated(locate(id));
      if (!finalized.isDone()) {
        throw new LifecycleException("Artifact " + id + " was reopened concurrently; certify it again");
      }
      RegistryEntry entry = snapshot.get(id).orElseThrow(() -> new LifecycleException(
          "Artifact " + id + " is finalized inline but the registry holds no entry; run reconcile"));
      TagMetadata restored = machine.reopen(entry, finalized.digest(), REASON_RECERTIFY, now);
      TagMetadata certified = machine.certify(restored, reviewerId, scrutiny, cleanNotes, true, now);
      writer.write(finalized.file(), List.of(new InlineEdit(finalized, certified)));
      snapshot.remove(id, new ArchiveRecord(id, now, REASON_RECERTIFY, entry.digest(), finalized.digest()));
      lock.write(snapshot);
      metrics.increment("certifai.transition.reopened");
      transition(id, "certified", "reviewer={} scrutiny={} notes={} reopened=true", reviewerId,
          scrutiny.wireName(), Logs.notes(cleanNotes));
      return certified;
    }
  }

  /**
   * Certify (agent) with the requested scrutiny, or the policy fallback when {@code null}.
   *
   * @param id artifact identity
   * @param agentId agent identity
   * @param scrutiny requested scrutiny; may be {@code null}
   * @return metadata written inline
   * @throws AgentPermissionException when the agent is not permitted; nothing is written
   * @throws CertifaiException when another precondition fails
   * @throws IOException when the source cannot be read or rewritten
   */
  public TagMetadata certifyAgent(ArtifactId id, String agentId, Scrutiny scrutiny)
      throws CertifaiException, IOException {
    return certifyAgent(id, agentId, scrutiny, null);
  }

  /**
   * Certify (agent) with notes.
   *
   * @param id artifact identity
   * @param agentId agent identity
   * @param scrutiny requested scrutiny; may be {@code null}
   * @param notes optional notes
   * @return metadata written inline
   * @throws AgentPermissionException when the agent is not permitted; nothing is written
   * @throws CertifaiException when another precondition fails
   * @throws IOException when the source cannot be read or rewritten
   */
  public TagMetadata certifyAgent(ArtifactId id, String agentId, Scrutiny scrutiny, String notes)
      throws CertifaiException, IOException {
    String agent = Strings.requireIdentity("agent", agentId);
    String cleanNotes = Strings.optionalText("notes", notes);
    Artifact artifact = requireAnnotated(locate(id));
    TagMetadata certified;
    try {
      certified = machine.certifyAgent(artifact.inline(), agent, scrutiny, cleanNotes, clock.now());
    } catch (AgentPermissionException ex) {
      metrics.increment("certifai.transition.denied");
      log.warn("Agent certification of {} denied: {}", id, ex.getMessage());
      throw ex;
    }
    writer.write(artifact.file(), List.of(new InlineEdit(artifact, certified)));
    transition(id, "agent-certified", "agent={} scrutiny={} notes={}", agent,
        certified.reviewers().get(certified.reviewers().size() - 1).scrutiny().wireName(), Logs.notes(cleanNotes));
    return certified;
  }

  /**
   * Finalize: commits the full record to the registry, then collapses the inline annotation. The artifact is
   * located under the registry lock.
   *
   * @param id artifact identity
   * @return registry entry created
   * @throws AgentPermissionException when the latest reviewer is an agent without {@code allow_finalize}
   * @throws CertifaiException when another precondition fails
   * @throws IOException when the registry or the source cannot be read or written
   */
  public RegistryEntry finalize(ArtifactId id) throws CertifaiException, IOException {
    Objects.requireNonNull(id, "id");
    try (RegistryLock lock = registry.lock()) {
      Registry snapshot = lock.read();
      Artifact artifact = requireAnnotated(locate(id));
      if (snapshot.contains(id)) {
        throw new LifecycleException(artifact.isDone()
            ? "Artifact " + id + " is already finalized"
            : "Registry already holds an entry for " + id + "; run reconcile");
      }
      Finalization finalization = machine.finalize(id, artifact.inline(), artifact.digest(), clock.now());
      snapshot.add(finalization.entry());
      lock.write(snapshot);
      writer.write(artifact.file(), List.of(new InlineEdit(artifact, finalization.inline())));
      transition(id, "finalized", "digest={}", finalization.entry().digest());
      return finalization.entry();
    }
  }

  /**
   * Finalizes every artifact under the root whose preconditions hold, in one registry transaction. Artifacts that
   * do not qualify are skipped and logged.
   *
   * @return registry entries created, in scan order
   * @throws IOException when the registry or a source file cannot be read or written
   */
  public List<RegistryEntry> finalizeAll() throws IOException {
    try (RegistryLock lock = registry.lock()) {
      Registry snapshot = lock.read();
      ScanResult result = scanner.scan(root);
      Instant now = clock.now();
      List<RegistryEntry> created = new ArrayList<>();
      Map<Path, List<InlineEdit>> edits = new LinkedHashMap<>();
      for (Artifact artifact : result.artifacts()) {
        if (artifact.isPristine() || artifact.isDone() || snapshot.contains(artifact.id())) {
          continue;
        }
        Finalization finalization;
        try {
          finalization = machine.finalize(artifact.id(), artifact.inline(), artifact.digest(), now);
        } catch (CertifaiException ex) {
          log.info("Not finalizing {}: {}", artifact.id(), ex.getMessage());
          continue;
        }
        snapshot.add(finalization.entry());
        created.add(finalization.entry());
        edits.computeIfAbsent(artifact.file(), file -> new ArrayList<>())
            .add(new InlineEdit(artifact, finalization.inline()));
      }
      if (created.isEmpty()) {
        log.info("No artifacts under {} are ready to finalize", root);
        return created;
      }
      lock.write(snapshot);
      for (Map.Entry<Path, List<InlineEdit>> file : edits.entrySet()) {
        writer.write(file.getKey(), file.getValue());
      }
      created.forEach(entry -> metrics.increment("certifai.transition.finalized"));
      log.info("Finalized {} artifacts across {} files", created.size(), edits.size());
      return created;
    }
  }

  /**
   * Reconciles inline annotations with the registry.
   *
   * @return reconciliation report
   * @throws IOException when the registry is corrupt or locked, or a source file cannot be rewritten
   */
  public ReconcileReport reconcile() throws IOException {
    return reconciler.reconcile();
  }

  /**
   * Evaluates a policy over records. Pure.
   *
   * @param records artifact records
   * @param policy policy to apply
   * @return policy report
   */
  public PolicyReport evaluatePolicy(List<ArtifactRecord> records, PolicyConfig policy) {
    return evaluator.evaluate(records, policy);
  }

  /**
   * Scans the root and evaluates the engine's policy, including orphaned registry entries.
   *
   * @return policy report
   * @throws IOException when the tree cannot be walked or the registry is corrupt
   */
  public PolicyReport check() throws IOException {
    ScanReport report = scan();
    return evaluator.evaluate(report.records(), report.orphans(), policy);
  }

  private Artifact locate(ArtifactId id) throws CertifaiException {
    Objects.requireNonNull(id, "id");
    Path file = Paths.requireWithin(root, root.resolve(id.path()));
    ScanResult result = scanner.scanFile(root, file);
    Optional<Artifact> artifact = result.find(id);
    if (artifact.isPresent()) {
      return artifact.get();
    }
    for (ScanProblem problem : result.problems()) {
      if (problem.kind() == ScanProblem.Kind.ANNOTATION && id.qualifiedName().equals(problem.artifact())) {
        throw new AnnotationCorruptionException("Annotation of " + id + " is malformed: " + problem.message());
      }
      if (problem.kind() == ScanProblem.Kind.PARSE) {
        throw new LifecycleException("Cannot read " + id.path() + ": " + problem.message());
      }
    }
    throw new LifecycleException("Unknown artifact " + id);
  }

  private static Artifact requireAnnotated(Artifact artifact) throws LifecycleException {
    if (artifact.isPristine()) {
      throw new LifecycleException("Artifact " + artifact.id() + " is not annotated; annotate it first");
    }
    return artifact;
  }

  private void transition(ArtifactId id, String action, String format, Object... details) {
    metrics.increment("certifai.transition." + action);
    MDC.put("artifact", id.toString());
    try {
      if (log.isInfoEnabled()) {
        log.info(action + " " + id + ": " + format, details);
      }
    } finally {
      MDC.remove("artifact");
    }
  }
}
