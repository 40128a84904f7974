package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.port.ClockPort;
import ca.gc.cra.certifai.application.port.InlineAnnotationWriter;
import ca.gc.cra.certifai.application.port.InlineEdit;
import ca.gc.cra.certifai.application.port.MetricsPort;
import ca.gc.cra.certifai.application.port.RegistryLock;
import ca.gc.cra.certifai.application.port.RegistryStore;
import ca.gc.cra.certifai.application.port.ScanResult;
import ca.gc.cra.certifai.application.port.SourceScanner;
import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.registry.ArchiveRecord;
import ca.gc.cra.certifai.domain.registry.Registry;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Brings inline annotations and the registry back into agreement.
 * <p><strong>Why:</strong> Finalized artifacts whose implementation drifted must be reopened, and a crash between
 * the inline rewrite and the registry write must be recoverable on the next run.</p>
 * <p><strong>Role:</strong> Application use case invoked through {@link ProvenanceEngine#reconcile()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reopen {@code done=true} artifacts whose live digest differs from the registry entry.</li>
 *   <li>Reopen finalized methods whose parameter list changed, matched to the entry of the former signature.</li>
 *   <li>Drop registry entries left behind by an interrupted Finalize or Reopen; inline metadata is authoritative.</li>
 *   <li>Report finalized annotations without a registry entry and entries without an artifact.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each pass runs under one registry lock; concurrent passes serialize.</p>
 * <p><strong>Observability:</strong> Increments {@code certifai.reconcile.*} counters; reopenings log at INFO,
 * recoveries and orphans at WARN.</p>
 *
 * @implNote Inline edits are written before the registry so an interrupted pass leaves entries that the next pass
 *     recovers.
 * @since 0.1.0
 */
public final class Reconciler {
  private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

  static final String REASON_DIGEST_MISMATCH = "digest-mismatch";
  static final String REASON_ANNOTATION_REMOVED = "annotation-removed";
  static final String REASON_INTERRUPTED = "interrupted-transition";
  static final String REASON_SIGNATURE_CHANGED = "signature-changed";

  private final Path root;
  private final SourceScanner scanner;
  private final InlineAnnotationWriter writer;
  private final RegistryStore store;
  private final LifecycleStateMachine machine;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a reconciler bound to one repository root.
   *
   * @param root scanned root
   * @param scanner source scanner
   * @param writer inline annotation writer
   * @param store registry store
   * @param machine lifecycle rules used to restore metadata
   * @param clock clock stamping history and archive records
   * @param metrics metrics sink
   */
  public Reconciler(
      Path root,
      SourceScanner scanner,
      InlineAnnotationWriter writer,
      RegistryStore store,
      LifecycleStateMachine machine,
      ClockPort clock,
      MetricsPort metrics) {
    this.root = Objects.requireNonNull(root, "root");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.store = Objects.requireNonNull(store, "store");
    this.machine = Objects.requireNonNull(machine, "machine");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Runs one reconciliation pass. Running it twice without intervening edits reopens nothing the second time.
   *
   * @return what the pass changed and found
   * @throws IOException when the registry is corrupt or locked, or a source file cannot be rewritten
   */
  public ReconcileReport reconcile() throws IOException {
    List<ReopenedArtifact> reopened = new ArrayList<>();
    List<ArtifactId> recovered = new ArrayList<>();
    List<CorruptionFinding> corruption = new ArrayList<>();
    Map<Path, List<InlineEdit>> edits = new LinkedHashMap<>();

    try (RegistryLock lock = store.lock()) {
      Registry registry = lock.read();
      ScanResult scan = scanner.scan(root);
      Instant now = clock.now();
      boolean changed = false;
      Map<ArtifactId, RegistryEntry> relocated = relocated(registry, scan);

      for (Artifact artifact : scan.artifacts()) {
        ArtifactId id = artifact.id();
        Optional<RegistryEntry> entry = registry.get(id);
        MDC.put("artifact", id.toString());
        try {
          if (artifact.isPristine()) {
            if (entry.isPresent()) {
              restore(artifact, entry.get(), REASON_ANNOTATION_REMOVED, now, registry, edits);
              log.warn("Restored annotation of {} from its registry entry", id);
              recovered.add(id);
              metrics.increment("certifai.reconcile.recovered");
              changed = true;
            }
          } else if (artifact.isDone()) {
            if (entry.isEmpty() && relocated.containsKey(id)) {
              RegistryEntry previous = relocated.get(id);
              TagMetadata restored = restore(artifact, previous, REASON_SIGNATURE_CHANGED, now, registry, edits);
              reopened.add(new ReopenedArtifact(id, previous.digest(), artifact.digest(), restored));
              metrics.increment("certifai.reconcile.reopened");
              log.info("Reopened {}: signature changed from {}", id, previous.id().qualifiedName());
              changed = true;
            } else if (entry.isEmpty()) {
              log.warn("{} is finalized inline but the registry holds no entry", id);
              corruption.add(new CorruptionFinding(id, CorruptionFinding.Kind.MISSING_REGISTRY_ENTRY,
                  "inline annotation has done=true but " + store.location() + " holds no entry"));
            } else if (!entry.get().digest().equals(artifact.digest())) {
              TagMetadata restored = restore(artifact, entry.get(), REASON_DIGEST_MISMATCH, now, registry, edits);
              reopened.add(new ReopenedArtifact(id, entry.get().digest(), artifact.digest(), restored));
              metrics.increment("certifai.reconcile.reopened");
              log.info("Reopened {}: digest {} -> {}", id, entry.get().digest(), artifact.digest());
              changed = true;
            }
          } else if (entry.isPresent()) {
            registry.remove(id, new ArchiveRecord(id, now, REASON_INTERRUPTED, entry.get().digest(),
                artifact.digest()));
            recovered.add(id);
            metrics.increment("certifai.reconcile.recovered");
            log.warn("Dropped registry entry of {}: inline annotation is not finalized", id);
            changed = true;
          }
        } finally {
          MDC.remove("artifact");
        }
      }

      List<ReopenConflict> orphans = new ArrayList<>();
      for (RegistryEntry entry : orphaned(registry, scan)) {
        orphans.add(new ReopenConflict(entry));
        log.warn("Registry entry {} has no matching artifact", entry.id());
      }
      metrics.observe("certifai.reconcile.orphans", orphans.size());

      for (Map.Entry<Path, List<InlineEdit>> file : edits.entrySet()) {
        writer.write(file.getKey(), file.getValue());
      }
      if (changed) {
        lock.write(registry);
      }
      log.info("Reconciled {}: {} reopened, {} recovered, {} orphaned, {} corrupt",
          root, reopened.size(), recovered.size(), orphans.size(), corruption.size());
      return new ReconcileReport(reopened, orphans, recovered, corruption, scan.problems());
    }
  }

  private TagMetadata restore(
      Artifact artifact,
      RegistryEntry entry,
      String reason,
      Instant now,
      Registry registry,
      Map<Path, List<InlineEdit>> edits) {
    TagMetadata restored = machine.reopen(entry, artifact.digest(), reason, now);
    edits.computeIfAbsent(artifact.file(), file -> new ArrayList<>()).add(new InlineEdit(artifact, restored));
    registry.remove(entry.id(), new ArchiveRecord(entry.id(), now, reason, entry.digest(), artifact.digest()));
    return restored;
  }

  /**
   * Pairs finalized artifacts that have no registry entry with the orphaned entry of the same member in the same
   * file, i.e. a finalized method or constructor whose parameter list was edited. Only one-to-one pairs are
   * returned; overloads edited together stay unmatched.
   *
   * @param registry registry snapshot
   * @param scan live scan
   * @return orphaned entry keyed by the identity of the artifact it now belongs to
   */
  static Map<ArtifactId, RegistryEntry> relocated(Registry registry, ScanResult scan) {
    Map<String, List<RegistryEntry>> orphansByMember = new HashMap<>();
    for (RegistryEntry entry : orphaned(registry, scan)) {
      orphansByMember.computeIfAbsent(memberKey(entry.id()), key -> new ArrayList<>()).add(entry);
    }
    Map<String, List<ArtifactId>> unmatchedByMember = new HashMap<>();
    for (Artifact artifact : scan.artifacts()) {
      if (artifact.isDone() && !registry.contains(artifact.id())) {
        unmatchedByMember.computeIfAbsent(memberKey(artifact.id()), key -> new ArrayList<>()).add(artifact.id());
      }
    }
    Map<ArtifactId, RegistryEntry> relocated = new HashMap<>();
    for (Map.Entry<String, List<ArtifactId>> member : unmatchedByMember.entrySet()) {
      List<RegistryEntry> candidates = orphansByMember.getOrDefault(member.getKey(), List.of());
      if (member.getValue().size() == 1 && candidates.size() == 1) {
        relocated.put(member.getValue().get(0), candidates.get(0));
      }
    }
    return relocated;
  }

  private static String memberKey(ArtifactId id) {
    return id.path() + ArtifactId.SEPARATOR + id.memberName();
  }

  /**
   * Lists registry entries with no artifact in a scan. Entries of unreadable files and of artifacts whose
   * annotation failed to decode are not orphans: their artifacts still exist.
   *
   * @param registry registry snapshot
   * @param scan live scan
   * @return orphaned entries in identity order
   */
  static List<RegistryEntry> orphaned(Registry registry, ScanResult scan) {
    Set<ArtifactId> live = new HashSet<>();
    for (Artifact artifact : scan.artifacts()) {
      live.add(artifact.id());
    }
    List<RegistryEntry> orphans = new ArrayList<>();
    for (RegistryEntry entry : registry.entries().values()) {
      ArtifactId id = entry.id();
      if (!live.contains(id) && !scan.isUnreadable(id) && !scan.hasAnnotationProblem(id)) {
        orphans.add(entry);
      }
    }
    return orphans;
  }
}
