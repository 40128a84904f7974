package ca.gc.cra.certifai.domain.registry;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory snapshot of the registry: active entries keyed by identity plus the archive trail.
 *
 * <p>Not thread-safe. A snapshot is read, modified and written back under one registry lock.</p>
 *
 * <p>The archive is an append-only audit trail: records are never pruned, so {@code registry.yml} keeps one record
 * per reopening or recovery for the life of the repository. Trimming it is a manual, reviewed edit.</p>
 *
 * @since 0.1.0
 */
public final class Registry {
  private final TreeMap<ArtifactId, RegistryEntry> entries = new TreeMap<>();
  private final List<ArchiveRecord> archive = new ArrayList<>();

  public Registry() {}

  public Registry(Collection<RegistryEntry> entries, List<ArchiveRecord> archive) {
    for (RegistryEntry entry : Objects.requireNonNull(entries, "entries")) {
      this.entries.put(entry.id(), entry);
    }
    this.archive.addAll(Objects.requireNonNull(archive, "archive"));
  }

  public Optional<RegistryEntry> get(ArtifactId id) {
    return Optional.ofNullable(entries.get(id));
  }

  public boolean contains(ArtifactId id) {
    return entries.containsKey(id);
  }

  /**
   * Adds a newly finalized entry.
   *
   * @param entry entry to add
   * @throws IllegalStateException when an entry already exists for the identity
   */
  public void add(RegistryEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (entries.putIfAbsent(entry.id(), entry) != null) {
      throw new IllegalStateException("registry already holds an entry for " + entry.id());
    }
  }

  /**
   * Removes an entry, optionally recording an archive trace.
   *
   * @param id identity to remove
   * @param trace archive record to append; may be {@code null}
   * @return removed entry, if any
   */
  public Optional<RegistryEntry> remove(ArtifactId id, ArchiveRecord trace) {
    RegistryEntry removed = entries.remove(id);
    if (removed != null && trace != null) {
      archive.add(trace);
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Returns active entries in identity order.
   *
   * @return unmodifiable view
   */
  public Map<ArtifactId, RegistryEntry> entries() {
    return Collections.unmodifiableMap(entries);
  }

  public List<ArchiveRecord> archive() {
    return Collections.unmodifiableList(archive);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
