package ca.gc.cra.certifai.infrastructure.registry;

import ca.gc.cra.certifai.domain.error.RegistryCorruptionException;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.ReviewerKind;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.registry.ArchiveRecord;
import ca.gc.cra.certifai.domain.registry.Registry;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link Registry} to and from the plain YAML tree of the registry document.
 *
 * <pre>
 * version: 1
 * artifacts:
 *   path/Foo.java::pkg.Foo.run():
 *     digest: ...
 *     finalized_at: ...
 *     metadata: {ai_composed, human_certified, scrutiny, date, notes, history, reviewers, extras}
 * archive:
 *   - {id, archived_at, reason, old_digest, new_digest}
 * </pre>
 */
final class RegistryDocument {
  static final int VERSION = 1;

  private final Path path;

  RegistryDocument(Path path) {
    this.path = path;
  }

  Map<String, Object> encode(Registry registry) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    Map<String, Object> artifacts = new LinkedHashMap<>();
    for (RegistryEntry entry : registry.entries().values()) {
      Map<String, Object> node = new LinkedHashMap<>();
      node.put("digest", entry.digest());
      node.put("finalized_at", entry.finalizedAt().toString());
      node.put("metadata", encodeMetadata(entry.metadata()));
      artifacts.put(entry.id().toString(), node);
    }
    root.put("artifacts", artifacts);
    List<Object> archive = new ArrayList<>();
    for (ArchiveRecord record : registry.archive()) {
      Map<String, Object> node = new LinkedHashMap<>();
      node.put("id", record.id().toString());
      node.put("archived_at", record.archivedAt().toString());
      node.put("reason", record.reason());
      node.put("old_digest", record.oldDigest());
      if (record.newDigest() != null) {
        node.put("new_digest", record.newDigest());
      }
      archive.add(node);
    }
    root.put("archive", archive);
    return root;
  }

  Registry decode(Object document) throws RegistryCorruptionException {
    if (document == null) {
      return new Registry();
    }
    Map<String, Object> root = asMap(document, "document");
    Object version = root.get("version");
    if (version != null && !String.valueOf(version).trim().equals(Integer.toString(VERSION))) {
      throw corrupt("unsupported registry version " + version);
    }
    List<RegistryEntry> entries = new ArrayList<>();
    Object artifactsNode = root.get("artifacts");
    if (artifactsNode != null) {
      for (Map.Entry<String, Object> artifact : asMap(artifactsNode, "artifacts").entrySet()) {
        entries.add(decodeEntry(artifact.getKey(), asMap(artifact.getValue(), artifact.getKey())));
      }
    }
    List<ArchiveRecord> archive = new ArrayList<>();
    Object archiveNode = root.get("archive");
    if (archiveNode != null) {
      if (!(archiveNode instanceof List<?> list)) {
        throw corrupt("archive must be a list");
      }
      for (Object item : list) {
        archive.add(decodeArchive(asMap(item, "archive[]")));
      }
    }
    return new Registry(entries, archive);
  }

  private RegistryEntry decodeEntry(String key, Map<String, Object> node) throws RegistryCorruptionException {
    ArtifactId id;
    try {
      id = ArtifactId.parse(key);
    } catch (IllegalArgumentException ex) {
      throw corrupt("invalid artifact identity '" + key + "'");
    }
    String digest = requireString(node, "digest", key);
    Instant finalizedAt = requireInstant(node, "finalized_at", key);
    Object metadataNode = node.get("metadata");
    TagMetadata metadata = metadataNode == null
        ? TagMetadata.builder().done(true).build()
        : decodeMetadata(asMap(metadataNode, key + ".metadata"), key);
    return new RegistryEntry(id, digest, metadata, finalizedAt);
  }

  private ArchiveRecord decodeArchive(Map<String, Object> node) throws RegistryCorruptionException {
    String rawId = requireString(node, "id", "archive[]");
    ArtifactId id;
    try {
      id = ArtifactId.parse(rawId);
    } catch (IllegalArgumentException ex) {
      throw corrupt("invalid archived identity '" + rawId + "'");
    }
    return new ArchiveRecord(
        id,
        requireInstant(node, "archived_at", rawId),
        requireString(node, "reason", rawId),
        requireString(node, "old_digest", rawId),
        optionalString(node.get("new_digest")));
  }

  private Map<String, Object> encodeMetadata(TagMetadata metadata) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("ai_composed", metadata.aiComposed());
    node.put("human_certified", metadata.humanCertified());
    node.put("scrutiny", metadata.scrutiny().wireName());
    node.put("date", metadata.date() == null ? null : metadata.date().toString());
    node.put("notes", metadata.notes());
    node.put("history", new ArrayList<>(metadata.history()));
    List<Object> reviewers = new ArrayList<>();
    for (ReviewerInfo reviewer : metadata.reviewers()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("kind", reviewer.kind().wireName());
      item.put("id", reviewer.id());
      item.put("scrutiny", reviewer.scrutiny().wireName());
      item.put("timestamp", reviewer.timestamp() == null ? null : reviewer.timestamp().toString());
      item.put("notes", reviewer.notes());
      reviewers.add(item);
    }
    node.put("reviewers", reviewers);
    node.put("extras", new LinkedHashMap<>(metadata.extras()));
    return node;
  }

  private TagMetadata decodeMetadata(Map<String, Object> node, String key) throws RegistryCorruptionException {
    TagMetadata.Builder builder = TagMetadata.builder()
        .aiComposed(optionalString(node.get("ai_composed")))
        .humanCertified(optionalString(node.get("human_certified")))
        .scrutiny(scrutiny(node.get("scrutiny"), key))
        .date(optionalInstant(node.get("date"), key + ".date"))
        .notes(optionalString(node.get("notes")))
        .done(true);
    for (Object entry : list(node.get("history"), key + ".history")) {
      builder.addHistory(String.valueOf(entry));
    }
    for (Object item : list(node.get("reviewers"), key + ".reviewers")) {
      Map<String, Object> reviewer = asMap(item, key + ".reviewers[]");
      String kindValue = requireString(reviewer, "kind", key);
      ReviewerKind kind = ReviewerKind.parse(kindValue)
          .orElseThrow(() -> corrupt("unknown reviewer kind '" + kindValue + "' in " + key));
      builder.addReviewer(new ReviewerInfo(
          kind,
          requireString(reviewer, "id", key),
          scrutiny(reviewer.get("scrutiny"), key),
          optionalInstant(reviewer.get("timestamp"), key + ".reviewers.timestamp"),
          optionalString(reviewer.get("notes"))));
    }
    Object extras = node.get("extras");
    if (extras != null) {
      for (Map.Entry<String, Object> extra : asMap(extras, key + ".extras").entrySet()) {
        builder.putExtra(extra.getKey(), String.valueOf(extra.getValue()));
      }
    }
    return builder.build();
  }

  private Scrutiny scrutiny(Object value, String key) throws RegistryCorruptionException {
    if (value == null) {
      return Scrutiny.AUTO;
    }
    return Scrutiny.parse(String.valueOf(value))
        .orElseThrow(() -> corrupt("unknown scrutiny '" + value + "' in " + key));
  }

  private Map<String, Object> asMap(Object node, String context) throws RegistryCorruptionException {
    if (!(node instanceof Map<?, ?> raw)) {
      throw corrupt(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw corrupt(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private List<?> list(Object node, String context) throws RegistryCorruptionException {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof List<?> list)) {
      throw corrupt(context + " must be a list");
    }
    return list;
  }

  private String requireString(Map<String, Object> node, String field, String context)
      throws RegistryCorruptionException {
    String value = optionalString(node.get(field));
    if (value == null) {
      throw corrupt("missing " + field + " for " + context);
    }
    return value;
  }

  private Instant requireInstant(Map<String, Object> node, String field, String context)
      throws RegistryCorruptionException {
    Instant value = optionalInstant(node.get(field), context + "." + field);
    if (value == null) {
      throw corrupt("missing " + field + " for " + context);
    }
    return value;
  }

  private Instant optionalInstant(Object value, String context) throws RegistryCorruptionException {
    if (value == null) {
      return null;
    }
    if (value instanceof Date date) {
      return date.toInstant();
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      throw corrupt("invalid timestamp '" + text + "' at " + context);
    }
  }

  private static String optionalString(Object value) {
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isBlank() ? null : text;
  }

  private RegistryCorruptionException corrupt(String reason) {
    return new RegistryCorruptionException(path, reason);
  }
}
