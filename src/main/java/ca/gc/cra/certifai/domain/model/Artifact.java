package ca.gc.cra.certifai.domain.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Artifact descriptor produced by one scan of a source revision.
 *
 * <p>A new scan always produces new instances, even for unchanged code. Two descriptors denote the
 * same artifact when their {@link #id()} matches.</p>
 *
 * @param id stable identity; never {@code null}
 * @param file absolute source file; never {@code null}
 * @param kind declaration kind; never {@code null}
 * @param span declaration span, excluding Javadoc; never {@code null}
 * @param annotationSpan span of the inline provenance annotation; {@code null} when Pristine
 * @param inline decoded inline provenance; {@code null} when Pristine
 * @param digest canonical implementation digest; never {@code null}
 * @since 0.1.0
 */
public record Artifact(
    ArtifactId id,
    Path file,
    ArtifactKind kind,
    SourceSpan span,
    SourceSpan annotationSpan,
    TagMetadata inline,
    String digest) {

  public Artifact {
    id = Objects.requireNonNull(id, "id");
    file = Objects.requireNonNull(file, "file");
    kind = Objects.requireNonNull(kind, "kind");
    span = Objects.requireNonNull(span, "span");
    digest = Objects.requireNonNull(digest, "digest");
    if ((annotationSpan == null) != (inline == null)) {
      throw new IllegalArgumentException("annotation span and inline metadata must be present together");
    }
  }

  public boolean isPristine() {
    return inline == null;
  }

  public boolean isDone() {
    return inline != null && inline.done();
  }

  public Optional<TagMetadata> inlineMetadata() {
    return Optional.ofNullable(inline);
  }
}
