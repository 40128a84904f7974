package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.model.Attribution;
import ca.gc.cra.certifai.domain.model.SourceSpan;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Source-control attribution lookup (last commit and author of a declaration).
 *
 * <p>Implemented by collaborators; the engine only records what it is given.</p>
 *
 * @since 0.1.0
 */
public interface AttributionPort {
  /**
   * Resolves attribution for a span of a file.
   *
   * @param file absolute source file
   * @param span declaration span
   * @return attribution when source control knows the lines
   */
  Optional<Attribution> attribute(Path file, SourceSpan span);

  /** Attribution lookup that never finds anything. */
  AttributionPort NONE = (file, span) -> Optional.empty();
}
