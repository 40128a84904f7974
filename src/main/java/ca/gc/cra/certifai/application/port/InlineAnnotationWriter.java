package ca.gc.cra.certifai.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes inline annotations back into source files.
 *
 * @since 0.1.0
 */
public interface InlineAnnotationWriter {
  /**
   * Applies edits to one file atomically. Text around the edited annotations, including unrelated annotations
   * and comments, is preserved.
   *
   * @param file file every edit belongs to
   * @param edits edits computed from the current content of {@code file}
   * @throws IOException when the file cannot be rewritten
   */
  void write(Path file, List<InlineEdit> edits) throws IOException;
}
