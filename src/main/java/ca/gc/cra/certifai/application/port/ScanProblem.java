package ca.gc.cra.certifai.application.port;

import java.nio.file.Path;
import java.util.Objects;

/**
 * File or artifact skipped during a scan.
 *
 * @param kind failure category
 * @param file offending file; never {@code null}
 * @param artifact qualified name when the problem is specific to one artifact; may be {@code null}
 * @param message human-readable description
 * @since 0.1.0
 */
public record ScanProblem(Kind kind, Path file, String artifact, String message) {
  public ScanProblem {
    kind = Objects.requireNonNull(kind, "kind");
    file = Objects.requireNonNull(file, "file");
    message = message == null ? "" : message;
  }

  /** Failure categories. */
  public enum Kind {
    /** The file could not be read or parsed; all its artifacts are skipped. */
    PARSE,
    /** One inline provenance annotation is malformed; that artifact is skipped. */
    ANNOTATION
  }

  @Override
  public String toString() {
    return kind + " " + file + (artifact == null ? "" : " [" + artifact + "]") + ": " + message;
  }
}
