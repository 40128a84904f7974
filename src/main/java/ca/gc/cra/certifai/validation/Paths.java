package ca.gc.cra.certifai.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for repository roots and files handed to the engine.
 * <p><strong>Why:</strong> Artifact identities are relative to the scanned root, so the root must be a real
 * directory and every rewritten file must stay inside it.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a repository root.
   *
   * @param path candidate root; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the path is missing, not a directory, or contains control characters
   */
  public static Path requireDirectory(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("root must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("root must not contain null bytes");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("root is not a directory: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve root " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures a file lies within a base directory.
   *
   * @param base real base directory
   * @param file candidate file
   * @return absolute normalized file path
   * @throws IllegalArgumentException if {@code file} escapes {@code base}
   */
  public static Path requireWithin(Path base, Path file) {
    Path normalized = file.toAbsolutePath().normalize();
    Path resolved = normalized;
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        resolved = normalized.toRealPath();
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!resolved.startsWith(base)) {
      throw new IllegalArgumentException("path " + normalized + " escapes root " + base);
    }
    return resolved;
  }
}
