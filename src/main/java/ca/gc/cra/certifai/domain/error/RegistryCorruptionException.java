package ca.gc.cra.certifai.domain.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the registry file is malformed or its lock cannot be obtained.
 *
 * <p>Fatal for the operation that touched the registry. The registry is never repaired by discarding
 * it; the path and reason are carried for manual recovery.</p>
 *
 * @since 0.1.0
 */
public final class RegistryCorruptionException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;
  private final String reason;

  public RegistryCorruptionException(Path path, String reason) {
    this(path, reason, null);
  }

  public RegistryCorruptionException(Path path, String reason, Throwable cause) {
    super("Registry " + path + ": " + reason, cause);
    this.path = path;
    this.reason = reason;
  }

  public Path path() {
    return path;
  }

  public String reason() {
    return reason;
  }
}
