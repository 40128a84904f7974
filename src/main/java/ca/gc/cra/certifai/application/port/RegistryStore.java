package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.registry.Registry;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Durable store of finalized provenance records shared by independent invocations.
 *
 * @since 0.1.0
 */
public interface RegistryStore {
  /**
   * Location of the registry document, for diagnostics.
   *
   * @return registry path
   */
  Path location();

  /**
   * Reads the registry under a short-lived lock.
   *
   * @return registry snapshot; empty when no registry file exists
   * @throws IOException when the registry is malformed, unreadable or the lock cannot be obtained
   */
  Registry load() throws IOException;

  /**
   * Persists a registry under a short-lived lock.
   *
   * @param registry snapshot to persist
   * @throws IOException when the registry cannot be written or the lock cannot be obtained
   */
  default void save(Registry registry) throws IOException {
    try (RegistryLock lock = lock()) {
      lock.write(registry);
    }
  }

  /**
   * Acquires the exclusive registry lock, waiting at most the configured timeout.
   *
   * @return held lock
   * @throws IOException ({@link ca.gc.cra.certifai.domain.error.RegistryCorruptionException}) when the lock
   *     cannot be obtained in time
   */
  RegistryLock lock() throws IOException;
}
