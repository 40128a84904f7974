package ca.gc.cra.certifai.application.port;

import ca.gc.cra.certifai.domain.registry.Registry;
import java.io.IOException;

/**
 * Exclusive hold on the registry for one read-modify-write batch.
 *
 * <p>Use with try-with-resources; the lock is released on every exit path.</p>
 *
 * @since 0.1.0
 */
public interface RegistryLock extends AutoCloseable {
  /**
   * Reads the registry as of now.
   *
   * @return registry snapshot; empty when no registry file exists
   * @throws IOException when the file is malformed or unreadable
   */
  Registry read() throws IOException;

  /**
   * Replaces the registry document. Either the prior or the new document is observable afterwards, never a
   * partial one.
   *
   * @param registry snapshot to persist
   * @throws IOException when the write fails
   */
  void write(Registry registry) throws IOException;

  @Override
  void close() throws IOException;
}
