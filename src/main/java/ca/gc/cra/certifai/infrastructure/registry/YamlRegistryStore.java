package ca.gc.cra.certifai.infrastructure.registry;

import ca.gc.cra.certifai.application.port.RegistryLock;
import ca.gc.cra.certifai.application.port.RegistryStore;
import ca.gc.cra.certifai.domain.error.RegistryCorruptionException;
import ca.gc.cra.certifai.domain.registry.Registry;
import ca.gc.cra.certifai.infrastructure.io.AtomicFiles;
import java.io.IOException;
import java.io.Reader;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * {@link RegistryStore} persisting the registry as one YAML document per repository.
 *
 * <p>Exclusive access combines an in-process lock per registry path with an OS lock on a sibling
 * {@code registry.lock} file, both acquired within a bounded timeout. Writes replace the document atomically.
 * A missing document is an empty registry; a malformed one raises {@link RegistryCorruptionException} and is
 * left untouched.</p>
 *
 * @since 0.1.0
 */
public final class YamlRegistryStore implements RegistryStore {
  private static final Logger log = LoggerFactory.getLogger(YamlRegistryStore.class);
  private static final ConcurrentMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();
  private static final long POLL_MILLIS = 25L;
  private static final String LOCK_FILE_NAME = "registry.lock";

  private final Path file;
  private final Path lockFile;
  private final Duration timeout;
  private final RegistryDocument document;

  /**
   * Creates a store.
   *
   * @param file registry document location; parent directories are created on first lock
   * @param timeout bounded wait for the registry lock
   */
  public YamlRegistryStore(Path file, Duration timeout) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
    this.lockFile = this.file.resolveSibling(LOCK_FILE_NAME);
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.document = new RegistryDocument(this.file);
  }

  @Override
  public Path location() {
    return file;
  }

  @Override
  public Registry load() throws IOException {
    try (RegistryLock lock = lock()) {
      return lock.read();
    }
  }

  @Override
  public RegistryLock lock() throws IOException {
    long deadline = System.nanoTime() + timeout.toNanos();
    ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(file, ignored -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = local.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RegistryCorruptionException(file, "interrupted while waiting for the registry lock", ex);
    }
    if (!acquired) {
      throw unobtainable();
    }
    FileChannel channel = null;
    try {
      Files.createDirectories(file.getParent());
      channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock osLock = acquireOsLock(channel, deadline);
      log.debug("Acquired registry lock {}", lockFile);
      return new HeldLock(local, channel, osLock);
    } catch (IOException | RuntimeException ex) {
      closeQuietly(channel);
      local.unlock();
      throw ex;
    }
  }

  private FileLock acquireOsLock(FileChannel channel, long deadline) throws IOException {
    while (true) {
      try {
        FileLock lock = channel.tryLock();
        if (lock != null) {
          return lock;
        }
      } catch (OverlappingFileLockException ex) {
        log.debug("Registry lock {} held elsewhere in this JVM; retrying", lockFile);
      }
      if (System.nanoTime() >= deadline) {
        throw unobtainable();
      }
      try {
        Thread.sleep(POLL_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new RegistryCorruptionException(file, "interrupted while waiting for the registry lock", ex);
      }
    }
  }

  private RegistryCorruptionException unobtainable() {
    log.error("Registry lock {} not obtained within {} ms", lockFile, timeout.toMillis());
    return new RegistryCorruptionException(file, "lock unobtainable within " + timeout.toMillis() + " ms");
  }

  private Registry readDocument() throws IOException {
    Object parsed;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      parsed = new Yaml().load(reader);
    } catch (NoSuchFileException ex) {
      return new Registry();
    } catch (YAMLException ex) {
      throw new RegistryCorruptionException(file, "malformed YAML: " + ex.getMessage(), ex);
    }
    return document.decode(parsed);
  }

  private void writeDocument(Registry registry) throws IOException {
    Map<String, Object> tree = document.encode(registry);
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setWidth(120);
    String text = new Yaml(options).dump(tree);
    AtomicFiles.writeString(file, text);
    log.debug("Wrote registry {} with {} entries", file, registry.size());
  }

  private void closeQuietly(FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException ex) {
      log.warn("Unable to close registry lock channel {}", lockFile, ex);
    }
  }

  private final class HeldLock implements RegistryLock {
    private final ReentrantLock local;
    private final FileChannel channel;
    private final FileLock osLock;
    private boolean closed;

    private HeldLock(ReentrantLock local, FileChannel channel, FileLock osLock) {
      this.local = local;
      this.channel = channel;
      this.osLock = osLock;
    }

    @Override
    public Registry read() throws IOException {
      ensureOpen();
      return readDocument();
    }

    @Override
    public void write(Registry registry) throws IOException {
      ensureOpen();
      writeDocument(Objects.requireNonNull(registry, "registry"));
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      try {
        osLock.release();
      } finally {
        try {
          channel.close();
        } finally {
          local.unlock();
          log.debug("Released registry lock {}", lockFile);
        }
      }
    }

    private void ensureOpen() {
      if (closed) {
        throw new IllegalStateException("registry lock already released");
      }
    }
  }
}
