package ca.gc.cra.certifai.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigTest {

  @TempDir Path tempDir;

  @Test
  void forRootUsesDefaultRegistryAndExcludes() {
    EngineConfig config = EngineConfig.forRoot(tempDir);

    assertEquals(tempDir.toAbsolutePath().normalize().resolve(".certifai/registry.yml"), config.registryFile());
    assertEquals(List.of("**/target/**", "**/.git/**"), config.excludes());
    assertEquals(Duration.ofMillis(EngineConfig.DEFAULT_LOCK_TIMEOUT_MILLIS), config.lockTimeout());
  }

  @Test
  void fromMapResolvesRegistryAgainstRoot() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        "root", tempDir.toString(),
        "registry", "meta/provenance.yml",
        "lockTimeoutMillis", "750",
        "scanThreads", "3",
        "exclude", " **/gen/** , ,**/build/**"));

    Path root = tempDir.toAbsolutePath().normalize();
    assertEquals(root, config.root());
    assertEquals(root.resolve("meta/provenance.yml"), config.registryFile());
    assertEquals(Duration.ofMillis(750), config.lockTimeout());
    assertEquals(3, config.scanThreads());
    assertEquals(List.of("**/gen/**", "**/build/**"), config.excludes());
  }

  @Test
  void fromMapRejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("root", tempDir.toString(), "scanThreads", "512")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("root", tempDir.toString(), "lockTimeoutMillis", "7200000")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of("root", tempDir.toString(), "lockTimeoutMillis", "soon")));
  }

  @Test
  void withRootMovesDefaultRegistry() {
    Path other = tempDir.resolve("other");

    EngineConfig moved = EngineConfig.forRoot(tempDir).withRoot(other);

    assertEquals(other.toAbsolutePath().normalize().resolve(".certifai/registry.yml"), moved.registryFile());
  }
}
