package ca.gc.cra.certifai.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Walks a source tree and describes every trackable declaration.
 *
 * <p>Per-file failures are reported in {@link ScanResult#problems()} and never abort the scan.</p>
 *
 * @since 0.1.0
 */
public interface SourceScanner {
  /**
   * Scans every source file under {@code root}.
   *
   * @param root repository root; identities are relative to it
   * @return artifacts and problems
   * @throws IOException when the tree itself cannot be walked
   */
  ScanResult scan(Path root) throws IOException;

  /**
   * Scans a single file.
   *
   * @param root repository root
   * @param file file below {@code root}
   * @return artifacts and problems of that file
   */
  ScanResult scanFile(Path root, Path file);
}
