package ca.gc.cra.certifai.infrastructure.java;

import ca.gc.cra.certifai.application.port.MetricsPort;
import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.application.port.ScanResult;
import ca.gc.cra.certifai.application.port.SourceScanner;
import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.SourceSpan;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.infrastructure.exec.ExecutorFactories;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AnnotationExpr;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SourceScanner} parsing {@code *.java} files with JavaParser on a fixed worker pool.
 *
 * <p>Each task owns its own parser and returns an immutable {@link ScanResult}. Unreadable or unparsable files
 * and malformed provenance annotations are reported as problems; the remaining artifacts are still returned.</p>
 *
 * @since 0.1.0
 */
public final class JavaSourceScanner implements SourceScanner {
  private static final Logger log = LoggerFactory.getLogger(JavaSourceScanner.class);
  private static final String SOURCE_SUFFIX = ".java";

  private final CanonicalDigester digester;
  private final CertifaiAnnotationCodec codec;
  private final List<PathMatcher> excludes;
  private final int threads;
  private final MetricsPort metrics;

  /**
   * Creates a scanner.
   *
   * @param excludes glob patterns matched against root-relative paths
   * @param threads worker threads used for parsing
   * @param metrics metrics sink
   */
  public JavaSourceScanner(List<String> excludes, int threads, MetricsPort metrics) {
    this(new CanonicalDigester(), new CertifaiAnnotationCodec(), excludes, threads, metrics);
  }

  JavaSourceScanner(
      CanonicalDigester digester,
      CertifaiAnnotationCodec codec,
      List<String> excludes,
      int threads,
      MetricsPort metrics) {
    this.digester = Objects.requireNonNull(digester, "digester");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.excludes = new ArrayList<>();
    for (String pattern : excludes == null ? List.<String>of() : excludes) {
      this.excludes.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1");
    }
    this.threads = threads;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public ScanResult scan(Path root) throws IOException {
    Path base = root.toAbsolutePath().normalize();
    List<Path> files = sourceFiles(base);
    log.debug("Scanning {} source files under {}", files.size(), base);
    if (files.isEmpty()) {
      return new ScanResult(List.of(), List.of());
    }

    List<Artifact> artifacts = new ArrayList<>();
    List<ScanProblem> problems = new ArrayList<>();
    ExecutorService pool = ExecutorFactories.newScanPool(Math.min(threads, files.size()), "certifai-scan",
        (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    try {
      List<Future<ScanResult>> futures = new ArrayList<>(files.size());
      for (Path file : files) {
        futures.add(pool.submit(() -> scanFile(base, file)));
      }
      for (int i = 0; i < futures.size(); i++) {
        ScanResult partial = await(futures.get(i), files.get(i));
        artifacts.addAll(partial.artifacts());
        problems.addAll(partial.problems());
      }
    } finally {
      pool.shutdownNow();
    }
    metrics.observe("certifai.scan.artifacts", artifacts.size());
    if (!problems.isEmpty()) {
      log.warn("Scan of {} skipped {} files or artifacts", base, problems.size());
    }
    return new ScanResult(artifacts, problems);
  }

  @Override
  public ScanResult scanFile(Path root, Path file) {
    Path base = root.toAbsolutePath().normalize();
    Path absolute = file.toAbsolutePath().normalize();
    metrics.increment("certifai.scan.files");
    String source;
    try {
      source = Files.readString(absolute, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      return failed(absolute, "unreadable: " + ex.getMessage());
    }
    ParseResult<CompilationUnit> parsed = JavaParsers.newParser().parse(source);
    if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
      return failed(absolute, JavaParsers.describe(parsed));
    }

    String relative = relativePath(base, absolute);
    List<Artifact> artifacts = new ArrayList<>();
    List<ScanProblem> problems = new ArrayList<>();
    for (DeclarationCollector.Declaration declaration : new DeclarationCollector().collect(parsed.getResult().get())) {
      ArtifactId id = new ArtifactId(relative, declaration.qualifiedName());
      List<AnnotationExpr> annotations = CertifaiAnnotations.find(declaration.node());
      AnnotationExpr annotation = null;
      TagMetadata inline = null;
      if (annotations.size() > 1) {
        problems.add(new ScanProblem(ScanProblem.Kind.ANNOTATION, absolute, declaration.qualifiedName(),
            "multiple @" + CertifaiAnnotations.SIMPLE_NAME + " annotations"));
        continue;
      }
      if (annotations.size() == 1) {
        annotation = annotations.get(0);
        try {
          inline = codec.decode(annotation);
        } catch (AnnotationCorruptionException ex) {
          log.warn("Skipping {}: {}", id, ex.getMessage());
          problems.add(new ScanProblem(ScanProblem.Kind.ANNOTATION, absolute, declaration.qualifiedName(),
              ex.getMessage()));
          continue;
        }
      }
      artifacts.add(new Artifact(
          id,
          absolute,
          declaration.kind(),
          span(declaration.node()),
          annotation == null ? null : span(annotation),
          inline,
          digester.digest(declaration.node())));
    }
    log.debug("Scanned {}: {} artifacts", relative, artifacts.size());
    return new ScanResult(artifacts, problems);
  }

  private List<Path> sourceFiles(Path base) throws IOException {
    try (Stream<Path> walk = Files.walk(base)) {
      return walk
          .filter(Files::isRegularFile)
          .filter(path -> path.getFileName().toString().endsWith(SOURCE_SUFFIX))
          .filter(path -> !excluded(base.relativize(path)))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private boolean excluded(Path relative) {
    Path anchored = Path.of(".").resolve(relative);
    for (PathMatcher matcher : excludes) {
      if (matcher.matches(relative) || matcher.matches(anchored)) {
        return true;
      }
    }
    return false;
  }

  private ScanResult await(Future<ScanResult> future, Path file) throws IOException {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Scan interrupted at " + file, ex);
    } catch (ExecutionException ex) {
      log.warn("Parser failed on {}", file, ex.getCause());
      return failed(file, "parser failure: " + ex.getCause());
    }
  }

  private static ScanResult failed(Path file, String message) {
    log.warn("Skipping {}: {}", file, message);
    return new ScanResult(List.of(), List.of(new ScanProblem(ScanProblem.Kind.PARSE, file, null, message)));
  }

  static String relativePath(Path base, Path file) {
    Path relative = file.startsWith(base) ? base.relativize(file) : file;
    return relative.toString().replace('\\', '/');
  }

  static SourceSpan span(Node node) {
    Range range = node.getRange()
        .orElseThrow(() -> new IllegalStateException("parsed node without range: " + node.getClass().getSimpleName()));
    return new SourceSpan(range.begin.line, range.begin.column, range.end.line, range.end.column);
  }
}
