package ca.gc.cra.certifai.infrastructure.java;

import ca.gc.cra.certifai.application.port.AnnotationCodec;
import ca.gc.cra.certifai.application.port.InlineAnnotationWriter;
import ca.gc.cra.certifai.application.port.InlineEdit;
import ca.gc.cra.certifai.domain.model.Artifact;
import ca.gc.cra.certifai.domain.model.SourceSpan;
import ca.gc.cra.certifai.infrastructure.io.AtomicFiles;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InlineAnnotationWriter} splicing encoded annotations into Java source text.
 *
 * <p>Only the characters of the provenance annotation are replaced; a Pristine declaration receives a new
 * annotation line at its first annotation or modifier, below its Javadoc. The import of the annotation type is
 * added when missing. The file is replaced atomically.</p>
 *
 * @since 0.1.0
 */
public final class JavaSourceRewriter implements InlineAnnotationWriter {
  private static final Logger log = LoggerFactory.getLogger(JavaSourceRewriter.class);

  private final AnnotationCodec codec;

  public JavaSourceRewriter(AnnotationCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public void write(Path file, List<InlineEdit> edits) throws IOException {
    Objects.requireNonNull(file, "file");
    if (edits == null || edits.isEmpty()) {
      return;
    }
    String source = Files.readString(file, StandardCharsets.UTF_8);
    String updated = rewrite(source, edits);
    AtomicFiles.writeString(file, updated);
    log.debug("Rewrote {} provenance annotations in {}", edits.size(), file);
  }

  /**
   * Applies edits to source text.
   *
   * @param source current file content; edits must have been scanned from it
   * @param edits edits to apply
   * @return rewritten content
   * @throws IOException when the content no longer parses or an artifact moved since it was scanned
   */
  String rewrite(String source, List<InlineEdit> edits) throws IOException {
    ParseResult<CompilationUnit> parsed = JavaParsers.newParser().parse(source);
    if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
      throw new IOException("Source no longer parses: " + JavaParsers.describe(parsed));
    }
    CompilationUnit unit = parsed.getResult().get();
    Map<String, DeclarationCollector.Declaration> declarations = new HashMap<>();
    for (DeclarationCollector.Declaration declaration : new DeclarationCollector().collect(unit)) {
      declarations.putIfAbsent(declaration.qualifiedName(), declaration);
    }
    LineIndex index = new LineIndex(source);
    String newline = index.lineSeparator();
    List<Splice> splices = new ArrayList<>(edits.size() + 1);
    for (InlineEdit edit : edits) {
      requireScannedPosition(declarations, edit.artifact());
      splices.add(splice(source, index, edit, newline));
    }
    importSplice(unit, index, newline).ifPresent(splices::add);

    splices.sort(Comparator.comparingInt(Splice::start).reversed());
    StringBuilder out = new StringBuilder(source);
    int previousStart = Integer.MAX_VALUE;
    for (Splice splice : splices) {
      if (splice.end() > previousStart) {
        throw new IllegalArgumentException("overlapping annotation edits at offset " + splice.start());
      }
      out.replace(splice.start(), splice.end(), splice.text());
      previousStart = splice.start();
    }
    return out.toString();
  }

  private Splice splice(String source, LineIndex index, InlineEdit edit, String newline) {
    Artifact artifact = edit.artifact();
    SourceSpan anchor = artifact.annotationSpan() != null ? artifact.annotationSpan() : artifact.span();
    int start = index.offset(anchor.beginLine(), anchor.beginColumn());
    String indent = index.indentBefore(start);
    String encoded = codec.encode(edit.metadata(), indent).replace("\n", newline);
    if (artifact.annotationSpan() != null) {
      int end = index.offset(anchor.endLine(), anchor.endColumn()) + 1;
      return new Splice(start, end, encoded);
    }
    boolean ownLine = index.lineStart(start) + indent.length() == start;
    String text = ownLine ? encoded + newline + indent : encoded + " ";
    return new Splice(start, start, text);
  }

  /**
   * Fails when the declaration or its annotation no longer sits where the scan recorded it, so a splice never lands
   * in text edited after the scan.
   */
  private static void requireScannedPosition(
      Map<String, DeclarationCollector.Declaration> declarations, Artifact artifact) throws IOException {
    DeclarationCollector.Declaration declaration = declarations.get(artifact.id().qualifiedName());
    if (declaration != null && JavaSourceScanner.span(declaration.node()).equals(artifact.span())) {
      List<AnnotationExpr> annotations = CertifaiAnnotations.find(declaration.node());
      SourceSpan annotation = annotations.size() == 1 ? JavaSourceScanner.span(annotations.get(0)) : null;
      if (annotations.size() <= 1 && Objects.equals(annotation, artifact.annotationSpan())) {
        return;
      }
    }
    throw new IOException(artifact.id() + " changed in " + artifact.file() + " after it was scanned; scan again");
  }

  private static Optional<Splice> importSplice(CompilationUnit unit, LineIndex index, String newline) {
    if (CertifaiAnnotations.isImported(unit)) {
      return Optional.empty();
    }
    String statement = "import " + CertifaiAnnotations.QUALIFIED_NAME + ";";
    if (!unit.getImports().isEmpty()) {
      ImportDeclaration last = unit.getImports().get(unit.getImports().size() - 1);
      int end = endOffset(index, last.getRange());
      return Optional.of(new Splice(end, end, newline + statement));
    }
    Optional<PackageDeclaration> pkg = unit.getPackageDeclaration();
    if (pkg.isPresent()) {
      int end = endOffset(index, pkg.get().getRange());
      return Optional.of(new Splice(end, end, newline + newline + statement));
    }
    return Optional.of(new Splice(0, 0, statement + newline + newline));
  }

  private static int endOffset(LineIndex index, Optional<Range> range) {
    Range r = range.orElseThrow(() -> new IllegalStateException("parsed node without range"));
    return index.offset(r.end.line, r.end.column) + 1;
  }

  private record Splice(int start, int end, String text) {}

  /**
   * Maps JavaParser positions (1-based line and column, tab width 1) to character offsets.
   */
  static final class LineIndex {
    private final String source;
    private final List<Integer> starts = new ArrayList<>();
    private final String lineSeparator;

    LineIndex(String source) {
      this.source = source;
      starts.add(0);
      String separator = null;
      for (int i = 0; i < source.length(); i++) {
        char c = source.charAt(i);
        if (c == '\r') {
          boolean crlf = i + 1 < source.length() && source.charAt(i + 1) == '\n';
          if (separator == null) {
            separator = crlf ? "\r\n" : "\r";
          }
          if (crlf) {
            i++;
          }
          starts.add(i + 1);
        } else if (c == '\n') {
          if (separator == null) {
            separator = "\n";
          }
          starts.add(i + 1);
        }
      }
      this.lineSeparator = separator == null ? System.lineSeparator() : separator;
    }

    String lineSeparator() {
      return lineSeparator;
    }

    int offset(int line, int column) {
      if (line < 1 || line > starts.size()) {
        throw new IllegalArgumentException("line " + line + " outside source of " + starts.size() + " lines");
      }
      int offset = starts.get(line - 1) + column - 1;
      if (offset < 0 || offset > source.length()) {
        throw new IllegalArgumentException("column " + column + " outside line " + line);
      }
      return offset;
    }

    int lineStart(int offset) {
      int line = 0;
      for (int i = 0; i < starts.size() && starts.get(i) <= offset; i++) {
        line = i;
      }
      return starts.get(line);
    }

    /**
     * Leading whitespace of the line holding {@code offset}, up to the first non-blank character.
     */
    String indentBefore(int offset) {
      int start = lineStart(offset);
      int end = start;
      while (end < offset && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
        end++;
      }
      return source.substring(start, end);
    }
  }
}
