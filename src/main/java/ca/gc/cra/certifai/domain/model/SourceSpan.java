package ca.gc.cra.certifai.domain.model;

/**
 * Inclusive line/column range within a source file (1-based, as reported by the parser).
 *
 * @param beginLine first line
 * @param beginColumn first column
 * @param endLine last line
 * @param endColumn last column
 * @since 0.1.0
 */
public record SourceSpan(int beginLine, int beginColumn, int endLine, int endColumn) {
  public SourceSpan {
    if (beginLine < 1 || beginColumn < 1 || endLine < beginLine) {
      throw new IllegalArgumentException("invalid span " + beginLine + ":" + beginColumn + "-" + endLine + ":" + endColumn);
    }
  }

  @Override
  public String toString() {
    return beginLine + ":" + beginColumn + "-" + endLine + ":" + endColumn;
  }
}
