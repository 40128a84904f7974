package ca.gc.cra.certifai.infrastructure.java;

import ca.gc.cra.certifai.application.port.AnnotationCodec;
import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.ReviewerKind;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import com.github.javaparser.ParseResult;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.utils.StringEscapeUtils;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link AnnotationCodec} for the {@code @Certifai(...)} source annotation.
 *
 * <p>Typed members must be literals. Any other member is kept as an extra whose value is the member's source
 * text, token for token. Encoding emits members in a fixed order followed by extras in their original order.</p>
 *
 * @since 0.1.0
 */
public final class CertifaiAnnotationCodec implements AnnotationCodec {
  static final String AI_COMPOSED = "aiComposed";
  static final String HUMAN_CERTIFIED = "humanCertified";
  static final String SCRUTINY = "scrutiny";
  static final String DATE = "date";
  static final String NOTES = "notes";
  static final String HISTORY = "history";
  static final String REVIEWERS = "reviewers";
  static final String DONE = "done";

  private static final int MAX_INLINE_MEMBERS = 3;
  private static final String MEMBER_INDENT = "    ";

  @Override
  public TagMetadata decode(String source) throws AnnotationCorruptionException {
    Objects.requireNonNull(source, "source");
    ParseResult<AnnotationExpr> result = JavaParsers.newParser().parseAnnotation(source.trim());
    if (!result.isSuccessful() || result.getResult().isEmpty()) {
      throw new AnnotationCorruptionException("Unparsable annotation: " + JavaParsers.describe(result));
    }
    AnnotationExpr annotation = result.getResult().get();
    if (!CertifaiAnnotations.isCertifai(annotation)) {
      throw new AnnotationCorruptionException("Not a @" + CertifaiAnnotations.SIMPLE_NAME + " annotation: "
          + annotation.getNameAsString());
    }
    return decode(annotation);
  }

  /**
   * Decodes a parsed {@code @Certifai} annotation.
   *
   * @param annotation parsed annotation
   * @return decoded metadata
   * @throws AnnotationCorruptionException when the payload is malformed
   */
  public TagMetadata decode(AnnotationExpr annotation) throws AnnotationCorruptionException {
    if (annotation.isMarkerAnnotationExpr()) {
      return TagMetadata.empty();
    }
    if (!annotation.isNormalAnnotationExpr()) {
      throw new AnnotationCorruptionException("@" + CertifaiAnnotations.SIMPLE_NAME
          + " must use named members, found single-member form");
    }
    TagMetadata.Builder builder = TagMetadata.builder();
    Set<String> seen = new HashSet<>();
    for (MemberValuePair pair : annotation.asNormalAnnotationExpr().getPairs()) {
      String name = pair.getNameAsString();
      if (!seen.add(name)) {
        throw new AnnotationCorruptionException("Duplicate member '" + name + "'");
      }
      Expression value = pair.getValue();
      switch (name) {
        case AI_COMPOSED -> builder.aiComposed(string(name, value));
        case HUMAN_CERTIFIED -> builder.humanCertified(string(name, value));
        case SCRUTINY -> builder.scrutiny(scrutiny(name, string(name, value)));
        case DATE -> builder.date(instant(name, string(name, value)));
        case NOTES -> builder.notes(string(name, value));
        case HISTORY -> {
          for (Expression entry : elements(value)) {
            builder.addHistory(string(name, entry));
          }
        }
        case REVIEWERS -> {
          for (Expression entry : elements(value)) {
            builder.addReviewer(reviewer(entry));
          }
        }
        case DONE -> {
          if (!value.isBooleanLiteralExpr()) {
            throw new AnnotationCorruptionException("Member 'done' must be a boolean literal, found: " + value);
          }
          builder.done(value.asBooleanLiteralExpr().getValue());
        }
        default -> builder.putExtra(name, sourceText(value));
      }
    }
    return builder.build();
  }

  @Override
  public String encode(TagMetadata metadata, String indent) {
    Objects.requireNonNull(metadata, "metadata");
    String baseIndent = indent == null ? "" : indent;
    List<String> members = new ArrayList<>();
    if (!metadata.done()) {
      members.add(member(AI_COMPOSED, quote(metadata.aiComposed())));
    }
    members.add(member(HUMAN_CERTIFIED, quote(metadata.humanCertified())));
    if (!metadata.done() || metadata.scrutiny() != Scrutiny.AUTO) {
      members.add(member(SCRUTINY, quote(metadata.scrutiny().wireName())));
    }
    if (metadata.date() != null) {
      members.add(member(DATE, quote(metadata.date().toString())));
    }
    if (metadata.notes() != null) {
      members.add(member(NOTES, quote(metadata.notes())));
    }
    boolean lists = !metadata.history().isEmpty() || !metadata.reviewers().isEmpty();
    boolean extras = !metadata.extras().isEmpty();
    if (!lists && !extras && members.size() + (metadata.done() ? 1 : 0) <= MAX_INLINE_MEMBERS) {
      if (metadata.done()) {
        members.add(member(DONE, "true"));
      }
      return "@" + CertifaiAnnotations.SIMPLE_NAME + "(" + String.join(", ", members) + ")";
    }

    String memberIndent = baseIndent + MEMBER_INDENT;
    String elementIndent = memberIndent + MEMBER_INDENT;
    if (!metadata.history().isEmpty()) {
      List<String> entries = new ArrayList<>();
      for (String entry : metadata.history()) {
        entries.add(quote(entry));
      }
      members.add(member(HISTORY, block(entries, memberIndent, elementIndent)));
    }
    if (!metadata.reviewers().isEmpty()) {
      List<String> entries = new ArrayList<>();
      for (ReviewerInfo reviewer : metadata.reviewers()) {
        entries.add(reviewer(reviewer));
      }
      members.add(member(REVIEWERS, block(entries, memberIndent, elementIndent)));
    }
    if (metadata.done()) {
      members.add(member(DONE, "true"));
    }
    for (Map.Entry<String, String> extra : metadata.extras().entrySet()) {
      members.add(member(extra.getKey(), extra.getValue()));
    }

    StringBuilder out = new StringBuilder(256)
        .append('@').append(CertifaiAnnotations.SIMPLE_NAME).append('(');
    for (int i = 0; i < members.size(); i++) {
      out.append('\n').append(memberIndent).append(members.get(i));
      if (i < members.size() - 1) {
        out.append(',');
      }
    }
    return out.append(')').toString();
  }

  private static String block(List<String> entries, String memberIndent, String elementIndent) {
    StringBuilder out = new StringBuilder("{");
    for (int i = 0; i < entries.size(); i++) {
      out.append('\n').append(elementIndent).append(entries.get(i));
      if (i < entries.size() - 1) {
        out.append(',');
      }
    }
    return out.append('\n').append(memberIndent).append('}').toString();
  }

  private static String reviewer(ReviewerInfo reviewer) {
    List<String> members = new ArrayList<>(5);
    members.add(member("kind", quote(reviewer.kind().wireName())));
    members.add(member("id", quote(reviewer.id())));
    members.add(member(SCRUTINY, quote(reviewer.scrutiny().wireName())));
    if (reviewer.timestamp() != null) {
      members.add(member("timestamp", quote(reviewer.timestamp().toString())));
    }
    if (reviewer.notes() != null) {
      members.add(member(NOTES, quote(reviewer.notes())));
    }
    return "@" + CertifaiAnnotations.REVIEWER_NAME + "(" + String.join(", ", members) + ")";
  }

  private static ReviewerInfo reviewer(Expression expression) throws AnnotationCorruptionException {
    if (!expression.isAnnotationExpr() || !CertifaiAnnotations.isReviewer(expression.asAnnotationExpr())) {
      throw new AnnotationCorruptionException("Reviewer entries must be @" + CertifaiAnnotations.REVIEWER_NAME
          + " annotations, found: " + expression);
    }
    AnnotationExpr annotation = expression.asAnnotationExpr();
    if (!(annotation instanceof NormalAnnotationExpr normal)) {
      throw new AnnotationCorruptionException("Reviewer entries must use named members: " + expression);
    }
    ReviewerKind kind = null;
    String id = null;
    Scrutiny scrutiny = Scrutiny.AUTO;
    Instant timestamp = null;
    String notes = null;
    for (MemberValuePair pair : normal.getPairs()) {
      String name = pair.getNameAsString();
      String value = string(REVIEWERS + "." + name, pair.getValue());
      switch (name) {
        case "kind" -> kind = ReviewerKind.parse(value)
            .orElseThrow(() -> new AnnotationCorruptionException("Unknown reviewer kind '" + value + "'"));
        case "id" -> id = value;
        case SCRUTINY -> scrutiny = scrutiny(REVIEWERS + "." + name, value);
        case "timestamp" -> timestamp = instant(REVIEWERS + "." + name, value);
        case NOTES -> notes = value.isBlank() ? null : value;
        default -> throw new AnnotationCorruptionException("Unknown reviewer member '" + name + "'");
      }
    }
    if (kind == null || id == null || id.isBlank()) {
      throw new AnnotationCorruptionException("Reviewer entries require kind and id: " + expression);
    }
    return new ReviewerInfo(kind, id, scrutiny, timestamp, notes);
  }

  private static NodeList<Expression> elements(Expression value) {
    if (value.isArrayInitializerExpr()) {
      return value.asArrayInitializerExpr().getValues();
    }
    return new NodeList<>(value);
  }

  private static String string(String member, Expression value) throws AnnotationCorruptionException {
    if (value.isStringLiteralExpr()) {
      return value.asStringLiteralExpr().asString();
    }
    if (value.isTextBlockLiteralExpr()) {
      return value.asTextBlockLiteralExpr().asString();
    }
    throw new AnnotationCorruptionException("Member '" + member + "' must be a string literal, found: " + value);
  }

  private static Scrutiny scrutiny(String member, String value) throws AnnotationCorruptionException {
    return Scrutiny.parse(value)
        .orElseThrow(() -> new AnnotationCorruptionException(
            "Member '" + member + "' has unknown scrutiny '" + value + "'"));
  }

  private static Instant instant(String member, String value) throws AnnotationCorruptionException {
    if (value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw new AnnotationCorruptionException("Member '" + member + "' is not an ISO-8601 instant: " + value, ex);
    }
  }

  private static String sourceText(Expression value) {
    return value.getTokenRange().map(TokenRange::toString).orElseGet(value::toString);
  }

  private static String member(String name, String value) {
    return name + " = " + value;
  }

  private static String quote(String value) {
    return "\"" + StringEscapeUtils.escapeJava(value) + "\"";
  }
}
