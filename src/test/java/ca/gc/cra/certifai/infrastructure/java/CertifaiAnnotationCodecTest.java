package ca.gc.cra.certifai.infrastructure.java;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.certifai.domain.error.AnnotationCorruptionException;
import ca.gc.cra.certifai.domain.model.ReviewerInfo;
import ca.gc.cra.certifai.domain.model.ReviewerKind;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CertifaiAnnotationCodecTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final CertifaiAnnotationCodec codec = new CertifaiAnnotationCodec();

  @Test
  void shortPayloadRendersOnOneLine() {
    TagMetadata metadata = TagMetadata.builder().aiComposed("gpt-4o").build();

    assertEquals("@Certifai(aiComposed = \"gpt-4o\", humanCertified = \"pending\", scrutiny = \"auto\")",
        codec.encode(metadata, "  "));
  }

  @Test
  void finalizedProjectionRendersMinimalForm() {
    TagMetadata projection = TagMetadata.builder().humanCertified("alice").done(true).build();

    assertEquals("@Certifai(humanCertified = \"alice\", done = true)", codec.encode(projection, ""));
  }

  @Test
  void fullPayloadRoundTripsIncludingExtras() throws AnnotationCorruptionException {
    TagMetadata metadata = TagMetadata.builder()
        .aiComposed("gpt-4o")
        .humanCertified("alice")
        .scrutiny(Scrutiny.HIGH)
        .date(T0)
        .notes("checked \"edge\" cases")
        .addHistory("2026-03-01T09:00:00Z annotated ai_composed=gpt-4o last_commit=unknown")
        .addHistory("2026-03-01T10:00:00Z certified reviewer=alice scrutiny=high")
        .addReviewer(ReviewerInfo.human("alice", Scrutiny.HIGH, T0, "ok"))
        .addReviewer(ReviewerInfo.agent("review-bot", Scrutiny.MEDIUM, T0, null))
        .putExtra("ticket", "\"SEC-42\"")
        .putExtra("weights", "{1, 2, 3}")
        .build();

    String encoded = codec.encode(metadata, "    ");
    TagMetadata decoded = codec.decode(encoded);

    assertEquals(metadata, decoded);
    assertTrue(encoded.contains("\n        history = {"));
    assertTrue(encoded.contains("ticket = \"SEC-42\""));
    assertTrue(encoded.contains("weights = {1, 2, 3}"));
  }

  @Test
  void markerAnnotationDecodesToEmptyMetadata() throws AnnotationCorruptionException {
    assertEquals(TagMetadata.empty(), codec.decode("@Certifai"));
  }

  @Test
  void qualifiedNameIsRecognized() throws AnnotationCorruptionException {
    TagMetadata metadata = codec.decode(
        "@ca.gc.cra.certifai.annotation.Certifai(aiComposed = \"gpt\", done = false)");

    assertEquals("gpt", metadata.aiComposed());
    assertFalse(metadata.done());
  }

  @Test
  void reviewerEntriesDecode() throws AnnotationCorruptionException {
    TagMetadata metadata = codec.decode("""
        @Certifai(reviewers = {
            @Certifai.Reviewer(kind = "agent", id = "bot", scrutiny = "low", timestamp = "2026-03-01T10:00:00Z")
        })
        """);

    ReviewerInfo reviewer = metadata.reviewers().get(0);
    assertEquals(ReviewerKind.AGENT, reviewer.kind());
    assertEquals("bot", reviewer.id());
    assertEquals(Scrutiny.LOW, reviewer.scrutiny());
    assertEquals(T0, reviewer.timestamp());
  }

  @Test
  void singleHistoryValueWithoutBracesIsAccepted() throws AnnotationCorruptionException {
    TagMetadata metadata = codec.decode("@Certifai(history = \"2026-03-01T10:00:00Z annotated\")");

    assertEquals(List.of("2026-03-01T10:00:00Z annotated"), metadata.history());
  }

  @Test
  void malformedPayloadsAreRejected() {
    for (String source : List.of(
        "@Certifai(\"gpt\")",
        "@Certifai(done = \"yes\")",
        "@Certifai(scrutiny = \"extreme\")",
        "@Certifai(aiComposed = MODEL)",
        "@Certifai(date = \"yesterday\")",
        "@Certifai(notes = \"a\", notes = \"b\")",
        "@Certifai(reviewers = {@Certifai.Reviewer(id = \"x\")})",
        "@Certifai(reviewers = {@Certifai.Reviewer(kind = \"robot\", id = \"x\")})",
        "@Certifai(reviewers = {\"alice\"})",
        "@Other(aiComposed = \"gpt\")",
        "@Certifai(")) {
      assertThrows(AnnotationCorruptionException.class, () -> codec.decode(source), source);
    }
  }

  @Test
  void extrasKeepSourceTextVerbatim() throws AnnotationCorruptionException {
    TagMetadata metadata = codec.decode("@Certifai(aiComposed = \"gpt\", risk = Risk.HIGH, budget = 3 * 60)");

    assertEquals(Map.of("risk", "Risk.HIGH", "budget", "3 * 60"), metadata.extras());
  }
}
