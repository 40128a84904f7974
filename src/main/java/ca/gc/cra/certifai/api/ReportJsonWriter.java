package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.application.lifecycle.CorruptionFinding;
import ca.gc.cra.certifai.application.lifecycle.ReconcileReport;
import ca.gc.cra.certifai.application.lifecycle.ReopenConflict;
import ca.gc.cra.certifai.application.lifecycle.ReopenedArtifact;
import ca.gc.cra.certifai.application.lifecycle.ScanReport;
import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.ArtifactRecord;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.policy.PolicyViolation;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Renders engine reports as JSON for {@code --json} output, using Jackson's streaming generator.
 *
 * <p>Each report is one pretty-printed object with a {@code schemaVersion} field.</p>
 */
final class ReportJsonWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();

  String scan(ScanReport report) {
    return render(gen -> {
      gen.writeStringField("report", "scan");
      gen.writeArrayFieldStart("artifacts");
      for (ArtifactRecord record : report.records()) {
        gen.writeStartObject();
        gen.writeStringField("id", record.id().toString());
        gen.writeStringField("kind", record.artifact().kind().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("stage", record.stage().name());
        gen.writeStringField("digest", record.artifact().digest());
        TagMetadata metadata = record.metadata();
        if (metadata != null) {
          gen.writeStringField("aiComposed", metadata.aiComposed());
          gen.writeStringField("humanCertified", metadata.humanCertified());
          gen.writeStringField("scrutiny", metadata.scrutiny().wireName());
          gen.writeNumberField("reviewers", metadata.reviewers().size());
          gen.writeBooleanField("stale", metadata.isStale());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeIds(gen, "orphans", report.orphans());
      writeProblems(gen, report.problems());
    });
  }

  String reconcile(ReconcileReport report) {
    return render(gen -> {
      gen.writeStringField("report", "reconcile");
      gen.writeBooleanField("clean", report.isClean());
      gen.writeArrayFieldStart("reopened");
      for (ReopenedArtifact reopened : report.reopened()) {
        gen.writeStartObject();
        gen.writeStringField("id", reopened.id().toString());
        gen.writeStringField("previousDigest", reopened.previousDigest());
        gen.writeStringField("currentDigest", reopened.currentDigest());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeIds(gen, "recovered", report.recovered());
      gen.writeArrayFieldStart("orphans");
      for (ReopenConflict orphan : report.orphans()) {
        gen.writeStartObject();
        gen.writeStringField("id", orphan.entry().id().toString());
        gen.writeStringField("finalizedAt", orphan.entry().finalizedAt().toString());
        gen.writeStringField("digest", orphan.entry().digest());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("corruption");
      for (CorruptionFinding finding : report.corruption()) {
        gen.writeStartObject();
        gen.writeStringField("id", finding.id().toString());
        gen.writeStringField("kind", finding.kind().name());
        gen.writeStringField("message", finding.message());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeProblems(gen, report.problems());
    });
  }

  String policy(PolicyReport report) {
    return render(gen -> {
      gen.writeStringField("report", "check");
      gen.writeBooleanField("passed", report.passed());
      gen.writeNumberField("coverageRatio", report.coverageRatio());
      gen.writeNumberField("certified", report.certifiedCount());
      gen.writeNumberField("eligible", report.eligibleCount());
      gen.writeNumberField("agentRatio", report.agentRatio());
      gen.writeArrayFieldStart("violations");
      for (PolicyViolation violation : report.violations()) {
        gen.writeStartObject();
        gen.writeStringField("kind", violation.kind().name());
        if (violation.artifact() != null) {
          gen.writeStringField("id", violation.artifact().toString());
        }
        gen.writeStringField("message", violation.message());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      writeIds(gen, "pending", report.pending());
    });
  }

  private void writeIds(JsonGenerator gen, String field, List<ArtifactId> ids) throws IOException {
    gen.writeArrayFieldStart(field);
    for (ArtifactId id : ids) {
      gen.writeString(id.toString());
    }
    gen.writeEndArray();
  }

  private void writeProblems(JsonGenerator gen, List<ScanProblem> problems) throws IOException {
    gen.writeArrayFieldStart("problems");
    for (ScanProblem problem : problems) {
      gen.writeStartObject();
      gen.writeStringField("kind", problem.kind().name());
      gen.writeStringField("file", problem.file().toString());
      if (problem.artifact() != null) {
        gen.writeStringField("artifact", problem.artifact());
      }
      gen.writeStringField("message", problem.message());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private String render(Body body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      body.write(gen);
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON report", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface Body {
    void write(JsonGenerator gen) throws IOException;
  }
}
