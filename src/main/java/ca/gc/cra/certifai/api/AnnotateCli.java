package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inserts provenance annotations above Pristine artifacts.
 *
 * @since 0.1.0
 */
public final class AnnotateCli {
  private static final String SUMMARY_USAGE =
      "usage: annotate artifact=PATH::NAME|--all [aiComposed=MODEL] [notes=TEXT] [root=DIR] [config=FILE]";
  private static final String HELP_TEXT = """
      CERTIFAI annotate

      Usage:
        annotate artifact='src/main/java/p/A.java::p.A.run(int)' aiComposed=model-x
        annotate --all aiComposed=model-x

      Required (one of):
        artifact=PATH::NAME      Artifact identity as printed by scan
        --all                    Annotate every Pristine artifact under root

      Optional:
        aiComposed=MODEL         Composing model or agent (default pending)
        notes=TEXT               Free-text notes
        root=DIR, config=FILE    As for scan
        --verbose | --quiet      Adjust logging
        --help                   Show this message
      """;
  private static final Set<String> KEYS = Set.of("artifact", "aiComposed", "notes");

  private AnnotateCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("annotate", SUMMARY_USAGE, HELP_TEXT, KEYS, args, (engine, kv, input) -> {
      String aiComposed = kv.get("aiComposed");
      String notes = kv.get("notes");
      if (input.hasFlag("--all")) {
        requireNoArtifact(kv);
        List<ArtifactId> annotated = engine.annotateAll(aiComposed, notes);
        annotated.forEach(id -> CliPrinter.println("annotated " + id));
        CliPrinter.printField("Annotated", annotated.size());
        return ExitCode.SUCCESS;
      }
      ArtifactId id = ConfigCliUtils.requireArtifact(kv);
      TagMetadata metadata = engine.annotate(id, aiComposed, notes);
      CliPrinter.println("annotated " + id + " (ai_composed=" + metadata.aiComposed() + ")");
      return ExitCode.SUCCESS;
    });
  }

  private static void requireNoArtifact(Map<String, String> kv) {
    if (kv.containsKey("artifact")) {
      throw new IllegalArgumentException("--all and artifact= are mutually exclusive");
    }
  }
}
