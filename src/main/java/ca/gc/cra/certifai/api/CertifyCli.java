package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.Scrutiny;
import ca.gc.cra.certifai.domain.model.TagMetadata;
import java.util.Set;

/**
 * Records a human or agent approval of an annotated artifact.
 *
 * @since 0.1.0
 */
public final class CertifyCli {
  private static final String SUMMARY_USAGE =
      "usage: certify artifact=PATH::NAME reviewer=ID|agent=ID [scrutiny=auto|low|medium|high] [notes=TEXT] "
          + "[--include-existing] [root=DIR] [config=FILE]";
  private static final String HELP_TEXT = """
      CERTIFAI certify

      Usage:
        certify artifact='src/main/java/p/A.java::p.A' reviewer=alice scrutiny=high
        certify artifact='src/main/java/p/A.java::p.A' agent=review-bot

      Required:
        artifact=PATH::NAME      Artifact identity as printed by scan
        reviewer=ID | agent=ID   Human reviewer or allow-listed agent (exactly one)

      Optional:
        scrutiny=LEVEL           auto|low|medium|high; human default medium, agent default from policy
        notes=TEXT               Reviewer notes
        --include-existing       Re-certify an artifact that is already certified or finalized
        root=DIR, config=FILE    As for scan
        --verbose | --quiet      Adjust logging
        --help                   Show this message
      """;
  private static final Set<String> KEYS = Set.of("artifact", "reviewer", "agent", "scrutiny", "notes");
  static final Scrutiny DEFAULT_HUMAN_SCRUTINY = Scrutiny.MEDIUM;

  private CertifyCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("certify", SUMMARY_USAGE, HELP_TEXT, KEYS, args, (engine, kv, input) -> {
      ArtifactId id = ConfigCliUtils.requireArtifact(kv);
      Scrutiny scrutiny = ConfigCliUtils.optionalScrutiny(kv);
      String reviewer = kv.get("reviewer");
      String agent = kv.get("agent");
      if ((reviewer == null) == (agent == null)) {
        throw new IllegalArgumentException("exactly one of reviewer= or agent= is required");
      }
      TagMetadata metadata;
      if (agent != null) {
        metadata = engine.certifyAgent(id, agent, scrutiny, kv.get("notes"));
        CliPrinter.println("agent-certified " + id + " by " + agent);
      } else {
        Scrutiny applied = scrutiny == null ? DEFAULT_HUMAN_SCRUTINY : scrutiny;
        metadata = engine.certify(id, reviewer, applied, kv.get("notes"), input.hasFlag("--include-existing"));
        CliPrinter.println("certified " + id + " by " + reviewer + " at " + applied.wireName());
      }
      CliPrinter.printField("Reviewers", metadata.reviewers().size());
      return ExitCode.SUCCESS;
    });
  }
}
