package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.registry.RegistryEntry;
import java.util.List;
import java.util.Set;

/**
 * Moves certified artifacts into the registry.
 *
 * @since 0.1.0
 */
public final class FinalizeCli {
  private static final String SUMMARY_USAGE = "usage: finalize artifact=PATH::NAME|--all [root=DIR] [config=FILE]";
  private static final String HELP_TEXT = """
      CERTIFAI finalize

      Usage:
        finalize artifact='src/main/java/p/A.java::p.A'
        finalize --all

      Required (one of):
        artifact=PATH::NAME      Artifact identity as printed by scan
        --all                    Finalize every artifact whose reviews satisfy the policy

      Optional:
        root=DIR, config=FILE    As for scan
        lockTimeoutMillis=N      Registry lock timeout (default 10000)
        --verbose | --quiet      Adjust logging
        --help                   Show this message
      """;

  private FinalizeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("finalize", SUMMARY_USAGE, HELP_TEXT, Set.of("artifact"), args,
        (engine, kv, input) -> {
          if (input.hasFlag("--all")) {
            if (kv.containsKey("artifact")) {
              throw new IllegalArgumentException("--all and artifact= are mutually exclusive");
            }
            List<RegistryEntry> entries = engine.finalizeAll();
            entries.forEach(entry -> CliPrinter.println("finalized " + entry.id()));
            CliPrinter.printField("Finalized", entries.size());
            return ExitCode.SUCCESS;
          }
          ArtifactId id = ConfigCliUtils.requireArtifact(kv);
          RegistryEntry entry = engine.finalize(id);
          CliPrinter.println("finalized " + id + " digest=" + entry.digest());
          return ExitCode.SUCCESS;
        });
  }
}
