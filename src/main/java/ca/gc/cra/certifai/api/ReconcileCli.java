package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.application.lifecycle.CorruptionFinding;
import ca.gc.cra.certifai.application.lifecycle.ReconcileReport;
import ca.gc.cra.certifai.application.lifecycle.ReopenConflict;
import ca.gc.cra.certifai.application.lifecycle.ReopenedArtifact;
import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import java.util.Set;

/**
 * Reopens drifted finalized artifacts and reports registry inconsistencies.
 *
 * <p>Exits with {@link ExitCode#REGISTRY_CORRUPTION} when a finalized annotation has no registry entry, so CI can
 * stop before a manual repair.</p>
 *
 * @since 0.1.0
 */
public final class ReconcileCli {
  private static final String SUMMARY_USAGE = "usage: reconcile [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      CERTIFAI reconcile

      Usage:
        reconcile root=.

      Optional:
        root=DIR, config=FILE    As for scan
        lockTimeoutMillis=N      Registry lock timeout (default 10000)
        --json                   Print the report as JSON
        --verbose | --quiet      Adjust logging
        --help                   Show this message
      """;

  private ReconcileCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("reconcile", SUMMARY_USAGE, HELP_TEXT, Set.of(), args, (engine, kv, input) -> {
      ReconcileReport report = engine.reconcile();
      if (input.hasFlag("--json")) {
        CliPrinter.println(new ReportJsonWriter().reconcile(report));
      } else {
        for (ReopenedArtifact reopened : report.reopened()) {
          CliPrinter.println("reopened " + reopened.id() + " (" + reopened.previousDigest() + " -> "
              + reopened.currentDigest() + ")");
        }
        for (ArtifactId recovered : report.recovered()) {
          CliPrinter.println("recovered " + recovered);
        }
        for (ReopenConflict orphan : report.orphans()) {
          CliPrinter.println("orphaned: " + orphan.describe());
        }
        for (CorruptionFinding finding : report.corruption()) {
          CliPrinter.println("corrupt " + finding.id() + ": " + finding.message());
        }
        for (ScanProblem problem : report.problems()) {
          CliPrinter.println("skipped: " + problem);
        }
        CliPrinter.printField("Reopened", report.reopened().size());
        CliPrinter.printField("Recovered", report.recovered().size());
        CliPrinter.printField("Orphaned", report.orphans().size());
      }
      return report.corruption().isEmpty() ? ExitCode.SUCCESS : ExitCode.REGISTRY_CORRUPTION;
    });
  }
}
