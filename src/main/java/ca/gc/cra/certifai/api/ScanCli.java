package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.application.lifecycle.ScanReport;
import ca.gc.cra.certifai.application.port.ScanProblem;
import ca.gc.cra.certifai.domain.model.ArtifactId;
import ca.gc.cra.certifai.domain.model.LifecycleStage;
import java.util.Locale;
import java.util.Set;

/**
 * Lists tracked artifacts with their lifecycle stage.
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final String SUMMARY_USAGE = "usage: scan [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      CERTIFAI scan

      Usage:
        scan root=. [options]

      Optional:
        root=DIR                 Repository root (default .)
        config=FILE              Policy/engine YAML (default ROOT/.certifai.yml or ROOT/certifai.yml)
        registry=FILE            Registry document relative to root (default .certifai/registry.yml)
        exclude=GLOB,...         Root-relative globs never scanned (default **/target/**,**/.git/**)
        scanThreads=N            Parser worker threads
        --json                   Print the report as JSON
        --verbose | --quiet      Adjust logging
        --help                   Show this message
      """;

  private ScanCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("scan", SUMMARY_USAGE, HELP_TEXT, Set.of(), args, (engine, kv, input) -> {
      ScanReport report = engine.scan();
      if (input.hasFlag("--json")) {
        CliPrinter.println(new ReportJsonWriter().scan(report));
        return ExitCode.SUCCESS;
      }
      report.records().forEach(record -> CliPrinter.println(
          String.format(Locale.ROOT, "%-13s %s", record.stage(), record.id())));
      CliPrinter.println("");
      for (LifecycleStage stage : LifecycleStage.values()) {
        CliPrinter.printField(stage.name(), report.inStage(stage).size());
      }
      for (ArtifactId orphan : report.orphans()) {
        CliPrinter.println("orphaned registry entry: " + orphan);
      }
      for (ScanProblem problem : report.problems()) {
        CliPrinter.println("skipped: " + problem);
      }
      return ExitCode.SUCCESS;
    });
  }
}
