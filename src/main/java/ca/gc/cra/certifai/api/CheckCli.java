package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.domain.policy.PolicyReport;
import ca.gc.cra.certifai.domain.policy.PolicyViolation;
import java.util.Locale;
import java.util.Set;

/**
 * Evaluates the policy over the current tree; the CI gate.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final String SUMMARY_USAGE = "usage: check [root=DIR] [config=FILE] [--json]";
  private static final String HELP_TEXT = """
      CERTIFAI check

      Usage:
        check root=. --json

      Optional:
        root=DIR, config=FILE    As for scan
        --json                   Print the report as JSON
        --verbose | --quiet      Adjust logging
        --help                   Show this message

      Exit status is 1 when the policy reports violations.
      """;

  private CheckCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return EngineCliSupport.run("check", SUMMARY_USAGE, HELP_TEXT, Set.of(), args, (engine, kv, input) -> {
      PolicyReport report = engine.check();
      if (input.hasFlag("--json")) {
        CliPrinter.println(new ReportJsonWriter().policy(report));
      } else {
        CliPrinter.printField("Coverage", String.format(Locale.ROOT, "%d/%d (%.2f%%)",
            report.certifiedCount(), report.eligibleCount(), report.coverageRatio() * 100d));
        CliPrinter.printField("Agent ratio", String.format(Locale.ROOT, "%.2f%%", report.agentRatio() * 100d));
        CliPrinter.printField("Pending", report.pending().size());
        for (PolicyViolation violation : report.violations()) {
          CliPrinter.println("violation " + violation.kind() + ": " + violation.message());
        }
        CliPrinter.println(report.passed() ? "Policy check passed" : "Policy check failed");
      }
      return report.passed() ? ExitCode.SUCCESS : ExitCode.POLICY_FAILURE;
    });
  }
}
