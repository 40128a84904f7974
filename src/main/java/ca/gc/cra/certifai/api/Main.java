package ca.gc.cra.certifai.api;

import ca.gc.cra.certifai.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CERTIFAI CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: certifai <scan|annotate|certify|finalize|reconcile|check> [options]";
  private static final String HELP_TEXT = """
      CERTIFAI command dispatcher

      Usage:
        certifai <command> [options]

      Commands:
        scan        List artifacts and their lifecycle stage
        annotate    Insert provenance annotations above Pristine artifacts
        certify     Record a human or agent approval
        finalize    Move certified artifacts into the registry
        reconcile   Reopen drifted artifacts and report registry inconsistencies
        check       Evaluate the policy; exits 1 on violations

      Global flags:
        --help      Show this message (command --help for details)
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = firstCommand(tokens);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (CliInput.parse(Arrays.copyOfRange(tokens, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = tokens[commandIndex].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(tokens, commandIndex + 1, tokens.length);

    return switch (command) {
      case "scan" -> ScanCli.run(delegateArgs);
      case "annotate" -> AnnotateCli.run(delegateArgs);
      case "certify" -> CertifyCli.run(delegateArgs);
      case "finalize" -> FinalizeCli.run(delegateArgs);
      case "reconcile" -> ReconcileCli.run(delegateArgs);
      case "check" -> CheckCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommand(String[] tokens) {
    for (int i = 0; i < tokens.length; i++) {
      String token = tokens[i];
      if (token != null && !token.isBlank() && !token.trim().startsWith("-") && !token.contains("=")) {
        return i;
      }
    }
    return -1;
  }
}
