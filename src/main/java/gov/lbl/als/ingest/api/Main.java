package gov.lbl.als.ingest.api;

import gov.lbl.als.ingest.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code beamline-ingest} dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: beamline-ingest <ingest|reconcile> [options]";
  private static final String HELP_TEXT = """
      Beamline dataset ingestion

      Usage:
        beamline-ingest <command> [options]

      Commands:
        ingest      Register a dataset in the Catalog and reconcile the Tracker (ingest --help)
        reconcile   Re-run Tracker reconciliation for an ingested dataset (reconcile --help)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
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
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safe = args == null ? new String[0] : args;
    int index = 0;
    while (index < safe.length && safe[index] != null && safe[index].trim().startsWith("-")) {
      CliInput global = CliInput.parse(new String[] {safe[index]});
      if (global.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (global.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
      } else {
        log.warn("Ignoring unknown global flag {}", safe[index]);
      }
      index++;
    }
    if (index >= safe.length || safe[index] == null || safe[index].isBlank()) {
      log.error("Missing command");
      CliPrinter.errorln(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safe[index].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safe, index + 1, safe.length);
    return switch (command) {
      case "ingest" -> IngestCli.run(delegateArgs);
      case "reconcile" -> ReconcileCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.errorln(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
