package gov.lbl.als.ingest.api;

import gov.lbl.als.ingest.application.pipeline.ReconcileRequest;
import gov.lbl.als.ingest.config.CompositionRoot;
import gov.lbl.als.ingest.config.EnvironmentConfig;
import gov.lbl.als.ingest.config.IngestConfig;
import gov.lbl.als.ingest.domain.ingest.IngestResult;
import gov.lbl.als.ingest.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for re-running Tracker reconciliation on a dataset that already has a Catalog dataset,
 * for example after the Tracker was unreachable during ingestion or after files changed.
 *
 * @since 0.1.0
 */
public final class ReconcileCli {
  private static final Logger log = LoggerFactory.getLogger(ReconcileCli.class);
  private static final String SUMMARY_USAGE =
      "usage: reconcile datasetPath=PATH trackerUrl=URL trackerUsername=USER "
          + "trackerPassword=SECRET [config=FILE]";
  private static final String HELP_TEXT = """
      Tracker reconciliation for an ingested dataset

      Usage:
        reconcile datasetPath=PATH [options]

      Required:
        datasetPath=PATH            Dataset directory holding the descriptor; prefixed with the base
                                    folder when set. Also the Tracker instance path.
        trackerUrl=URL              Tracker API (env DATASETTRACKER_URL)
        trackerUsername=USER        Tracker login (env DATASETTRACKER_USERNAME)
        trackerPassword=SECRET      Tracker password (env DATASETTRACKER_PASSWORD)

      Options:
        shareIdentifier=SLUG        Tracker share (default als-beegfs)
        baseFolder=PATH             Base folder (env SCICAT_INGEST_BASE_FOLDER)
        internalBaseFolder=PATH     Container base folder (env SCICAT_INGEST_INTERNAL_BASE_FOLDER)
        registryTimeoutSeconds=N    Per-request timeout, 1-600 (default 30)
        flowRunId=ID                Orchestration run id recorded on Tracker records
        metricsExporter=otlp|none   Metrics export (default otlp)
        config=FILE                 YAML file with 'common' and 'reconcile' sections
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ReconcileCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, EnvironmentConfig.fromSystem());
  }

  /**
   * Executes the reconcile command.
   *
   * @param args raw CLI arguments
   * @param environment settings taken from environment variables
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, Map<String, String> environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for reconcile CLI");
    }

    IngestConfig config;
    Path datasetRoot;
    try {
      config = CommandSupport.loadConfig("reconcile", input, environment);
      datasetRoot = config.datasetRoot();
    } catch (CommandSupport.CommandFailure ex) {
      log.error(ex.getMessage());
      CliPrinter.errorln(SUMMARY_USAGE);
      return ex.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid dataset path: {}", ex.getMessage());
      CliPrinter.errorln(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    log.info("Using reconcile configuration {}", config.describe());

    try (CompositionRoot root = new CompositionRoot(config)) {
      IngestResult result = root.ingestUseCase()
          .reconcile(new ReconcileRequest(datasetRoot, config.datasetPath()));
      return CommandSupport.report("Reconcile", config, result);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during reconcile", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
