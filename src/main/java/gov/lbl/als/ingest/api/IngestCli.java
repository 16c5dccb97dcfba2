package gov.lbl.als.ingest.api;

import gov.lbl.als.ingest.application.extract.ExtractionRegistry;
import gov.lbl.als.ingest.application.pipeline.IngestPlan;
import gov.lbl.als.ingest.application.pipeline.IngestRequest;
import gov.lbl.als.ingest.application.pipeline.IngestUseCase;
import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.application.port.MetricsPort;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.application.port.RunLogPort;
import gov.lbl.als.ingest.config.CompositionRoot;
import gov.lbl.als.ingest.config.EnvironmentConfig;
import gov.lbl.als.ingest.config.IngestConfig;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.ingest.IngestResult;
import gov.lbl.als.ingest.domain.ingest.ValidationIssue;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.infrastructure.time.SystemClockAdapter;
import gov.lbl.als.ingest.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for ingesting one dataset into the Catalog and reconciling it with the Tracker.
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: ingest spec=NAME datasetPath=PATH [files=a.txt,b/c.dat] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      Beamline dataset ingestion

      Usage:
        ingest spec=NAME datasetPath=PATH [options]

      Required:
        spec=NAME                   Extraction strategy (for example 'generic')
        datasetPath=PATH            Dataset directory; prefixed with the internal base folder or base
                                    folder when set. Also recorded as the Tracker instance path.

      Options:
        files=a.txt,b/c.dat         Explicit files relative to the dataset; default is every file
        catalogUrl=URL              Catalog API (env SCICAT_INGEST_URL, default http://localhost:3000/api/v3)
        catalogUsername=USER        Catalog login (env SCICAT_INGEST_USERNAME)
        catalogPassword=SECRET      Catalog password (env SCICAT_INGEST_PASSWORD)
        ownerUsername=USER          Owner of created datasets (env SCICAT_INGEST_OWNER_USERNAME)
        baseFolder=PATH             Base folder (env SCICAT_INGEST_BASE_FOLDER)
        internalBaseFolder=PATH     Container base folder (env SCICAT_INGEST_INTERNAL_BASE_FOLDER)
        trackerUrl=URL              Tracker API (env DATASETTRACKER_URL); Tracker skipped when unset
        trackerUsername=USER        Tracker login (env DATASETTRACKER_USERNAME)
        trackerPassword=SECRET      Tracker password (env DATASETTRACKER_PASSWORD)
        shareIdentifier=SLUG        Tracker share (env DATASETTRACKER_SHARE_IDENTIFIER, default als-beegfs)
        registryTimeoutSeconds=N    Per-request timeout, 1-600 (default 30)
        flowRunId=ID                Orchestration run id recorded on Tracker records
        metricsExporter=otlp|none   Metrics export (default otlp)
        otlpEndpoint=URL            OTLP endpoint override
        config=FILE                 YAML file with 'common' and 'ingest' sections
        --dry-run                   Print the manifest plan without contacting any registry
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Precedence: CLI > environment > YAML > defaults.
      """;

  private IngestCli() {}

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
   * Executes the ingest command.
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
      log.debug("Verbose logging enabled for ingest CLI");
    }

    IngestConfig config;
    Path datasetRoot;
    try {
      config = CommandSupport.loadConfig("ingest", input, environment);
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
    log.info("Using ingest configuration {}", config.describe());
    IngestRequest request =
        new IngestRequest(datasetRoot, config.datasetPath(), config.files(), config.spec());

    if (config.dryRun()) {
      return dryRun(config, request);
    }

    try {
      config.requireCatalogCredentials();
    } catch (IngestException ex) {
      log.error(ex.getMessage());
      return ExitCode.forFailure(ex.kind());
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      IngestUseCase useCase = root.ingestUseCase();
      IngestResult result = useCase.ingest(request);
      return CommandSupport.report("Ingest", config, result);
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during ingest", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode dryRun(IngestConfig config, IngestRequest request) {
    try (CompositionRoot root = new CompositionRoot(config, ExtractionRegistry.withDefaults(),
        MetricsPort.NO_OP, null, new SystemClockAdapter(), RunLogPort.NONE)) {
      IngestPlan plan = root.ingestUseCase(OFFLINE_CATALOG, null).plan(request);
      CliPrinter.printLines(
          "Ingest dry-run: no registry will be contacted and no descriptor written.",
          " Dataset root     : " + request.datasetRoot(),
          " Extractor        : " + config.spec(),
          " First ingestion  : " + plan.firstIngestion(),
          " Tracker          : " + (config.trackerEnabled() ? config.trackerUrl() : "<disabled>"),
          " Files            : " + plan.manifest().size()
              + " (" + plan.manifest().totalSizeBytes() + " bytes)");
      for (FileManifestEntry entry : plan.manifest().entries()) {
        CliPrinter.println("   " + entry.path() + " (" + entry.sizeBytes() + " bytes)");
      }
      for (ValidationIssue issue : plan.issues()) {
        CliPrinter.println(" Skipped " + issue.path() + ": " + issue.message());
      }
      CliPrinter.println(" Re-run without --dry-run to ingest.");
      return ExitCode.SUCCESS;
    } catch (IngestException ex) {
      log.error("Dry run refused ({}): {}", ex.kind(), ex.getMessage());
      return ExitCode.forFailure(ex.kind());
    }
  }

  /** Catalog used for planning; any call is a programming error. */
  private static final CatalogPort OFFLINE_CATALOG = new CatalogPort() {
    @Override
    public String createDataset(CatalogDataset dataset) throws RegistryException {
      throw new RegistryException("Catalog is not contacted during a dry run", false, 0);
    }

    @Override
    public void createDatablock(String datasetId, Datablock datablock) throws RegistryException {
      throw new RegistryException("Catalog is not contacted during a dry run", false, 0);
    }

    @Override
    public void createAttachment(String datasetId, String thumbnail, String caption)
        throws RegistryException {
      throw new RegistryException("Catalog is not contacted during a dry run", false, 0);
    }
  };
}
