package gov.lbl.als.ingest.api;

import gov.lbl.als.ingest.config.ConfigMerger;
import gov.lbl.als.ingest.config.DefaultsForMode;
import gov.lbl.als.ingest.config.IngestConfig;
import gov.lbl.als.ingest.config.YamlConfigLoader;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestResult;
import gov.lbl.als.ingest.domain.ingest.ReconciliationReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration loading and result rendering shared by the {@code ingest} and {@code reconcile}
 * commands.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  /** Raised when a command must stop before running; carries the exit code to report. */
  static final class CommandFailure extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CommandFailure(ExitCode exitCode, String message) {
      super(message);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode {@code ingest} or {@code reconcile}
   * @param input parsed CLI input
   * @param environment settings taken from environment variables
   * @return validated configuration
   * @throws CommandFailure with {@link ExitCode#INVALID_ARGS} or {@link ExitCode#IO_ERROR}
   */
  static IngestConfig loadConfig(String mode, CliInput input, Map<String, String> environment)
      throws CommandFailure {
    for (String flag : input.unknownFlags()) {
      log.warn("Ignoring unknown flag {}", flag);
    }
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      throw new CommandFailure(ExitCode.INVALID_ARGS, "Invalid argument: " + ex.getMessage());
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new CommandFailure(ExitCode.INVALID_ARGS,
            "Configuration file does not exist: " + yamlPath);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        throw new CommandFailure(ExitCode.INVALID_ARGS,
            "Invalid YAML configuration: " + ex.getMessage());
      } catch (IOException ex) {
        throw new CommandFailure(ExitCode.IO_ERROR,
            "Unable to read configuration file " + yamlPath + ": " + ex.getMessage());
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yaml, environment, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      IngestConfig config = IngestConfig.fromMap(effective);
      if (input.dryRun()) {
        config = config.withDryRun(true);
      }
      return config;
    } catch (IllegalArgumentException ex) {
      throw new CommandFailure(ExitCode.INVALID_ARGS,
          "Invalid " + mode + " configuration: " + ex.getMessage());
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Prints a run summary and maps the result to an exit code.
   *
   * @param operation {@code Ingest} or {@code Reconcile}
   * @param config run configuration
   * @param result run outcome
   * @return exit code
   */
  static ExitCode report(String operation, IngestConfig config, IngestResult result) {
    if (result.isSuccess()) {
      result.descriptor().ifPresent(descriptor -> CliPrinter.printLines(
          operation + " succeeded for " + config.datasetPath(),
          " Catalog dataset  : " + descriptor.catalog().datasetId(),
          " Tracker dataset  : " + orNone(descriptor.tracker().trackerDatasetId()),
          " Tracker instance : " + orNone(descriptor.tracker().instanceRecordId()),
          " Files            : " + descriptor.fileManifest().size()));
      result.report().ifPresent(CommandSupport::printReport);
      return ExitCode.SUCCESS;
    }
    FailureKind kind = result.failureKind().orElseThrow();
    CliPrinter.errorln(operation + " failed [" + kind + "]: " + result.message());
    if (result.descriptor().isPresent()) {
      CliPrinter.errorln(" Descriptor was written; re-run 'reconcile datasetPath=" + config.datasetPath()
          + "' once the Tracker problem is resolved.");
    }
    return ExitCode.forFailure(kind);
  }

  private static void printReport(ReconciliationReport report) {
    CliPrinter.printLines(
        " Files created    : " + report.filesCreated(),
        " Files updated    : " + report.filesUpdated(),
        " Files deleted    : " + report.filesDeleted(),
        " Files unchanged  : " + report.filesUnchanged());
  }

  private static String orNone(String value) {
    return value == null ? "<none>" : value;
  }
}
