package gov.lbl.als.ingest.config;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.logging.Logs;
import gov.lbl.als.ingest.validation.Numbers;
import gov.lbl.als.ingest.validation.Paths;
import gov.lbl.als.ingest.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, validated settings for one {@code ingest} or {@code reconcile} run.
 * <p><strong>Why:</strong> Collapses the CLI, environment, YAML and default layers into typed values
 * before any registry adapter is built.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param spec extraction strategy name; {@code null} for reconcile runs
 * @param datasetPath dataset path as the operator gave it; also the Tracker instance path
 * @param files explicit file list relative to the dataset root; empty for discovery
 * @param catalogUrl Catalog base URL without trailing slash
 * @param catalogUsername Catalog login; may be {@code null} until {@link #requireCatalogCredentials()}
 * @param catalogPassword Catalog password
 * @param ownerUsername owner of created Catalog datasets; defaults to the Catalog username
 * @param internalBaseFolder base folder inside a container; preferred over {@code baseFolder}
 * @param baseFolder base folder prepended to {@code datasetPath}
 * @param trackerUrl Tracker base URL, or {@code null}
 * @param trackerUsername Tracker login, or {@code null}
 * @param trackerPassword Tracker password, or {@code null}
 * @param shareIdentifier Tracker share slug
 * @param registryTimeout per-request timeout for both registries
 * @param flowRunId orchestration run id recorded on Tracker records, or {@code null}
 * @param metricsExporter {@code otlp} or {@code none}
 * @param otlpEndpoint OTLP endpoint override, or {@code null} for the exporter default
 * @param dryRun when {@code true} only the manifest plan is computed
 * @since 0.1.0
 */
public record IngestConfig(
    String spec,
    String datasetPath,
    List<String> files,
    String catalogUrl,
    String catalogUsername,
    String catalogPassword,
    String ownerUsername,
    String internalBaseFolder,
    String baseFolder,
    String trackerUrl,
    String trackerUsername,
    String trackerPassword,
    String shareIdentifier,
    Duration registryTimeout,
    String flowRunId,
    String metricsExporter,
    String otlpEndpoint,
    boolean dryRun) {

  public static final String SPEC = "spec";
  public static final String DATASET_PATH = "datasetPath";
  public static final String FILES = "files";
  public static final String CATALOG_URL = "catalogUrl";
  public static final String CATALOG_USERNAME = "catalogUsername";
  public static final String CATALOG_PASSWORD = "catalogPassword";
  public static final String OWNER_USERNAME = "ownerUsername";
  public static final String INTERNAL_BASE_FOLDER = "internalBaseFolder";
  public static final String BASE_FOLDER = "baseFolder";
  public static final String TRACKER_URL = "trackerUrl";
  public static final String TRACKER_USERNAME = "trackerUsername";
  public static final String TRACKER_PASSWORD = "trackerPassword";
  public static final String SHARE_IDENTIFIER = "shareIdentifier";
  public static final String REGISTRY_TIMEOUT_SECONDS = "registryTimeoutSeconds";
  public static final String FLOW_RUN_ID = "flowRunId";
  public static final String METRICS_EXPORTER = "metricsExporter";
  public static final String OTLP_ENDPOINT = "otlpEndpoint";
  public static final String DRY_RUN = "dryRun";

  private static final long MAX_TIMEOUT_SECONDS = 600;

  public IngestConfig {
    Objects.requireNonNull(datasetPath, "datasetPath");
    Objects.requireNonNull(catalogUrl, "catalogUrl");
    Objects.requireNonNull(shareIdentifier, "shareIdentifier");
    Objects.requireNonNull(registryTimeout, "registryTimeout");
    files = files == null ? List.of() : List.copyOf(files);
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "otlp");
  }

  /**
   * Builds a configuration from an effective key/value map.
   *
   * @param options merged settings, typically from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String datasetPath = Strings.requireNonBlank(DATASET_PATH, options.get(DATASET_PATH));
    String catalogUrl = Strings.requireHttpUrl(CATALOG_URL,
        Objects.requireNonNullElse(Strings.blankToNull(options.get(CATALOG_URL)),
            DefaultsForMode.DEFAULT_CATALOG_URL));
    String catalogUsername = Strings.blankToNull(options.get(CATALOG_USERNAME));
    String ownerUsername = Objects.requireNonNullElse(
        Strings.blankToNull(options.get(OWNER_USERNAME)), Objects.requireNonNullElse(catalogUsername, ""));

    String trackerUrl = Optional.ofNullable(Strings.blankToNull(options.get(TRACKER_URL)))
        .map(url -> Strings.requireHttpUrl(TRACKER_URL, url))
        .orElse(null);
    String share = Strings.requireSlug(SHARE_IDENTIFIER, Objects.requireNonNullElse(
        Strings.blankToNull(options.get(SHARE_IDENTIFIER)), DefaultsForMode.DEFAULT_SHARE_IDENTIFIER));

    String timeoutRaw = Strings.blankToNull(options.get(REGISTRY_TIMEOUT_SECONDS));
    long timeoutSeconds = timeoutRaw == null
        ? DefaultsForMode.DEFAULT_REGISTRY_TIMEOUT_SECONDS
        : Numbers.parseInRange(REGISTRY_TIMEOUT_SECONDS, timeoutRaw, 1, MAX_TIMEOUT_SECONDS);

    String exporter = Objects.requireNonNullElse(Strings.blankToNull(options.get(METRICS_EXPORTER)), "otlp")
        .toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException(METRICS_EXPORTER + " must be 'otlp' or 'none'");
    }
    String otlpEndpoint = Optional.ofNullable(Strings.blankToNull(options.get(OTLP_ENDPOINT)))
        .map(endpoint -> Strings.requireHttpUrl(OTLP_ENDPOINT, endpoint))
        .orElse(null);

    return new IngestConfig(
        Strings.blankToNull(options.get(SPEC)),
        datasetPath,
        parseFiles(options.get(FILES)),
        catalogUrl,
        catalogUsername,
        Strings.blankToNull(options.get(CATALOG_PASSWORD)),
        ownerUsername,
        Strings.blankToNull(options.get(INTERNAL_BASE_FOLDER)),
        Strings.blankToNull(options.get(BASE_FOLDER)),
        trackerUrl,
        Strings.blankToNull(options.get(TRACKER_USERNAME)),
        Strings.blankToNull(options.get(TRACKER_PASSWORD)),
        share,
        Duration.ofSeconds(timeoutSeconds),
        Strings.blankToNull(options.get(FLOW_RUN_ID)),
        exporter,
        otlpEndpoint,
        parseBoolean(options.get(DRY_RUN)));
  }

  /**
   * Returns a copy with the dry-run switch set.
   *
   * @param value new dry-run switch
   * @return updated configuration
   */
  public IngestConfig withDryRun(boolean value) {
    return new IngestConfig(spec, datasetPath, files, catalogUrl, catalogUsername, catalogPassword,
        ownerUsername, internalBaseFolder, baseFolder, trackerUrl, trackerUsername, trackerPassword,
        shareIdentifier, registryTimeout, flowRunId, metricsExporter, otlpEndpoint, value);
  }

  /**
   * Resolves the dataset root: the internal base folder when set, otherwise the base folder, joined
   * with {@link #datasetPath()}.
   *
   * @return absolute dataset root
   * @throws IllegalArgumentException when the joined path leaves the base folder
   */
  public Path datasetRoot() {
    String base = internalBaseFolder != null ? internalBaseFolder : baseFolder;
    return Paths.resolveDatasetRoot(base, datasetPath);
  }

  /** Tracker reconciliation runs only when URL, username and password are all present. */
  public boolean trackerEnabled() {
    return trackerUrl != null && trackerUsername != null && trackerPassword != null;
  }

  /**
   * Verifies that Catalog credentials are present.
   *
   * @throws IngestException {@code MISSING_CREDENTIALS} when the username or password is missing
   */
  public void requireCatalogCredentials() throws IngestException {
    if (catalogUsername == null) {
      throw new IngestException(FailureKind.MISSING_CREDENTIALS, "Cannot resolve Catalog username");
    }
    if (catalogPassword == null) {
      throw new IngestException(FailureKind.MISSING_CREDENTIALS, "Cannot resolve Catalog password");
    }
  }

  /**
   * Renders the settings for a startup log line with passwords redacted.
   *
   * @return ordered, redacted settings
   */
  public Map<String, String> describe() {
    Map<String, String> view = new LinkedHashMap<>();
    view.put(SPEC, String.valueOf(spec));
    view.put(DATASET_PATH, datasetPath);
    view.put(FILES, Integer.toString(files.size()));
    view.put(CATALOG_URL, catalogUrl);
    view.put(CATALOG_USERNAME, String.valueOf(catalogUsername));
    view.put(CATALOG_PASSWORD, catalogPassword);
    view.put(OWNER_USERNAME, ownerUsername);
    view.put(TRACKER_URL, String.valueOf(trackerUrl));
    view.put(TRACKER_USERNAME, String.valueOf(trackerUsername));
    view.put(TRACKER_PASSWORD, trackerPassword);
    view.put(SHARE_IDENTIFIER, shareIdentifier);
    view.put(REGISTRY_TIMEOUT_SECONDS, Long.toString(registryTimeout.toSeconds()));
    view.put(METRICS_EXPORTER, metricsExporter);
    return Logs.redactSecrets(view);
  }

  private static List<String> parseFiles(String raw) {
    List<String> files = new ArrayList<>();
    if (raw == null || raw.isBlank()) {
      return files;
    }
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        files.add(trimmed);
      }
    }
    return files;
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
