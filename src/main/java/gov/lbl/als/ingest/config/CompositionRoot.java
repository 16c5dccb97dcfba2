package gov.lbl.als.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import gov.lbl.als.ingest.application.descriptor.DescriptorStore;
import gov.lbl.als.ingest.application.extract.ExtractionDispatcher;
import gov.lbl.als.ingest.application.extract.ExtractionRegistry;
import gov.lbl.als.ingest.application.manifest.ManifestBuilder;
import gov.lbl.als.ingest.application.pipeline.IngestUseCase;
import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.application.port.ClockPort;
import gov.lbl.als.ingest.application.port.MetricsPort;
import gov.lbl.als.ingest.application.port.RunLogPort;
import gov.lbl.als.ingest.application.port.TrackerPort;
import gov.lbl.als.ingest.application.port.context.IngestionContext;
import gov.lbl.als.ingest.application.reconcile.ReconciliationEngine;
import gov.lbl.als.ingest.infrastructure.catalog.HttpCatalogAdapter;
import gov.lbl.als.ingest.infrastructure.http.JsonHttpClient;
import gov.lbl.als.ingest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import gov.lbl.als.ingest.infrastructure.persistence.DatasetLock;
import gov.lbl.als.ingest.infrastructure.persistence.JsonDescriptorRepository;
import gov.lbl.als.ingest.infrastructure.time.SystemClockAdapter;
import gov.lbl.als.ingest.infrastructure.tracker.HttpTrackerAdapter;
import gov.lbl.als.ingest.logging.RunLogCapture;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the ingestion use case from an {@link IngestConfig}.
 * <p><strong>Why:</strong> Keeps adapter construction (HTTP clients, descriptor repository, lock, metrics)
 * out of the CLI and lets tests substitute the registries.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on a single thread; close once the run ends.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final IngestConfig config;
  private final ExtractionRegistry extractors;
  private final MetricsPort metrics;
  private final AutoCloseable metricsHandle;
  private final ClockPort clock;
  private final RunLogPort runLog;

  /**
   * Creates a composition root exporting metrics as configured.
   *
   * @param config validated configuration
   */
  public CompositionRoot(IngestConfig config) {
    this(config, ExtractionRegistry.withDefaults(),
        new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otlpEndpoint()));
  }

  private CompositionRoot(
      IngestConfig config, ExtractionRegistry extractors, OpenTelemetryMetricsAdapter metrics) {
    this(config, extractors, metrics, metrics, new SystemClockAdapter(), new RunLogCapture());
  }

  /**
   * Creates a composition root with explicit collaborators.
   *
   * @param config validated configuration
   * @param extractors extraction strategies
   * @param metrics metrics sink
   * @param metricsHandle closed by {@link #close()}; may be {@code null}
   * @param clock time source
   * @param runLog run log capture
   */
  public CompositionRoot(
      IngestConfig config,
      ExtractionRegistry extractors,
      MetricsPort metrics,
      AutoCloseable metricsHandle,
      ClockPort clock,
      RunLogPort runLog) {
    this.config = Objects.requireNonNull(config, "config");
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsHandle = metricsHandle;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.runLog = Objects.requireNonNull(runLog, "runLog");
  }

  /**
   * Builds the use case against the HTTP registries named in the configuration.
   *
   * @return use case
   */
  public IngestUseCase ingestUseCase() {
    ObjectMapper mapper = new ObjectMapper();
    CatalogPort catalog = new HttpCatalogAdapter(
        new JsonHttpClient(config.catalogUrl(), config.registryTimeout(), mapper),
        Objects.requireNonNullElse(config.catalogUsername(), ""),
        Objects.requireNonNullElse(config.catalogPassword(), ""));
    TrackerPort tracker = null;
    if (config.trackerEnabled()) {
      tracker = new HttpTrackerAdapter(
          new JsonHttpClient(config.trackerUrl(), config.registryTimeout(), mapper),
          config.trackerUsername(),
          config.trackerPassword());
    } else {
      log.info("Tracker URL or credentials not set; the Tracker will not be used");
    }
    return ingestUseCase(catalog, tracker);
  }

  /**
   * Builds the use case against the given registries.
   *
   * @param catalog Catalog port
   * @param tracker Tracker port, or {@code null} to skip Tracker reconciliation
   * @return use case
   */
  public IngestUseCase ingestUseCase(CatalogPort catalog, TrackerPort tracker) {
    JsonDescriptorRepository repository = new JsonDescriptorRepository();
    DatasetLock lock = new DatasetLock();
    ManifestBuilder manifestBuilder =
        new ManifestBuilder(name -> repository.isDescriptorFile(name) || lock.isLockFile(name));
    IngestionContext context = new IngestionContext(
        catalog,
        tracker,
        runLog,
        config.shareIdentifier(),
        clock,
        metrics,
        config.catalogUrl(),
        config.trackerUrl(),
        config.flowRunId(),
        config.ownerUsername());
    return new IngestUseCase(
        extractors,
        manifestBuilder,
        new DescriptorStore(repository),
        new ExtractionDispatcher(),
        new ReconciliationEngine(),
        lock,
        context);
  }

  public IngestConfig config() {
    return config;
  }

  @Override
  public void close() {
    if (metricsHandle == null) {
      return;
    }
    try {
      metricsHandle.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics exporter", ex);
    }
  }
}
