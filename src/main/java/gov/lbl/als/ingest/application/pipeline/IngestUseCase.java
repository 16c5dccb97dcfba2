package gov.lbl.als.ingest.application.pipeline;

import gov.lbl.als.ingest.application.descriptor.DescriptorStore;
import gov.lbl.als.ingest.application.extract.ExtractionDispatcher;
import gov.lbl.als.ingest.application.extract.ExtractionRegistry;
import gov.lbl.als.ingest.application.extract.ExtractionStrategy;
import gov.lbl.als.ingest.application.manifest.ManifestBuildResult;
import gov.lbl.als.ingest.application.manifest.ManifestBuilder;
import gov.lbl.als.ingest.application.port.DatasetLockPort;
import gov.lbl.als.ingest.application.port.MetricsPort;
import gov.lbl.als.ingest.application.port.RunLogPort;
import gov.lbl.als.ingest.application.port.context.IngestionContext;
import gov.lbl.als.ingest.application.reconcile.ReconciliationEngine;
import gov.lbl.als.ingest.application.reconcile.ReconciliationResult;
import gov.lbl.als.ingest.domain.descriptor.CatalogLink;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.ingest.IngestResult;
import gov.lbl.als.ingest.domain.ingest.ReconciliationReport;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates ingestion and stand-alone reconciliation of one dataset.
 * <p><strong>Why:</strong> Fixes the order of the steps so that every check that can refuse a run happens
 * before the Catalog is written, and the descriptor is persisted whenever a Catalog dataset exists.</p>
 * <p><strong>Ingestion order:</strong> resolve extractor, validate root, take the dataset lock, build
 * the manifest, load and validate the descriptor, merge manifests, check the Tracker share, extract,
 * stamp the Catalog link, reconcile the Tracker, persist, release the lock.</p>
 * <p><strong>Thread-safety:</strong> Safe to call concurrently for different datasets; the dataset lock
 * rejects concurrent runs on the same one.</p>
 * <p><strong>Observability:</strong> Tags log lines with MDC {@code ingest.run}; emits
 * {@code <op>.run.success}, {@code <op>.run.failure.<category>} and {@code <op>.run.latencyMillis}
 * where {@code <op>} is {@code ingest} or {@code reconcile}.</p>
 *
 * @implNote Never throws for expected failures; every outcome is returned as an {@link IngestResult}.
 * @since 0.1.0
 */
public final class IngestUseCase {
  private static final Logger log = LoggerFactory.getLogger(IngestUseCase.class);

  private final ExtractionRegistry extractors;
  private final ManifestBuilder manifestBuilder;
  private final DescriptorStore descriptorStore;
  private final ExtractionDispatcher dispatcher;
  private final ReconciliationEngine reconciliation;
  private final DatasetLockPort lock;
  private final IngestionContext context;

  /**
   * Creates the use case.
   *
   * @param extractors extractor registry
   * @param manifestBuilder manifest builder
   * @param descriptorStore descriptor store
   * @param dispatcher extraction dispatcher
   * @param reconciliation Tracker reconciliation engine
   * @param lock per-dataset lock
   * @param context registries, clock, metrics and settings
   */
  public IngestUseCase(
      ExtractionRegistry extractors,
      ManifestBuilder manifestBuilder,
      DescriptorStore descriptorStore,
      ExtractionDispatcher dispatcher,
      ReconciliationEngine reconciliation,
      DatasetLockPort lock,
      IngestionContext context) {
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.manifestBuilder = Objects.requireNonNull(manifestBuilder, "manifestBuilder");
    this.descriptorStore = Objects.requireNonNull(descriptorStore, "descriptorStore");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.reconciliation = Objects.requireNonNull(reconciliation, "reconciliation");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Ingests a dataset.
   *
   * @param request dataset root, file list and extractor
   * @return outcome; failures carry the kind and, when one was written, the descriptor
   */
  public IngestResult ingest(IngestRequest request) {
    return runTagged("ingest", request.datasetRoot(), recording -> doIngest(request, recording));
  }

  /**
   * Re-runs Tracker reconciliation for a dataset that already has a Catalog dataset.
   *
   * @param request dataset root and instance path
   * @return outcome
   */
  public IngestResult reconcile(ReconcileRequest request) {
    return runTagged("reconcile", request.datasetRoot(), recording -> doReconcile(request, recording));
  }

  /**
   * Computes what {@link #ingest(IngestRequest)} would extract, without the lock and without any
   * registry call.
   *
   * @param request ingestion parameters
   * @return merged manifest and dropped paths
   * @throws IngestException when the run would be refused before extraction
   */
  public IngestPlan plan(IngestRequest request) throws IngestException {
    extractors.resolve(request.spec());
    Path root = validateRoot(request.datasetRoot());
    ManifestBuildResult built = manifestBuilder.build(root, request.files());
    Optional<Descriptor> loaded = descriptorStore.load(root);
    Descriptor descriptor = loaded.orElse(Descriptor.blank());
    descriptorStore.validateForIngestion(descriptor, built.manifest().paths());
    FileManifest merged = descriptorStore.merge(descriptor.fileManifest(), built.manifest());
    return new IngestPlan(merged, built.issues(), loaded.isEmpty());
  }

  @FunctionalInterface
  private interface Run {
    IngestResult execute(RunLogPort.Recording recording);
  }

  private IngestResult runTagged(String operation, Path datasetRoot, Run run) {
    String runId = UUID.randomUUID().toString();
    String previousRun = MDC.get(RunLogPort.MDC_KEY);
    long started = context.clock().nowMillis();
    IngestResult result;
    MDC.put(RunLogPort.MDC_KEY, runId);
    try (RunLogPort.Recording recording = context.runLog().start(runId)) {
      log.info("Starting {} of {}", operation, datasetRoot);
      result = run.execute(recording);
      if (result.isSuccess()) {
        log.info("Finished {} of {}", operation, datasetRoot);
      }
    } catch (RuntimeException e) {
      log.error("Unexpected error during {} of {}", operation, datasetRoot, e);
      result = IngestResult.failure(
          new IngestException(FailureKind.UNEXPECTED_ERROR, operation + " stopped: " + e, e), null);
    } finally {
      if (previousRun == null) {
        MDC.remove(RunLogPort.MDC_KEY);
      } else {
        MDC.put(RunLogPort.MDC_KEY, previousRun);
      }
    }
    record(operation, result, context.clock().nowMillis() - started);
    return result;
  }

  private IngestResult doIngest(IngestRequest request, RunLogPort.Recording recording) {
    Descriptor persisted = null;
    try {
      ExtractionStrategy strategy = extractors.resolve(request.spec());
      Path root = validateRoot(request.datasetRoot());
      try (DatasetLockPort.Held held = lock.acquire(root)) {
        ManifestBuildResult built = manifestBuilder.build(root, request.files());
        Descriptor descriptor = descriptorStore.load(root).orElse(Descriptor.blank());
        descriptorStore.validateForIngestion(descriptor, built.manifest().paths());
        FileManifest merged = descriptorStore.merge(descriptor.fileManifest(), built.manifest());
        descriptor = descriptor.withFileManifest(merged);

        if (context.trackerEnabled()) {
          reconciliation.verifyShare(context);
        }

        Descriptor extracted = dispatcher.invoke(strategy, merged, descriptor, root,
            context.catalog(), context.ownerUsername());
        if (!extracted.fileManifest().equals(merged)) {
          log.warn("Extractor {} changed the manifest; keeping the manifest it was given", request.spec());
          extracted = extracted.withFileManifest(merged);
        }
        Descriptor stamped = extracted.withCatalog(new CatalogLink(
            extracted.catalog().datasetId(),
            context.catalogUrl(),
            context.clock().now().truncatedTo(ChronoUnit.SECONDS),
            request.spec(),
            List.of()));

        Descriptor outcome = stamped;
        ReconciliationReport report = null;
        IngestException reconcileFailure = null;
        if (context.trackerEnabled()) {
          try {
            ReconciliationResult reconciled =
                reconciliation.reconcile(stamped, request.instancePath(), context);
            outcome = reconciled.descriptor();
            report = reconciled.report();
          } catch (IngestException e) {
            log.error("Tracker reconciliation failed ({}): {}. Re-run reconcile once resolved.",
                e.kind(), e.getMessage());
            reconcileFailure = e;
          } catch (RuntimeException e) {
            log.error("Tracker reconciliation failed. Re-run reconcile once resolved.", e);
            reconcileFailure = new IngestException(FailureKind.REGISTRY_REJECTED,
                "Tracker reconciliation stopped: " + e, e);
          }
        } else {
          log.info("Tracker not configured; skipping Tracker reconciliation");
        }

        try {
          persisted = descriptorStore.persist(outcome, root, recording.lines());
        } catch (IngestException e) {
          if (reconcileFailure != null) {
            e.addSuppressed(reconcileFailure);
          }
          throw e;
        }
        if (reconcileFailure != null) {
          return IngestResult.failure(reconcileFailure, persisted);
        }
        return IngestResult.success(persisted, report);
      }
    } catch (IngestException e) {
      log.error("Ingestion failed ({}): {}", e.kind(), e.getMessage());
      return IngestResult.failure(e, persisted);
    }
  }

  private IngestResult doReconcile(ReconcileRequest request, RunLogPort.Recording recording) {
    try {
      if (!context.trackerEnabled()) {
        throw new IngestException(FailureKind.MISSING_CREDENTIALS,
            "Tracker URL, username and password are required to reconcile");
      }
      Path root = validateRoot(request.datasetRoot());
      try (DatasetLockPort.Held held = lock.acquire(root)) {
        Descriptor descriptor = descriptorStore.load(root).orElseThrow(
            () -> new IngestException(FailureKind.NOT_INGESTED, "No descriptor found in " + root));
        if (!descriptor.catalog().isIngested()) {
          throw new IngestException(FailureKind.NOT_INGESTED,
              "Descriptor in " + root + " has no Catalog dataset id");
        }
        ReconciliationResult reconciled =
            reconciliation.reconcile(descriptor, request.instancePath(), context);
        Descriptor persisted = descriptorStore.persist(reconciled.descriptor(), root,
            mergeRunLogs(descriptor.catalog().runLog(), recording.lines()));
        return IngestResult.success(persisted, reconciled.report());
      }
    } catch (IngestException e) {
      log.error("Reconciliation failed ({}): {}", e.kind(), e.getMessage());
      return IngestResult.failure(e, null);
    }
  }

  private static List<String> mergeRunLogs(List<String> earlier, List<String> current) {
    List<String> all = new ArrayList<>(earlier.size() + current.size());
    all.addAll(earlier);
    all.addAll(current);
    return all;
  }

  private static Path validateRoot(Path datasetRoot) throws IngestException {
    Path root = datasetRoot.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new IngestException(FailureKind.INVALID_DATASET_ROOT,
          "Dataset root does not exist or is not a directory: " + root);
    }
    return root;
  }

  private void record(String operation, IngestResult result, long latencyMillis) {
    MetricsPort metrics = context.metrics();
    metrics.observe(operation + ".run.latencyMillis", latencyMillis);
    if (result.isSuccess()) {
      metrics.increment(operation + ".run.success");
      result.report().ifPresent(
          report -> metrics.observe(operation + ".run.fileOperations", report.fileOperations()));
      return;
    }
    String category = result.failureCategory()
        .map(c -> c.name().toLowerCase(Locale.ROOT))
        .orElse("unknown");
    metrics.increment(operation + ".run.failure." + category);
  }
}
