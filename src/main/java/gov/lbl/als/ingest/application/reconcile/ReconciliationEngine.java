package gov.lbl.als.ingest.application.reconcile;

import gov.lbl.als.ingest.application.port.MetricsPort;
import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.application.port.TrackerPort;
import gov.lbl.als.ingest.application.port.context.IngestionContext;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.descriptor.TrackerLink;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.ingest.ReconciliationReport;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.domain.tracker.Beamline;
import gov.lbl.als.ingest.domain.tracker.DatasetInstance;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import gov.lbl.als.ingest.domain.tracker.Proposal;
import gov.lbl.als.ingest.domain.tracker.Share;
import gov.lbl.als.ingest.domain.tracker.TrackerDataset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converges the Tracker onto the state a descriptor describes.
 * <p><strong>Why:</strong> Runs may be repeated after partial failures or file changes; each step looks
 * up before it creates, so a re-run reuses existing records instead of duplicating them.</p>
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Beamline by name, created when absent.</li>
 *   <li>Proposal by name, created when absent.</li>
 *   <li>Share by configured slug; absence is a configuration error.</li>
 *   <li>Dataset: the linked one is fetched and its Catalog fields refreshed; without a link a dataset
 *   carrying the same Catalog id is reused, otherwise one is created.</li>
 *   <li>Newest non-deleted instance at {@code (dataset, share, path)}, created when absent.</li>
 *   <li>File records: deletes, then creates, then updates that change something.</li>
 *   <li>Descriptor Tracker link set; operator comments kept.</li>
 * </ol>
 * Steps 1 to 5 fail fast. A failure in step 6 stops the run and leaves the descriptor's previous
 * Tracker link in place; the next run recomputes the diff from the records as they are then.</p>
 * <p><strong>Thread-safety:</strong> Stateless; one call per run.</p>
 * <p><strong>Observability:</strong> Emits {@code reconcile.files.created|updated|deleted} and
 * {@code reconcile.tracker.created.<entity>}.</p>
 *
 * @since 0.1.0
 */
public final class ReconciliationEngine {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

  @FunctionalInterface
  private interface RegistryCall<T> {
    T call() throws RegistryException;
  }

  /** Records which upserts created a record during one call. */
  private static final class Created {
    boolean beamline;
    boolean proposal;
    boolean dataset;
    boolean instance;
  }

  /**
   * Reconciles the Tracker with a descriptor.
   *
   * @param descriptor descriptor carrying a Catalog dataset id and a non-empty manifest
   * @param instancePath dataset path within the share, recorded on the instance
   * @param context run context; its Tracker port must be present
   * @return descriptor with the updated Tracker link and a report
   * @throws IngestException for precondition violations and registry failures
   */
  public ReconciliationResult reconcile(Descriptor descriptor, String instancePath, IngestionContext context)
      throws IngestException {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(instancePath, "instancePath");
    TrackerPort tracker = context.trackerPort().orElseThrow(
        () -> new IllegalStateException("Tracker is not configured"));
    MetricsPort metrics = context.metrics();
    String catalogId = descriptor.catalog().datasetId();
    if (!descriptor.catalog().isIngested()) {
      throw new IngestException(FailureKind.NOT_INGESTED,
          "Descriptor has no Catalog dataset id; nothing to reconcile");
    }
    FileManifest manifest = descriptor.fileManifest();
    if (manifest.isEmpty()) {
      throw new IngestException(FailureKind.EMPTY_MANIFEST,
          "Descriptor manifest is empty; cannot reconcile Tracker files");
    }

    // 1-2
    Created created = new Created();
    Beamline beamline = upsertBeamline(tracker, descriptor.beamlineId(), catalogId, created, metrics);
    Proposal proposal = upsertProposal(tracker, descriptor.proposalId(), catalogId, created, metrics);

    // 3
    Share share = verifyShare(context);

    // 4
    TrackerDataset dataset = upsertDataset(tracker, descriptor, beamline, proposal, context, created);

    // 5
    DatasetInstance instance = upsertInstance(tracker, dataset, share, instancePath, manifest,
        context, created);

    // 6
    FileDiff diff = FileDiff.compute(manifest,
        call("list instance files", () -> tracker.findInstanceFiles(instance.id())));
    List<FileDiff.Update> changed = diff.changedUpdates();
    int unchanged = diff.update().size() - changed.size();
    log.info("File diff for instance {}: {} to delete, {} to create, {} to update, {} unchanged",
        instance.id(), diff.delete().size(), diff.create().size(), changed.size(), unchanged);
    syncFiles(tracker, instance, diff, changed, metrics);

    // 7
    TrackerLink previous = descriptor.tracker();
    TrackerLink link = new TrackerLink(dataset.slug(), context.trackerUrl(), instance.id(),
        previous.instanceComments());
    ReconciliationReport report = new ReconciliationReport(dataset.slug(), instance.id(),
        created.beamline, created.proposal, created.dataset, created.instance,
        diff.create().size(), changed.size(), diff.delete().size(), unchanged);
    log.info("Tracker reconciled: dataset {}, instance {}, {} file operations",
        dataset.slug(), instance.id(), report.fileOperations());
    return new ReconciliationResult(descriptor.withTracker(link), report);
  }

  /**
   * Resolves the configured share. Also used before extraction so a misconfigured share is found
   * before the Catalog is written.
   *
   * @param context run context; its Tracker port must be present
   * @return share record
   * @throws IngestException {@code SHARE_NOT_CONFIGURED} when the Tracker does not know the slug
   */
  public Share verifyShare(IngestionContext context) throws IngestException {
    TrackerPort tracker = context.trackerPort().orElseThrow(
        () -> new IllegalStateException("Tracker is not configured"));
    String slug = context.shareIdentifier();
    return call("look up share", () -> tracker.findShare(slug))
        .orElseThrow(() -> new IngestException(FailureKind.SHARE_NOT_CONFIGURED,
            "Tracker share '" + slug + "' does not exist"));
  }

  private Beamline upsertBeamline(
      TrackerPort tracker, String name, String catalogId, Created created, MetricsPort metrics)
      throws IngestException {
    requireName(name, "beamline");
    List<Beamline> found = call("look up beamline", () -> tracker.findBeamlines(name));
    if (!found.isEmpty()) {
      return found.get(0);
    }
    Beamline beamline = call("create beamline",
        () -> tracker.createBeamline(new Beamline(null, name, autoCreatedNote(catalogId))));
    log.info("Created Tracker beamline {} ({})", beamline.slug(), name);
    metrics.increment("reconcile.tracker.created.beamline");
    created.beamline = true;
    return beamline;
  }

  private Proposal upsertProposal(
      TrackerPort tracker, String name, String catalogId, Created created, MetricsPort metrics)
      throws IngestException {
    requireName(name, "proposal");
    List<Proposal> found = call("look up proposal", () -> tracker.findProposals(name));
    if (!found.isEmpty()) {
      return found.get(0);
    }
    Proposal proposal = call("create proposal",
        () -> tracker.createProposal(new Proposal(null, name, autoCreatedNote(catalogId))));
    log.info("Created Tracker proposal {} ({})", proposal.slug(), name);
    metrics.increment("reconcile.tracker.created.proposal");
    created.proposal = true;
    return proposal;
  }

  private TrackerDataset upsertDataset(
      TrackerPort tracker,
      Descriptor descriptor,
      Beamline beamline,
      Proposal proposal,
      IngestionContext context,
      Created created) throws IngestException {
    String catalogId = descriptor.catalog().datasetId();
    TrackerDataset existing;
    if (descriptor.tracker().hasDataset()) {
      String slug = descriptor.tracker().trackerDatasetId();
      existing = call("fetch dataset", () -> tracker.findDataset(slug))
          .orElseThrow(() -> new IngestException(FailureKind.TRACKER_RECORD_MISSING,
              "Tracker dataset " + slug + " named in the descriptor does not exist"));
      log.info("Using Tracker dataset {} from descriptor", slug);
    } else {
      List<TrackerDataset> byCatalog =
          call("look up dataset by Catalog id", () -> tracker.findDatasetsByCatalogId(catalogId));
      existing = byCatalog.isEmpty() ? null : byCatalog.get(0);
      if (existing != null) {
        log.info("Reusing Tracker dataset {} already linked to Catalog dataset {}",
            existing.slug(), catalogId);
      }
    }

    if (existing == null) {
      TrackerDataset fresh = new TrackerDataset(null, descriptor.name(), descriptor.description(),
          beamline.slug(), proposal.slug(), descriptor.dateOfAcquisition(), catalogId,
          descriptor.catalog().dateIngested(), context.flowRunId());
      TrackerDataset dataset = call("create dataset", () -> tracker.createDataset(fresh));
      log.info("Created Tracker dataset {}", dataset.slug());
      context.metrics().increment("reconcile.tracker.created.dataset");
      created.dataset = true;
      return dataset;
    }

    TrackerDataset refreshed = existing.withCatalogReference(
        catalogId, descriptor.catalog().dateIngested(), context.flowRunId());
    if (refreshed.equals(existing)) {
      return existing;
    }
    return call("update dataset", () -> tracker.updateDataset(refreshed));
  }

  private DatasetInstance upsertInstance(
      TrackerPort tracker,
      TrackerDataset dataset,
      Share share,
      String path,
      FileManifest manifest,
      IngestionContext context,
      Created created) throws IngestException {
    List<DatasetInstance> found = call("look up dataset instance",
        () -> tracker.findInstances(dataset.slug(), share.slug(), path));
    Optional<DatasetInstance> live = found.stream().filter(i -> !i.isDeleted()).findFirst();
    if (live.isPresent()) {
      if (found.size() > 1) {
        log.warn("{} instances of dataset {} at {}; using newest {}",
            found.size(), dataset.slug(), path, live.get().id());
      }
      return live.get();
    }
    DatasetInstance fresh = new DatasetInstance(null, dataset.slug(), share.slug(), path,
        manifest.totalSizeBytes(), context.flowRunId(), null, null);
    DatasetInstance instance = call("create dataset instance", () -> tracker.createInstance(fresh));
    log.info("Created dataset instance {} at {}:{}", instance.id(), share.slug(), path);
    context.metrics().increment("reconcile.tracker.created.instance");
    created.instance = true;
    return instance;
  }

  private void syncFiles(
      TrackerPort tracker,
      DatasetInstance instance,
      FileDiff diff,
      List<FileDiff.Update> changed,
      MetricsPort metrics) throws IngestException {
    String current = null;
    try {
      for (DatasetInstanceFile record : diff.delete()) {
        current = record.path();
        tracker.deleteInstanceFile(record.id());
        metrics.increment("reconcile.files.deleted");
      }
      for (FileManifestEntry entry : diff.create()) {
        current = entry.path();
        tracker.createInstanceFile(DatasetInstanceFile.fromManifest(instance.id(), entry));
        metrics.increment("reconcile.files.created");
      }
      for (FileDiff.Update update : changed) {
        current = update.entry().path();
        tracker.updateInstanceFile(update.record().withManifestValues(update.entry()));
        metrics.increment("reconcile.files.updated");
      }
    } catch (RegistryException e) {
      FailureKind kind = e.isTransient() ? FailureKind.REGISTRY_UNAVAILABLE : FailureKind.FILE_SYNC_FAILED;
      throw new IngestException(kind,
          "File sync for instance " + instance.id() + " stopped at " + current + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new IngestException(FailureKind.FILE_SYNC_FAILED,
          "File sync for instance " + instance.id() + " stopped at " + current + ": " + e, e);
    }
  }

  private static <T> T call(String what, RegistryCall<T> call) throws IngestException {
    try {
      return call.call();
    } catch (RegistryException e) {
      FailureKind kind = e.isTransient() ? FailureKind.REGISTRY_UNAVAILABLE : FailureKind.REGISTRY_REJECTED;
      throw new IngestException(kind, "Tracker failed to " + what + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new IngestException(FailureKind.REGISTRY_REJECTED, "Tracker failed to " + what + ": " + e, e);
    }
  }

  private static void requireName(String name, String what) throws IngestException {
    if (name == null || name.isBlank()) {
      throw new IngestException(FailureKind.TRACKER_RECORD_MISSING,
          "Descriptor names no " + what + "; cannot resolve the Tracker " + what);
    }
  }

  private static String autoCreatedNote(String catalogId) {
    return "Auto-created while ingesting Catalog dataset " + catalogId;
  }
}
