package gov.lbl.als.ingest.application.port.context;

import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.application.port.ClockPort;
import gov.lbl.als.ingest.application.port.MetricsPort;
import gov.lbl.als.ingest.application.port.RunLogPort;
import gov.lbl.als.ingest.application.port.TrackerPort;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Collaborators and settings of one ingestion run.
 * <p><strong>Why:</strong> Passed explicitly through the pipeline so no component reaches for globals;
 * tests build one around in-memory fakes.</p>
 * <p><strong>Thread-safety:</strong> Immutable holder; the registry ports it references are used by one
 * run at a time.</p>
 *
 * @param catalog Catalog port
 * @param tracker Tracker port, or {@code null} when the Tracker is not configured
 * @param runLog capture whose lines are embedded in the descriptor
 * @param shareIdentifier slug of the Tracker share the dataset lives on
 * @param clock time source for ingestion dates and latency
 * @param metrics metrics sink
 * @param catalogUrl base URL of the Catalog, recorded in the descriptor
 * @param trackerUrl base URL of the Tracker, recorded in the descriptor
 * @param flowRunId orchestration run id recorded on Tracker records, may be {@code null}
 * @param ownerUsername owner of created Catalog datasets
 * @since 0.1.0
 */
public record IngestionContext(
    CatalogPort catalog,
    TrackerPort tracker,
    RunLogPort runLog,
    String shareIdentifier,
    ClockPort clock,
    MetricsPort metrics,
    String catalogUrl,
    String trackerUrl,
    String flowRunId,
    String ownerUsername) {

  public IngestionContext {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(shareIdentifier, "shareIdentifier");
    Objects.requireNonNull(ownerUsername, "ownerUsername");
    runLog = Objects.requireNonNullElse(runLog, RunLogPort.NONE);
    clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  public Optional<TrackerPort> trackerPort() {
    return Optional.ofNullable(tracker);
  }

  public boolean trackerEnabled() {
    return tracker != null;
  }
}
