package gov.lbl.als.ingest.domain.tracker;

import java.time.Instant;

/**
 * Tracker-side record of one logical dataset. Distinct from the Catalog dataset, which it
 * cross-references through {@link #catalogDatasetId()}.
 *
 * @param slug Tracker-assigned identifier; {@code null} before the record is created
 * @param name dataset name
 * @param description dataset description
 * @param beamlineSlug slug of the owning beamline
 * @param proposalSlug slug of the owning proposal
 * @param dateOfAcquisition ISO-8601 acquisition date
 * @param catalogDatasetId Catalog dataset id this record describes
 * @param catalogDateIngested when the Catalog dataset was created
 * @param ingestionFlowRunId orchestration run that performed the ingestion, if any
 * @since 0.1.0
 */
public record TrackerDataset(
    String slug,
    String name,
    String description,
    String beamlineSlug,
    String proposalSlug,
    String dateOfAcquisition,
    String catalogDatasetId,
    Instant catalogDateIngested,
    String ingestionFlowRunId) {

  /**
   * Returns a copy whose Catalog cross-reference fields are replaced; identity fields stay as they
   * are.
   */
  public TrackerDataset withCatalogReference(String datasetId, Instant dateIngested, String flowRunId) {
    return new TrackerDataset(slug, name, description, beamlineSlug, proposalSlug, dateOfAcquisition,
        datasetId, dateIngested, flowRunId);
  }
}
