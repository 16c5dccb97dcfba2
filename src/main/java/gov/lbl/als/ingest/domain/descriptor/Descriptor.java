package gov.lbl.als.ingest.domain.descriptor;

import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Durable, file-resident record of a dataset's provenance.
 * <p><strong>Why:</strong> Ties a dataset's manifest to its Catalog and Tracker identities so that later
 * runs can decide whether re-ingestion is legal and what must be reconciled.</p>
 * <p><strong>Role:</strong> Domain aggregate read and written by the descriptor store, handed to the
 * extraction strategy and updated by the reconciliation engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable; every mutation returns a copy.</p>
 *
 * @param beamlineId beamline identifier as the user office names it (for example {@code 7.3.3})
 * @param proposalId proposal identifier
 * @param principalInvestigator principal investigator of the proposal
 * @param name dataset name
 * @param description free-form dataset description
 * @param dateOfAcquisition ISO-8601 acquisition date, kept verbatim
 * @param fileManifest files that make up the dataset
 * @param catalog Catalog linkage; {@link CatalogLink#datasetId()} is the double-ingestion guard
 * @param tracker Tracker linkage
 * @param extensions top-level descriptor properties this engine does not interpret, kept in order
 * @since 0.1.0
 */
public record Descriptor(
    String beamlineId,
    String proposalId,
    String principalInvestigator,
    String name,
    String description,
    String dateOfAcquisition,
    FileManifest fileManifest,
    CatalogLink catalog,
    TrackerLink tracker,
    Map<String, Object> extensions) {

  public Descriptor {
    fileManifest = Objects.requireNonNullElse(fileManifest, FileManifest.empty());
    catalog = Objects.requireNonNullElse(catalog, CatalogLink.empty());
    tracker = Objects.requireNonNullElse(tracker, TrackerLink.empty());
    extensions = extensions == null || extensions.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
  }

  /**
   * Returns a descriptor with no metadata, used on first ingestion of a dataset.
   *
   * @return blank descriptor
   */
  public static Descriptor blank() {
    return new Descriptor(null, null, null, null, null, null, null, null, null, null);
  }

  public Descriptor withFileManifest(FileManifest manifest) {
    return new Descriptor(beamlineId, proposalId, principalInvestigator, name, description,
        dateOfAcquisition, manifest, catalog, tracker, extensions);
  }

  public Descriptor withCatalog(CatalogLink link) {
    return new Descriptor(beamlineId, proposalId, principalInvestigator, name, description,
        dateOfAcquisition, fileManifest, link, tracker, extensions);
  }

  public Descriptor withTracker(TrackerLink link) {
    return new Descriptor(beamlineId, proposalId, principalInvestigator, name, description,
        dateOfAcquisition, fileManifest, catalog, link, extensions);
  }

  /**
   * Returns a copy carrying the given scientific identity fields; the manifest and registry links
   * are left untouched.
   */
  public Descriptor withIdentity(
      String beamline,
      String proposal,
      String pi,
      String datasetName,
      String datasetDescription,
      String acquired) {
    return new Descriptor(beamline, proposal, pi, datasetName, datasetDescription, acquired,
        fileManifest, catalog, tracker, extensions);
  }
}
