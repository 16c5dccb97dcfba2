package gov.lbl.als.ingest.application.port;

import gov.lbl.als.ingest.domain.tracker.Beamline;
import gov.lbl.als.ingest.domain.tracker.DatasetInstance;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import gov.lbl.als.ingest.domain.tracker.Proposal;
import gov.lbl.als.ingest.domain.tracker.Share;
import gov.lbl.als.ingest.domain.tracker.TrackerDataset;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port to the Tracker registry.
 * <p><strong>Why:</strong> The reconciliation engine needs lookups by natural key plus create, update and
 * delete on every record type it converges.</p>
 * <p><strong>Role:</strong> Implemented by {@code HttpTrackerAdapter}; tests use an in-memory fake.</p>
 * <p><strong>Contract:</strong> records passed to {@code create*} carry a {@code null} id and the
 * returned record carries the assigned one. Every method throws {@link RegistryException} on failure.</p>
 *
 * @since 0.1.0
 */
public interface TrackerPort {
  List<Beamline> findBeamlines(String name) throws RegistryException;

  Beamline createBeamline(Beamline beamline) throws RegistryException;

  List<Proposal> findProposals(String name) throws RegistryException;

  Proposal createProposal(Proposal proposal) throws RegistryException;

  Optional<Share> findShare(String slug) throws RegistryException;

  Optional<TrackerDataset> findDataset(String slug) throws RegistryException;

  /**
   * Lists Tracker datasets that reference a Catalog dataset.
   *
   * @param catalogDatasetId Catalog dataset id
   * @return matching datasets, possibly empty
   * @throws RegistryException when the call fails
   */
  List<TrackerDataset> findDatasetsByCatalogId(String catalogDatasetId) throws RegistryException;

  TrackerDataset createDataset(TrackerDataset dataset) throws RegistryException;

  TrackerDataset updateDataset(TrackerDataset dataset) throws RegistryException;

  /**
   * Lists the non-deleted instances of a dataset at a share path, newest first.
   *
   * @param datasetSlug owning dataset
   * @param shareSlug share the path lives on
   * @param path dataset path within the share
   * @return matching instances ordered by descending creation date
   * @throws RegistryException when the call fails
   */
  List<DatasetInstance> findInstances(String datasetSlug, String shareSlug, String path)
      throws RegistryException;

  DatasetInstance createInstance(DatasetInstance instance) throws RegistryException;

  List<DatasetInstanceFile> findInstanceFiles(String instanceId) throws RegistryException;

  DatasetInstanceFile createInstanceFile(DatasetInstanceFile file) throws RegistryException;

  DatasetInstanceFile updateInstanceFile(DatasetInstanceFile file) throws RegistryException;

  void deleteInstanceFile(String fileId) throws RegistryException;
}
