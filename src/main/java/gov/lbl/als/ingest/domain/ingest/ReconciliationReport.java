package gov.lbl.als.ingest.domain.ingest;

/**
 * Outcome of one Tracker reconciliation.
 *
 * @param trackerDatasetId slug of the Tracker dataset that was reused or created
 * @param instanceId id of the dataset instance that was reused or created
 * @param beamlineCreated whether the beamline record was created by this run
 * @param proposalCreated whether the proposal record was created by this run
 * @param datasetCreated whether the Tracker dataset was created by this run
 * @param instanceCreated whether the dataset instance was created by this run
 * @param filesCreated instance file records created
 * @param filesUpdated instance file records updated
 * @param filesDeleted instance file records deleted
 * @param filesUnchanged instance file records that already matched the manifest
 * @since 0.1.0
 */
public record ReconciliationReport(
    String trackerDatasetId,
    String instanceId,
    boolean beamlineCreated,
    boolean proposalCreated,
    boolean datasetCreated,
    boolean instanceCreated,
    int filesCreated,
    int filesUpdated,
    int filesDeleted,
    int filesUnchanged) {

  /**
   * Total number of file mutations issued against the Tracker.
   */
  public int fileOperations() {
    return filesCreated + filesUpdated + filesDeleted;
  }
}
