package gov.lbl.als.ingest.domain.descriptor;

import java.util.List;

/**
 * Tracker side of a descriptor.
 *
 * @param trackerDatasetId slug of the Tracker dataset record
 * @param registryInstance base URL of the Tracker instance
 * @param instanceRecordId id of the dataset instance describing this physical copy
 * @param instanceComments operator comments about the instance; never originated by the engine
 * @since 0.1.0
 */
public record TrackerLink(
    String trackerDatasetId,
    String registryInstance,
    String instanceRecordId,
    List<String> instanceComments) {

  private static final TrackerLink EMPTY = new TrackerLink(null, null, null, List.of());

  public TrackerLink {
    instanceComments = instanceComments == null ? List.of() : List.copyOf(instanceComments);
  }

  public static TrackerLink empty() {
    return EMPTY;
  }

  public boolean hasDataset() {
    return trackerDatasetId != null && !trackerDatasetId.isBlank();
  }
}
