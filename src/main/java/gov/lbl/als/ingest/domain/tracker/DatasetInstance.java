package gov.lbl.als.ingest.domain.tracker;

import java.time.Instant;

/**
 * One physical copy of a dataset's files at a path inside a {@link Share}.
 *
 * @param id Tracker-assigned identifier; {@code null} before the record is created
 * @param datasetSlug owning Tracker dataset
 * @param shareSlug share the path is relative to
 * @param path dataset path within the share
 * @param filesSizeBytes total size of the files at creation time
 * @param flowRunId orchestration run that created the record, if any
 * @param dateCreated creation time assigned by the Tracker
 * @param dateFilesDeleted set once the files at this location were deleted
 * @since 0.1.0
 */
public record DatasetInstance(
    String id,
    String datasetSlug,
    String shareSlug,
    String path,
    long filesSizeBytes,
    String flowRunId,
    Instant dateCreated,
    Instant dateFilesDeleted) {

  public boolean isDeleted() {
    return dateFilesDeleted != null;
  }
}
