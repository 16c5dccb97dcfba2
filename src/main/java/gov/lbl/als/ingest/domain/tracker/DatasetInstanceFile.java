package gov.lbl.als.ingest.domain.tracker;

import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import java.time.Instant;
import java.util.Objects;

/**
 * Tracker record for one file of a {@link DatasetInstance}, keyed by its relative path.
 *
 * @param id Tracker-assigned identifier; {@code null} before the record is created
 * @param instanceId owning dataset instance
 * @param path path relative to the dataset root
 * @param sizeBytes file size in bytes
 * @param dateLastModified last modification time
 * @param supplemental whether the file is supplemental to the primary data
 * @since 0.1.0
 */
public record DatasetInstanceFile(
    String id,
    String instanceId,
    String path,
    long sizeBytes,
    Instant dateLastModified,
    boolean supplemental) {

  /**
   * Builds a not-yet-created record for a manifest entry.
   *
   * @param instanceId owning instance
   * @param entry manifest entry to copy
   * @return record with a {@code null} id
   */
  public static DatasetInstanceFile fromManifest(String instanceId, FileManifestEntry entry) {
    return new DatasetInstanceFile(null, instanceId, entry.path(), entry.sizeBytes(),
        entry.dateLastModified(), entry.supplemental());
  }

  /**
   * Returns this record with size, modification time and supplemental flag taken from the entry.
   */
  public DatasetInstanceFile withManifestValues(FileManifestEntry entry) {
    return new DatasetInstanceFile(id, instanceId, path, entry.sizeBytes(), entry.dateLastModified(),
        entry.supplemental());
  }

  /**
   * Checks whether the record already carries the entry's measured values.
   */
  public boolean matches(FileManifestEntry entry) {
    return sizeBytes == entry.sizeBytes()
        && supplemental == entry.supplemental()
        && Objects.equals(dateLastModified, entry.dateLastModified());
  }
}
