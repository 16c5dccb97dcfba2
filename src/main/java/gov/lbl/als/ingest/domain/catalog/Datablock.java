package gov.lbl.als.ingest.domain.catalog;

import java.time.Instant;
import java.util.List;

/**
 * Catalog list of the files that back a dataset.
 *
 * @param ownerGroup owner group, same as the dataset's
 * @param accessGroups access groups, same as the dataset's
 * @param size total size in bytes
 * @param files file entries
 * @since 0.1.0
 */
public record Datablock(String ownerGroup, List<String> accessGroups, long size, List<DataFile> files) {

  public Datablock {
    accessGroups = accessGroups == null ? List.of() : List.copyOf(accessGroups);
    files = files == null ? List.of() : List.copyOf(files);
  }

  /**
   * One file of a datablock.
   *
   * @param path path relative to the dataset source folder
   * @param size file size in bytes
   * @param time last modification time
   */
  public record DataFile(String path, long size, Instant time) {}
}
