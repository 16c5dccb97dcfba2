package gov.lbl.als.ingest.domain.manifest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * <strong>What:</strong> One file of a dataset as recorded in its manifest.
 * <p><strong>Role:</strong> Domain value shared by the manifest builder, the descriptor store and the
 * Tracker file reconciliation.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param path slash-separated path relative to the dataset root; unique within a manifest
 * @param sizeBytes file size in bytes; never negative
 * @param dateLastModified last modification time in UTC, truncated to whole seconds
 * @param supplemental {@code true} for files that belong to the dataset but are not primary data
 * @since 0.1.0
 */
public record FileManifestEntry(
    String path,
    long sizeBytes,
    Instant dateLastModified,
    boolean supplemental) {

  /**
   * Validates the entry and normalizes path separators and timestamp precision.
   */
  public FileManifestEntry {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(dateLastModified, "dateLastModified");
    path = normalizePath(path);
    if (path.isEmpty()) {
      throw new IllegalArgumentException("manifest path must not be blank");
    }
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must not be negative for " + path);
    }
    dateLastModified = dateLastModified.truncatedTo(ChronoUnit.SECONDS);
  }

  /**
   * Converts a platform path string into the manifest's POSIX form.
   *
   * @param raw path as given by the caller or the filesystem
   * @return trimmed path using {@code /} separators and no leading {@code ./}
   */
  public static String normalizePath(String raw) {
    String value = raw.trim().replace('\\', '/');
    while (value.startsWith("./")) {
      value = value.substring(2);
    }
    return value;
  }
}
