package gov.lbl.als.ingest.validation;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Resolves user-supplied dataset paths against the configured base folder.
 * <p><strong>Why:</strong> When ingestion runs in a container the dataset path names a location relative
 * to a mounted volume; joining it to the base folder must not escape that volume.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Only lexical checks; existence of the resolved directory is verified by the ingestion
 * pipeline so that it can report {@code INVALID_DATASET_ROOT}.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves a dataset path.
   *
   * @param baseFolder base folder; {@code null} or blank resolves {@code datasetPath} on its own
   * @param datasetPath dataset path as given by the operator
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is blank, contains control characters, cannot be
   *     parsed, or leaves {@code baseFolder} through {@code ..} segments
   */
  public static Path resolveDatasetRoot(String baseFolder, String datasetPath) {
    String raw = Strings.requireNonBlank("datasetPath", datasetPath);
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("datasetPath must not contain null bytes");
    }
    try {
      String base = Strings.blankToNull(baseFolder);
      if (base == null) {
        return Path.of(raw).toAbsolutePath().normalize();
      }
      Path basePath = Path.of(base).toAbsolutePath().normalize();
      Path relative = Path.of(stripLeadingSeparators(raw));
      Path resolved = basePath.resolve(relative).normalize();
      if (!resolved.startsWith(basePath)) {
        throw new IllegalArgumentException(
            "datasetPath " + datasetPath + " resolves outside base folder " + basePath);
      }
      return resolved;
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("datasetPath is not a valid path: " + ex.getReason(), ex);
    }
  }

  private static String stripLeadingSeparators(String value) {
    int i = 0;
    while (i < value.length() && (value.charAt(i) == '/' || value.charAt(i) == '\\')) {
      i++;
    }
    return i == value.length() ? "." : value.substring(i);
  }
}
