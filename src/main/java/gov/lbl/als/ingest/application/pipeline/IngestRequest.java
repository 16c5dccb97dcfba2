package gov.lbl.als.ingest.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one ingestion.
 *
 * @param datasetRoot local dataset root, already prefixed with any base folder
 * @param instancePath dataset path as given, recorded on the Tracker instance
 * @param files explicit file list relative to the root; empty to discover every file
 * @param spec extractor name
 * @since 0.1.0
 */
public record IngestRequest(Path datasetRoot, String instancePath, List<String> files, String spec) {

  public IngestRequest {
    Objects.requireNonNull(datasetRoot, "datasetRoot");
    Objects.requireNonNull(instancePath, "instancePath");
    files = files == null ? List.of() : List.copyOf(files);
  }
}
