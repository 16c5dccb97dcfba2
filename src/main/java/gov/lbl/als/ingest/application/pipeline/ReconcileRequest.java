package gov.lbl.als.ingest.application.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of a stand-alone Tracker reconciliation.
 *
 * @param datasetRoot local dataset root, already prefixed with any base folder
 * @param instancePath dataset path as given, recorded on the Tracker instance
 * @since 0.1.0
 */
public record ReconcileRequest(Path datasetRoot, String instancePath) {

  public ReconcileRequest {
    Objects.requireNonNull(datasetRoot, "datasetRoot");
    Objects.requireNonNull(instancePath, "instancePath");
  }
}
