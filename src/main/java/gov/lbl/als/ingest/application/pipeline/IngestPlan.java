package gov.lbl.als.ingest.application.pipeline;

import gov.lbl.als.ingest.domain.ingest.ValidationIssue;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.util.List;

/**
 * What an ingestion would do, computed without contacting any registry.
 *
 * @param manifest merged manifest that would be extracted and reconciled
 * @param issues paths the manifest builder dropped
 * @param firstIngestion {@code true} when the dataset has no descriptor yet
 * @since 0.1.0
 */
public record IngestPlan(FileManifest manifest, List<ValidationIssue> issues, boolean firstIngestion) {

  public IngestPlan {
    issues = List.copyOf(issues);
  }
}
