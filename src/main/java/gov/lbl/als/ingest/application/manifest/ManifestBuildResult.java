package gov.lbl.als.ingest.application.manifest;

import gov.lbl.als.ingest.domain.ingest.ValidationIssue;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.util.List;
import java.util.Objects;

/**
 * Manifest built from a dataset root plus the problems that caused paths to be dropped.
 *
 * @param manifest valid entries, never empty
 * @param issues dropped paths and why
 * @since 0.1.0
 */
public record ManifestBuildResult(FileManifest manifest, List<ValidationIssue> issues) {

  public ManifestBuildResult {
    Objects.requireNonNull(manifest, "manifest");
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
