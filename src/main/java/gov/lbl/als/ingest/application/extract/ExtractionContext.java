package gov.lbl.als.ingest.application.extract;

import gov.lbl.als.ingest.application.port.CatalogPort;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Everything an {@link ExtractionStrategy} may use during one call.
 *
 * @param datasetRoot absolute dataset root; files are read relative to it
 * @param catalog Catalog port the strategy creates the dataset with
 * @param ownerUsername user recorded as owner of the Catalog dataset
 * @param scratchDirectory private working directory, deleted after the call returns
 * @since 0.1.0
 */
public record ExtractionContext(
    Path datasetRoot, CatalogPort catalog, String ownerUsername, Path scratchDirectory) {

  public ExtractionContext {
    Objects.requireNonNull(datasetRoot, "datasetRoot");
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(ownerUsername, "ownerUsername");
    Objects.requireNonNull(scratchDirectory, "scratchDirectory");
  }
}
