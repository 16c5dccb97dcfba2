package gov.lbl.als.ingest.application.extract;

import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.manifest.FileManifest;

/**
 * <strong>What:</strong> Instrument-specific extractor that turns a dataset into a Catalog dataset.
 * <p><strong>Contract:</strong> Called once per run. Reads the files named by the manifest, creates
 * the Catalog dataset through {@link ExtractionContext#catalog()}, and returns the descriptor with
 * {@code catalog.datasetId} set. It may fill in identity fields (beamline, proposal, name...) it
 * derives from the data, and must not change the manifest.</p>
 *
 * @since 0.1.0
 */
public interface ExtractionStrategy {
  /**
   * Extracts metadata and creates the Catalog dataset.
   *
   * @param manifest files of the dataset
   * @param descriptor descriptor as loaded and merged by the pipeline
   * @param context dataset root, Catalog port, owner and scratch directory
   * @return descriptor carrying the new Catalog dataset id
   * @throws ExtractionException when metadata cannot be extracted or the Catalog call fails
   */
  Descriptor extract(FileManifest manifest, Descriptor descriptor, ExtractionContext context)
      throws ExtractionException;
}
