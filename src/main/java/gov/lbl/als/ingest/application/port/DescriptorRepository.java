package gov.lbl.als.ingest.application.port;

import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Persistence port for the descriptor file stored alongside a dataset.
 * <p><strong>Contract:</strong> {@link #write(Path, Descriptor)} replaces the file atomically; a reader
 * never observes a partially written descriptor.</p>
 *
 * @since 0.1.0
 */
public interface DescriptorRepository {
  /**
   * Reads the descriptor of a dataset.
   *
   * @param datasetRoot dataset root directory
   * @return descriptor, or empty on first ingestion
   * @throws IngestException {@code MULTIPLE_DESCRIPTORS} or {@code DESCRIPTOR_UNREADABLE}
   */
  Optional<Descriptor> read(Path datasetRoot) throws IngestException;

  /**
   * Writes the descriptor of a dataset, replacing any previous one.
   *
   * @param datasetRoot dataset root directory
   * @param descriptor descriptor to store
   * @return path of the written file
   * @throws IngestException {@code DESCRIPTOR_WRITE_FAILED}
   */
  Path write(Path datasetRoot, Descriptor descriptor) throws IngestException;

  /**
   * Tells whether a file name belongs to a descriptor so that manifest discovery can skip it.
   *
   * @param fileName bare file name
   * @return {@code true} for descriptor files
   */
  boolean isDescriptorFile(String fileName);
}
