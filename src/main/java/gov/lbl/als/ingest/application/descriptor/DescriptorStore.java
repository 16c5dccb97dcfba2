package gov.lbl.als.ingest.application.descriptor;

import gov.lbl.als.ingest.application.port.DescriptorRepository;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads, validates, merges and persists dataset descriptors.
 * <p><strong>Why:</strong> The descriptor is the only record of whether a dataset already reached the
 * Catalog; validating it before any registry call is what prevents double ingestion.</p>
 * <p><strong>Role:</strong> Application service over a {@link DescriptorRepository}.</p>
 *
 * @since 0.1.0
 */
public final class DescriptorStore {
  private static final Logger log = LoggerFactory.getLogger(DescriptorStore.class);

  private final DescriptorRepository repository;

  public DescriptorStore(DescriptorRepository repository) {
    this.repository = Objects.requireNonNull(repository, "repository");
  }

  /**
   * Loads the descriptor of a dataset.
   *
   * @param datasetRoot dataset root
   * @return descriptor, or empty on first ingestion
   * @throws IngestException when descriptor files are ambiguous or unreadable
   */
  public Optional<Descriptor> load(Path datasetRoot) throws IngestException {
    Optional<Descriptor> loaded = repository.read(datasetRoot);
    if (loaded.isEmpty()) {
      log.info("No descriptor in {}; treating as first ingestion", datasetRoot);
    }
    return loaded;
  }

  /**
   * Checks that a descriptor allows a new ingestion of the given paths.
   *
   * @param descriptor loaded descriptor
   * @param incomingPaths manifest paths of this run
   * @throws IngestException {@code ALREADY_INGESTED} when a Catalog dataset exists,
   *     {@code MANIFEST_MISMATCH} when a path is missing from a non-empty persisted manifest
   */
  public void validateForIngestion(Descriptor descriptor, Collection<String> incomingPaths)
      throws IngestException {
    if (descriptor.catalog().isIngested()) {
      throw new IngestException(FailureKind.ALREADY_INGESTED,
          "Dataset already ingested as Catalog dataset " + descriptor.catalog().datasetId());
    }
    FileManifest persisted = descriptor.fileManifest();
    if (persisted.isEmpty()) {
      return;
    }
    List<String> unknown = persisted.missingFrom(incomingPaths);
    if (!unknown.isEmpty()) {
      throw new IngestException(FailureKind.MANIFEST_MISMATCH,
          unknown.size() + " file(s) not listed in the descriptor manifest, first: " + unknown.get(0));
    }
  }

  /**
   * Merges the incoming manifest into the persisted one. Persisted entries win; new paths are
   * appended in incoming order.
   *
   * @param existing persisted manifest
   * @param incoming manifest built by this run
   * @return merged manifest
   */
  public FileManifest merge(FileManifest existing, FileManifest incoming) {
    return existing.mergeKeepingExisting(incoming.entries());
  }

  /**
   * Stores the descriptor with the run log embedded.
   *
   * @param descriptor descriptor to store
   * @param datasetRoot dataset root
   * @param runLog captured log lines of this run
   * @return descriptor as written
   * @throws IngestException {@code DESCRIPTOR_WRITE_FAILED}
   */
  public Descriptor persist(Descriptor descriptor, Path datasetRoot, List<String> runLog)
      throws IngestException {
    Descriptor stamped = descriptor.withCatalog(descriptor.catalog().withRunLog(runLog));
    Path written = repository.write(datasetRoot, stamped);
    log.info("Descriptor written to {}", written);
    return stamped;
  }
}
