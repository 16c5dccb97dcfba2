package gov.lbl.als.ingest.application.extract;

import gov.lbl.als.ingest.application.port.CatalogPort;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Invokes the resolved extraction strategy exactly once and checks its result.
 * <p><strong>Why:</strong> A strategy creates a Catalog dataset as a side effect, so a retry could create
 * a second one. Failures are reported, never retried.</p>
 * <p><strong>Role:</strong> Application service used by the ingestion use case.</p>
 *
 * @since 0.1.0
 */
public final class ExtractionDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ExtractionDispatcher.class);

  private final Path scratchParent;

  /** Creates a dispatcher that places scratch directories in the JVM temp directory. */
  public ExtractionDispatcher() {
    this(null);
  }

  /**
   * Creates a dispatcher.
   *
   * @param scratchParent directory scratch directories are created in; {@code null} for the JVM default
   */
  public ExtractionDispatcher(Path scratchParent) {
    this.scratchParent = scratchParent;
  }

  /**
   * Runs the strategy.
   *
   * @param strategy resolved strategy
   * @param manifest merged manifest
   * @param descriptor merged descriptor
   * @param datasetRoot absolute dataset root
   * @param catalog Catalog port handed to the strategy
   * @param ownerUsername owner of the Catalog dataset
   * @return descriptor returned by the strategy, carrying a Catalog dataset id
   * @throws IngestException {@code EXTRACTION_FAILED} when the strategy fails or returns no dataset id
   */
  public Descriptor invoke(
      ExtractionStrategy strategy,
      FileManifest manifest,
      Descriptor descriptor,
      Path datasetRoot,
      CatalogPort catalog,
      String ownerUsername) throws IngestException {
    Objects.requireNonNull(strategy, "strategy");
    Path scratch = createScratch();
    ExtractionContext context = new ExtractionContext(datasetRoot, catalog, ownerUsername, scratch);
    Descriptor result;
    try {
      result = strategy.extract(manifest, descriptor, context);
    } catch (ExtractionException e) {
      throw new IngestException(FailureKind.EXTRACTION_FAILED,
          "Extraction failed: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new IngestException(FailureKind.EXTRACTION_FAILED,
          "Extraction failed unexpectedly: " + e, e);
    } finally {
      deleteScratch(scratch);
    }
    if (result == null) {
      throw new IngestException(FailureKind.EXTRACTION_FAILED, "Extractor returned no descriptor");
    }
    if (!result.catalog().isIngested()) {
      throw new IngestException(FailureKind.EXTRACTION_FAILED,
          "Extractor returned a descriptor without a Catalog dataset id");
    }
    log.info("Extractor created Catalog dataset {}", result.catalog().datasetId());
    return result;
  }

  private Path createScratch() throws IngestException {
    try {
      return scratchParent == null
          ? Files.createTempDirectory("als-ingest-")
          : Files.createTempDirectory(scratchParent, "als-ingest-");
    } catch (IOException e) {
      throw new IngestException(FailureKind.EXTRACTION_FAILED,
          "Unable to create scratch directory: " + e.getMessage(), e);
    }
  }

  private static void deleteScratch(Path scratch) {
    try (Stream<Path> walk = Files.walk(scratch)) {
      walk.sorted(Comparator.reverseOrder()).forEach(p -> {
        try {
          Files.deleteIfExists(p);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (IOException | UncheckedIOException e) {
      log.warn("Unable to delete scratch directory {}", scratch, e);
    }
  }
}
