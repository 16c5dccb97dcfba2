package gov.lbl.als.ingest.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import gov.lbl.als.ingest.application.port.RegistryException;
import gov.lbl.als.ingest.domain.catalog.CatalogDataset;
import gov.lbl.als.ingest.domain.catalog.Datablock;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.testutil.InMemoryCatalog;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenericExtractionStrategyTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path tempDir;

  private final InMemoryCatalog catalog = new InMemoryCatalog();
  private final GenericExtractionStrategy strategy = new GenericExtractionStrategy();

  @Test
  void createsCatalogDatasetAndDatablockFromManifest() throws Exception {
    Path root = tempDir.resolve("20240301_sample");
    FileManifest manifest = FileManifest.of(List.of(
        new FileManifestEntry("a.h5", 10, T0, false),
        new FileManifestEntry("b.h5", 5, T0.plusSeconds(30), false)));
    Descriptor descriptor = new Descriptor("7.3.3", "ALS-123", "Dr. PI", null, null, "2024-03-01",
        null, null, null, Map.of("contact_email", "pi@lbl.gov"));

    Descriptor result = strategy.extract(manifest, descriptor, context(root));

    assertEquals("pid-1", result.catalog().datasetId());
    assertEquals("20240301_sample", result.name());
    CatalogDataset dataset = catalog.datasets.get("pid-1");
    assertEquals("ALS-123", dataset.ownerGroup());
    assertEquals(List.of("7.3.3", "ingestor"), dataset.accessGroups());
    assertEquals("pi@lbl.gov", dataset.contactEmail());
    assertEquals(15, dataset.size());
    assertEquals(2, dataset.numberOfFiles());
    assertEquals(T0.minusSeconds(36_000), dataset.creationTime());
    Datablock datablock = catalog.datablocks.get("pid-1").get(0);
    assertEquals(2, datablock.files().size());
    assertEquals(manifest, result.fileManifest());
  }

  @Test
  void catalogFailureBecomesExtractionException() {
    catalog.failNext(RegistryException.rejected("bad dataset", 400));
    FileManifest manifest = FileManifest.of(List.of(new FileManifestEntry("a.h5", 1, T0, false)));

    assertThrows(ExtractionException.class,
        () -> strategy.extract(manifest, Descriptor.blank(), context(tempDir)));
  }

  @Test
  void emptyManifestIsRejected() {
    assertThrows(ExtractionException.class,
        () -> strategy.extract(FileManifest.empty(), Descriptor.blank(), context(tempDir)));
  }

  private ExtractionContext context(Path root) {
    return new ExtractionContext(root, catalog, "ingestor", tempDir);
  }
}
