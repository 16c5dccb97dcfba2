package gov.lbl.als.ingest.application.descriptor;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import gov.lbl.als.ingest.domain.descriptor.CatalogLink;
import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.infrastructure.persistence.JsonDescriptorRepository;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DescriptorStoreTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path tempDir;

  private final DescriptorStore store = new DescriptorStore(new JsonDescriptorRepository());

  @Test
  void loadReturnsEmptyWhenNoDescriptor() throws Exception {
    assertTrue(store.load(tempDir).isEmpty());
  }

  @Test
  void alreadyIngestedDescriptorIsRefused() {
    Descriptor ingested = Descriptor.blank().withCatalog(CatalogLink.empty().withDatasetId("pid-7"));

    IngestException e = assertThrows(IngestException.class,
        () -> store.validateForIngestion(ingested, List.of("a.txt")));
    assertEquals(FailureKind.ALREADY_INGESTED, e.kind());
  }

  @Test
  void incomingPathOutsidePersistedManifestIsRefused() {
    Descriptor seeded = Descriptor.blank().withFileManifest(manifest("a.txt", "b.txt"));

    IngestException e = assertThrows(IngestException.class,
        () -> store.validateForIngestion(seeded, List.of("a.txt", "c.txt")));
    assertEquals(FailureKind.MANIFEST_MISMATCH, e.kind());
    assertTrue(e.getMessage().contains("c.txt"));
  }

  @Test
  void subsetOfPersistedManifestIsAccepted() {
    Descriptor seeded = Descriptor.blank().withFileManifest(manifest("a.txt", "b.txt"));

    assertDoesNotThrow(() -> store.validateForIngestion(seeded, List.of("b.txt")));
    assertDoesNotThrow(() -> store.validateForIngestion(Descriptor.blank(), List.of("z.txt")));
  }

  @Test
  void persistStampsRunLogAndRoundTrips() throws Exception {
    Descriptor descriptor = Descriptor.blank()
        .withFileManifest(manifest("a.txt"))
        .withCatalog(new CatalogLink("pid-1", "http://catalog", T0, "generic", List.of()));

    Descriptor written = store.persist(descriptor, tempDir, List.of("line one", "line two"));
    Descriptor reloaded = store.load(tempDir).orElseThrow();

    assertEquals(List.of("line one", "line two"), written.catalog().runLog());
    assertEquals(written, reloaded);
  }

  private static FileManifest manifest(String... paths) {
    return FileManifest.of(Arrays.stream(paths)
        .map(p -> new FileManifestEntry(p, 1, T0, false))
        .toList());
  }
}
