package gov.lbl.als.ingest.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.testutil.InMemoryCatalog;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractionDispatcherTest {
  @TempDir Path tempDir;

  private final FileManifest manifest = FileManifest.of(
      List.of(new FileManifestEntry("a.txt", 1, Instant.parse("2024-01-01T00:00:00Z"), false)));

  @Test
  void scratchDirectoryExistsDuringExtractionAndIsRemovedAfter() throws Exception {
    Path scratchParent = Files.createDirectory(tempDir.resolve("scratch"));
    AtomicReference<Path> seen = new AtomicReference<>();
    ExtractionStrategy strategy = (m, d, context) -> {
      seen.set(context.scratchDirectory());
      assertTrue(Files.isDirectory(context.scratchDirectory()));
      return d.withCatalog(d.catalog().withDatasetId("pid-9"));
    };

    Descriptor result = new ExtractionDispatcher(scratchParent)
        .invoke(strategy, manifest, Descriptor.blank(), tempDir, new InMemoryCatalog(), "ingestor");

    assertEquals("pid-9", result.catalog().datasetId());
    assertFalse(Files.exists(seen.get()));
    try (Stream<Path> left = Files.list(scratchParent)) {
      assertEquals(0, left.count());
    }
  }

  @Test
  void strategyFailuresBecomeExtractionFailed() {
    ExtractionDispatcher dispatcher = new ExtractionDispatcher(tempDir);

    IngestException checked = assertThrows(IngestException.class, () -> dispatcher.invoke(
        (m, d, c) -> {
          throw new ExtractionException("header missing");
        }, manifest, Descriptor.blank(), tempDir, new InMemoryCatalog(), "ingestor"));
    IngestException unchecked = assertThrows(IngestException.class, () -> dispatcher.invoke(
        (m, d, c) -> {
          throw new IllegalStateException("boom");
        }, manifest, Descriptor.blank(), tempDir, new InMemoryCatalog(), "ingestor"));

    assertEquals(FailureKind.EXTRACTION_FAILED, checked.kind());
    assertTrue(checked.getMessage().contains("header missing"));
    assertEquals(FailureKind.EXTRACTION_FAILED, unchecked.kind());
  }

  @Test
  void descriptorWithoutCatalogIdIsRejected() {
    IngestException e = assertThrows(IngestException.class, () -> new ExtractionDispatcher(tempDir)
        .invoke((m, d, c) -> d, manifest, Descriptor.blank(), tempDir, new InMemoryCatalog(), "ingestor"));

    assertEquals(FailureKind.EXTRACTION_FAILED, e.kind());
  }
}
