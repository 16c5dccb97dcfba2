package gov.lbl.als.ingest.domain.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class FileManifestTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void entryNormalizesPathAndTruncatesTime() {
    FileManifestEntry entry =
        new FileManifestEntry(" ./raw\\scan_001.h5 ", 10, T0.plusMillis(750), false);

    assertEquals("raw/scan_001.h5", entry.path());
    assertEquals(T0, entry.dateLastModified());
  }

  @Test
  void entryRejectsNegativeSizeAndBlankPath() {
    assertThrows(IllegalArgumentException.class, () -> new FileManifestEntry("a", -1, T0, false));
    assertThrows(IllegalArgumentException.class, () -> new FileManifestEntry("./", 1, T0, false));
  }

  @Test
  void ofRejectsDuplicatePaths() {
    List<FileManifestEntry> entries = List.of(
        new FileManifestEntry("a.txt", 1, T0, false),
        new FileManifestEntry("./a.txt", 2, T0, false));

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FileManifest.of(entries));
    assertTrue(e.getMessage().contains("a.txt"));
  }

  @Test
  void mergeKeepsExistingEntriesAndAppendsNewOnes() {
    FileManifest existing = FileManifest.of(List.of(new FileManifestEntry("a.txt", 1, T0, false)));
    FileManifest merged = existing.mergeKeepingExisting(List.of(
        new FileManifestEntry("a.txt", 99, T0.plusSeconds(60), false),
        new FileManifestEntry("b.txt", 2, T0, false)));

    assertEquals(List.of("a.txt", "b.txt"), List.copyOf(merged.paths()));
    assertEquals(1, merged.find("a.txt").orElseThrow().sizeBytes());
    assertEquals(3, merged.totalSizeBytes());
  }

  @Test
  void mergeWithNothingNewReturnsSameInstance() {
    FileManifest existing = FileManifest.of(List.of(new FileManifestEntry("a.txt", 1, T0, false)));

    assertSame(existing, existing.mergeKeepingExisting(List.of(new FileManifestEntry("a.txt", 5, T0, false))));
  }

  @Test
  void missingFromListsCandidatesNotInManifest() {
    FileManifest manifest = FileManifest.of(List.of(new FileManifestEntry("a.txt", 1, T0, false)));

    assertEquals(List.of("c.txt"), manifest.missingFrom(List.of("a.txt", "c.txt")));
    assertTrue(FileManifest.empty().isEmpty());
  }
}
