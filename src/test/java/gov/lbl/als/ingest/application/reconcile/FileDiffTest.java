package gov.lbl.als.ingest.application.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FileDiffTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void partitionsManifestAgainstRecords() {
    FileManifest manifest = FileManifest.of(List.of(
        new FileManifestEntry("a.txt", 1, T0, false),
        new FileManifestEntry("c.txt", 3, T0, false)));
    List<DatasetInstanceFile> records = List.of(
        new DatasetInstanceFile("file-1", "inst-1", "a.txt", 1, T0, false),
        new DatasetInstanceFile("file-2", "inst-1", "b.txt", 2, T0, false));

    FileDiff diff = FileDiff.compute(manifest, records);

    assertEquals(List.of("c.txt"), diff.create().stream().map(FileManifestEntry::path).toList());
    assertEquals(List.of("file-2"), diff.delete().stream().map(DatasetInstanceFile::id).toList());
    assertEquals(1, diff.update().size());
    assertTrue(diff.changedUpdates().isEmpty());
    assertDisjointCover(manifest, diff);
  }

  @Test
  void changedSizeTimeOrFlagIsAnUpdate() {
    FileManifest manifest = FileManifest.of(List.of(
        new FileManifestEntry("a.txt", 2, T0, false),
        new FileManifestEntry("b.txt", 1, T0.plusSeconds(1), false),
        new FileManifestEntry("c.txt", 1, T0, true)));
    List<DatasetInstanceFile> records = List.of(
        new DatasetInstanceFile("file-1", "inst-1", "a.txt", 1, T0, false),
        new DatasetInstanceFile("file-2", "inst-1", "b.txt", 1, T0, false),
        new DatasetInstanceFile("file-3", "inst-1", "c.txt", 1, T0, false));

    FileDiff diff = FileDiff.compute(manifest, records);

    assertEquals(3, diff.changedUpdates().size());
    assertTrue(diff.create().isEmpty());
    assertTrue(diff.delete().isEmpty());
  }

  @Test
  void duplicateRecordsForOnePathAreDeletedBeyondTheFirst() {
    FileManifest manifest = FileManifest.of(List.of(new FileManifestEntry("a.txt", 1, T0, false)));
    List<DatasetInstanceFile> records = List.of(
        new DatasetInstanceFile("file-1", "inst-1", "a.txt", 1, T0, false),
        new DatasetInstanceFile("file-2", "inst-1", "a.txt", 1, T0, false));

    FileDiff diff = FileDiff.compute(manifest, records);

    assertEquals(List.of("file-2"), diff.delete().stream().map(DatasetInstanceFile::id).toList());
    assertEquals("file-1", diff.update().get(0).record().id());
    assertFalse(diff.isEmpty());
  }

  @Test
  void matchingRecordsProduceEmptyDiff() {
    FileManifest manifest = FileManifest.of(List.of(new FileManifestEntry("a.txt", 1, T0, false)));

    assertTrue(FileDiff.compute(manifest,
        List.of(new DatasetInstanceFile("file-1", "inst-1", "a.txt", 1, T0, false))).isEmpty());
  }

  private static void assertDisjointCover(FileManifest manifest, FileDiff diff) {
    Set<String> covered = new HashSet<>();
    diff.create().forEach(e -> assertTrue(covered.add(e.path())));
    diff.update().forEach(u -> assertTrue(covered.add(u.entry().path())));
    assertEquals(manifest.paths(), covered);
  }
}
