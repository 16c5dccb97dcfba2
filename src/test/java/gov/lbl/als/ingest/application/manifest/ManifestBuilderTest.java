package gov.lbl.als.ingest.application.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.ingest.ValidationIssue;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestBuilderTest {
  @TempDir Path tempDir;

  private final ManifestBuilder builder =
      new ManifestBuilder(name -> name.startsWith("als-dataset-metadata") || name.equals(".als-ingest.lock"));

  @Test
  void discoversRegularFilesRecursivelyInPathOrder() throws Exception {
    Files.writeString(tempDir.resolve("b.txt"), "bb");
    Files.createDirectories(tempDir.resolve("raw"));
    Files.writeString(tempDir.resolve("raw/a.h5"), "a");
    Files.writeString(tempDir.resolve("als-dataset-metadata.json"), "{}");
    Files.writeString(tempDir.resolve(".als-ingest.lock"), "");

    ManifestBuildResult result = builder.build(tempDir, List.of());

    assertEquals(List.of("b.txt", "raw/a.h5"), List.copyOf(result.manifest().paths()));
    assertEquals(3, result.manifest().totalSizeBytes());
    assertTrue(result.issues().isEmpty());
  }

  @Test
  void explicitListDropsInvalidPathsWithIssues() throws Exception {
    Files.writeString(tempDir.resolve("a.txt"), "a");
    Files.createDirectories(tempDir.resolve("sub"));

    ManifestBuildResult result = builder.build(tempDir,
        List.of("a.txt", "missing.txt", "sub", "../outside.txt", "als-dataset-metadata.json"));

    assertEquals(List.of("a.txt"), List.copyOf(result.manifest().paths()));
    List<String> dropped = result.issues().stream().map(ValidationIssue::path).toList();
    assertEquals(List.of("missing.txt", "sub", "../outside.txt", "als-dataset-metadata.json"), dropped);
  }

  @Test
  void explicitDuplicateKeepsLaterOccurrence() throws Exception {
    Files.writeString(tempDir.resolve("a.txt"), "a");
    Files.writeString(tempDir.resolve("b.txt"), "b");

    ManifestBuildResult result = builder.build(tempDir, List.of("a.txt", "b.txt", "./a.txt"));

    assertEquals(List.of("b.txt", "a.txt"), List.copyOf(result.manifest().paths()));
  }

  @Test
  void discoveryReportsSymbolicLinksWithoutFollowingThem() throws Exception {
    Path outside = Files.createDirectories(tempDir.resolve("outside"));
    Files.writeString(outside.resolve("secret.txt"), "secret");
    Path root = Files.createDirectories(tempDir.resolve("root"));
    Files.writeString(root.resolve("a.txt"), "a");
    Files.createSymbolicLink(root.resolve("l.txt"), root.resolve("a.txt"));
    Files.createSymbolicLink(root.resolve("link"), outside);

    ManifestBuildResult result = builder.build(root, List.of());

    assertEquals(List.of("a.txt"), List.copyOf(result.manifest().paths()));
    assertEquals(List.of("l.txt", "link"),
        result.issues().stream().map(ValidationIssue::path).sorted().toList());
    assertTrue(result.issues().stream().allMatch(issue -> issue.message().contains("symbolic link")));
  }

  @Test
  void explicitPathThroughLinkedDirectoryIsRejected() throws Exception {
    Path outside = Files.createDirectories(tempDir.resolve("outside"));
    Files.writeString(outside.resolve("secret.txt"), "secret");
    Path root = Files.createDirectories(tempDir.resolve("root"));
    Files.writeString(root.resolve("a.txt"), "a");
    Files.createDirectories(root.resolve("raw"));
    Files.createSymbolicLink(root.resolve("raw/link"), outside);
    Files.createSymbolicLink(root.resolve("l.txt"), root.resolve("a.txt"));

    ManifestBuildResult result = builder.build(root, List.of("a.txt", "raw/link/secret.txt", "l.txt"));

    assertEquals(List.of("a.txt"), List.copyOf(result.manifest().paths()));
    assertEquals(List.of("raw/link/secret.txt", "l.txt"),
        result.issues().stream().map(ValidationIssue::path).toList());
    assertTrue(result.issues().get(0).message().contains("raw/link"));
  }

  @Test
  void noValidFilesFails() throws Exception {
    IngestException e = assertThrows(IngestException.class,
        () -> builder.build(tempDir, List.of("nope.txt")));

    assertEquals(FailureKind.NO_VALID_FILES, e.kind());
  }

  @Test
  void missingRootFails() {
    IngestException e = assertThrows(IngestException.class,
        () -> builder.build(tempDir.resolve("absent"), List.of()));

    assertEquals(FailureKind.INVALID_DATASET_ROOT, e.kind());
  }
}
