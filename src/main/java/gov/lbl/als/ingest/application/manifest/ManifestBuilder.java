package gov.lbl.als.ingest.application.manifest;

import gov.lbl.als.ingest.domain.ingest.FailureKind;
import gov.lbl.als.ingest.domain.ingest.IngestException;
import gov.lbl.als.ingest.domain.ingest.ValidationIssue;
import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the file manifest of a dataset from its root directory.
 * <p><strong>Why:</strong> The manifest is what both registries are reconciled against, so every entry
 * must name a regular file inside the root.</p>
 * <p><strong>Behavior:</strong>
 * <ul>
 *   <li>No explicit paths: every regular file below the root, discovered recursively in path order.
 *   Symbolic links are reported, not followed; bookkeeping files in the root are skipped.</li>
 *   <li>Explicit paths: each must resolve inside the root, exist, and be a regular file that is not a
 *   link and is not reached through a linked directory. Offenders are dropped and reported as
 *   {@link ValidationIssue}s. When a path is listed twice the later occurrence wins.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the exclusion predicate; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ManifestBuilder {
  private static final Logger log = LoggerFactory.getLogger(ManifestBuilder.class);

  private final Predicate<String> excludedRootFile;

  /**
   * Creates a builder.
   *
   * @param excludedRootFile matches names of files in the dataset root that never belong to the
   *     manifest (descriptor files, the run lock)
   */
  public ManifestBuilder(Predicate<String> excludedRootFile) {
    this.excludedRootFile = Objects.requireNonNull(excludedRootFile, "excludedRootFile");
  }

  /**
   * Builds the manifest.
   *
   * @param datasetRoot dataset root directory
   * @param explicitPaths paths relative to the root; empty for recursive discovery
   * @return manifest plus dropped-path issues
   * @throws IngestException {@code INVALID_DATASET_ROOT} when the root is not a directory,
   *     {@code NO_VALID_FILES} when nothing valid remains
   */
  public ManifestBuildResult build(Path datasetRoot, List<String> explicitPaths) throws IngestException {
    Objects.requireNonNull(datasetRoot, "datasetRoot");
    Path root = datasetRoot.toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw new IngestException(FailureKind.INVALID_DATASET_ROOT,
          "Dataset root is not a directory: " + root);
    }
    List<ValidationIssue> issues = new ArrayList<>();
    List<FileManifestEntry> entries = explicitPaths == null || explicitPaths.isEmpty()
        ? discover(root, issues)
        : fromExplicit(root, explicitPaths, issues);

    for (ValidationIssue issue : issues) {
      log.warn("Skipping {}: {}", issue.path(), issue.message());
    }
    if (entries.isEmpty()) {
      throw new IngestException(FailureKind.NO_VALID_FILES,
          "No valid files found under " + root + " (" + issues.size() + " rejected)");
    }
    FileManifest manifest = FileManifest.of(entries);
    log.info("Manifest built: {} files, {} bytes", manifest.size(), manifest.totalSizeBytes());
    return new ManifestBuildResult(manifest, issues);
  }

  private List<FileManifestEntry> discover(Path root, List<ValidationIssue> issues) throws IngestException {
    Map<String, FileManifestEntry> found = new TreeMap<>();
    try {
      Files.walkFileTree(root, new SimpleFileVisitor<>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
          if (attrs.isSymbolicLink()) {
            issues.add(ValidationIssue.warning(toRelative(root, file), "is a symbolic link"));
            return FileVisitResult.CONTINUE;
          }
          if (!attrs.isRegularFile()) {
            return FileVisitResult.CONTINUE;
          }
          if (file.getParent().equals(root) && excludedRootFile.test(file.getFileName().toString())) {
            return FileVisitResult.CONTINUE;
          }
          String relative = toRelative(root, file);
          found.put(relative, entry(relative, attrs));
          return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
          issues.add(ValidationIssue.error(toRelative(root, file), "unreadable: " + exc.getMessage()));
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (IOException e) {
      throw new IngestException(FailureKind.INVALID_DATASET_ROOT,
          "Unable to walk dataset root " + root + ": " + e.getMessage(), e);
    }
    return new ArrayList<>(found.values());
  }

  private List<FileManifestEntry> fromExplicit(Path root, List<String> explicitPaths, List<ValidationIssue> issues) {
    Map<String, FileManifestEntry> byPath = new LinkedHashMap<>();
    for (String raw : explicitPaths) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String candidate = FileManifestEntry.normalizePath(raw);
      Path resolved;
      try {
        Path given = Path.of(candidate);
        if (given.isAbsolute()) {
          issues.add(ValidationIssue.error(raw, "absolute paths are not allowed"));
          continue;
        }
        resolved = root.resolve(given).normalize();
      } catch (InvalidPathException e) {
        issues.add(ValidationIssue.error(raw, "invalid path: " + e.getReason()));
        continue;
      }
      if (!resolved.startsWith(root) || resolved.equals(root)) {
        issues.add(ValidationIssue.error(raw, "resolves outside the dataset root"));
        continue;
      }
      Path linked = linkedAncestor(root, resolved);
      if (linked != null) {
        issues.add(ValidationIssue.warning(raw, "passes through symbolic link " + toRelative(root, linked)));
        continue;
      }
      if (resolved.getParent().equals(root) && excludedRootFile.test(resolved.getFileName().toString())) {
        issues.add(ValidationIssue.warning(raw, "is an ingestion bookkeeping file"));
        continue;
      }
      BasicFileAttributes attrs;
      try {
        attrs = Files.readAttributes(resolved, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      } catch (IOException e) {
        issues.add(ValidationIssue.warning(raw, "does not exist"));
        continue;
      }
      if (attrs.isSymbolicLink()) {
        issues.add(ValidationIssue.warning(raw, "is a symbolic link"));
        continue;
      }
      if (attrs.isDirectory()) {
        issues.add(ValidationIssue.warning(raw, "is a directory"));
        continue;
      }
      if (!attrs.isRegularFile()) {
        issues.add(ValidationIssue.warning(raw, "is not a regular file"));
        continue;
      }
      String relative = toRelative(root, resolved);
      byPath.remove(relative);
      byPath.put(relative, entry(relative, attrs));
    }
    return new ArrayList<>(byPath.values());
  }

  // The root itself may be a link (mounted volumes); directories below it may not.
  private static Path linkedAncestor(Path root, Path resolved) {
    Path current = root;
    for (Path part : root.relativize(resolved.getParent())) {
      if (part.toString().isEmpty()) {
        break;
      }
      current = current.resolve(part);
      if (Files.isSymbolicLink(current)) {
        return current;
      }
    }
    return null;
  }

  private static FileManifestEntry entry(String relative, BasicFileAttributes attrs) {
    return new FileManifestEntry(relative, attrs.size(), attrs.lastModifiedTime().toInstant(), false);
  }

  private static String toRelative(Path root, Path file) {
    return FileManifestEntry.normalizePath(root.relativize(file).toString());
  }
}
