package gov.lbl.als.ingest.domain.manifest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Ordered, path-keyed list of the files that make up one dataset.
 * <p><strong>Why:</strong> The manifest is the authoritative file list both registries are reconciled
 * against, so path uniqueness and the size total are enforced here rather than by callers.</p>
 * <p><strong>Role:</strong> Domain aggregate persisted inside the descriptor.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @implNote {@link #totalSizeBytes()} is computed once from the entries at construction; it is never
 * accepted from outside.
 * @since 0.1.0
 */
public final class FileManifest {
  private static final FileManifest EMPTY = new FileManifest(Map.of());

  private final Map<String, FileManifestEntry> entries;
  private final long totalSizeBytes;

  private FileManifest(Map<String, FileManifestEntry> entries) {
    this.entries = Collections.unmodifiableMap(entries);
    long total = 0;
    for (FileManifestEntry entry : entries.values()) {
      total = Math.addExact(total, entry.sizeBytes());
    }
    this.totalSizeBytes = total;
  }

  /**
   * Returns the manifest with no files.
   *
   * @return shared empty manifest
   */
  public static FileManifest empty() {
    return EMPTY;
  }

  /**
   * Builds a manifest from entries in order.
   *
   * @param entries manifest entries; must not contain two entries with the same path
   * @return new manifest preserving the supplied order
   * @throws IllegalArgumentException if two entries share a path
   */
  public static FileManifest of(Collection<FileManifestEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    Map<String, FileManifestEntry> byPath = new LinkedHashMap<>();
    for (FileManifestEntry entry : entries) {
      Objects.requireNonNull(entry, "entry");
      if (byPath.putIfAbsent(entry.path(), entry) != null) {
        throw new IllegalArgumentException("duplicate manifest path: " + entry.path());
      }
    }
    return new FileManifest(byPath);
  }

  /**
   * Returns a manifest holding every entry of this one plus {@code additions} whose paths are not
   * present yet. Entries already present are kept as they are.
   *
   * @param additions candidate entries, in order
   * @return merged manifest; {@code this} when nothing new was supplied
   */
  public FileManifest mergeKeepingExisting(Collection<FileManifestEntry> additions) {
    Objects.requireNonNull(additions, "additions");
    Map<String, FileManifestEntry> merged = new LinkedHashMap<>(entries);
    boolean changed = false;
    for (FileManifestEntry entry : additions) {
      if (merged.putIfAbsent(entry.path(), entry) == null) {
        changed = true;
      }
    }
    return changed ? new FileManifest(merged) : this;
  }

  public List<FileManifestEntry> entries() {
    return List.copyOf(entries.values());
  }

  public Set<String> paths() {
    return entries.keySet();
  }

  public Optional<FileManifestEntry> find(String path) {
    return Optional.ofNullable(entries.get(path));
  }

  public boolean contains(String path) {
    return entries.containsKey(path);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Sum of {@link FileManifestEntry#sizeBytes()} over all entries.
   *
   * @return total size in bytes
   */
  public long totalSizeBytes() {
    return totalSizeBytes;
  }

  /**
   * Returns the paths of {@code candidates} that this manifest does not list, in candidate order.
   *
   * @param candidates paths to check
   * @return unknown paths; empty when every candidate is listed
   */
  public List<String> missingFrom(Collection<String> candidates) {
    List<String> missing = new ArrayList<>();
    for (String candidate : candidates) {
      if (!entries.containsKey(candidate)) {
        missing.add(candidate);
      }
    }
    return missing;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileManifest that)) {
      return false;
    }
    return List.copyOf(entries.values()).equals(List.copyOf(that.entries.values()));
  }

  @Override
  public int hashCode() {
    return List.copyOf(entries.values()).hashCode();
  }

  @Override
  public String toString() {
    return "FileManifest[files=" + entries.size() + ", totalSizeBytes=" + totalSizeBytes + "]";
  }
}
