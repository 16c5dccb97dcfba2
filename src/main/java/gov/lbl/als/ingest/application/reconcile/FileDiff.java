package gov.lbl.als.ingest.application.reconcile;

import gov.lbl.als.ingest.domain.manifest.FileManifest;
import gov.lbl.als.ingest.domain.manifest.FileManifestEntry;
import gov.lbl.als.ingest.domain.tracker.DatasetInstanceFile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Three-way difference between a manifest and the Tracker's file records.
 * <p><strong>Semantics:</strong> With manifest paths M and record paths R:
 * {@code delete = R - M}, {@code create = M - R}, {@code update = M ∩ R}. The three sets are disjoint,
 * {@code create ∪ update} covers M, and {@code delete ∪ update} only names records that exist.</p>
 * <p>When the Tracker holds several records for one path, the first is matched and the others are
 * deleted.</p>
 *
 * @param create manifest entries without a record, in manifest order
 * @param delete records whose path is not in the manifest
 * @param update record and entry pairs sharing a path
 * @since 0.1.0
 */
public record FileDiff(
    List<FileManifestEntry> create,
    List<DatasetInstanceFile> delete,
    List<Update> update) {

  public FileDiff {
    create = List.copyOf(create);
    delete = List.copyOf(delete);
    update = List.copyOf(update);
  }

  /**
   * Record to bring in line with a manifest entry.
   *
   * @param record existing Tracker record
   * @param entry manifest entry with the current values
   */
  public record Update(DatasetInstanceFile record, FileManifestEntry entry) {
    /** Whether the record differs from the entry and must be written. */
    public boolean isChange() {
      return !record.matches(entry);
    }
  }

  /**
   * Computes the difference.
   *
   * @param manifest desired state
   * @param records current Tracker records of the instance
   * @return operations that converge the records onto the manifest
   */
  public static FileDiff compute(FileManifest manifest, Collection<DatasetInstanceFile> records) {
    Map<String, DatasetInstanceFile> byPath = new LinkedHashMap<>();
    List<DatasetInstanceFile> delete = new ArrayList<>();
    for (DatasetInstanceFile record : records) {
      if (!manifest.contains(record.path()) || byPath.putIfAbsent(record.path(), record) != null) {
        delete.add(record);
      }
    }
    List<FileManifestEntry> create = new ArrayList<>();
    List<Update> update = new ArrayList<>();
    for (FileManifestEntry entry : manifest.entries()) {
      DatasetInstanceFile record = byPath.get(entry.path());
      if (record == null) {
        create.add(entry);
      } else {
        update.add(new Update(record, entry));
      }
    }
    return new FileDiff(create, delete, update);
  }

  /**
   * Updates that actually change a record.
   *
   * @return subset of {@link #update()} whose record differs from its entry
   */
  public List<Update> changedUpdates() {
    List<Update> changed = new ArrayList<>();
    for (Update u : update) {
      if (u.isChange()) {
        changed.add(u);
      }
    }
    return changed;
  }

  public boolean isEmpty() {
    return create.isEmpty() && delete.isEmpty() && changedUpdates().isEmpty();
  }
}
