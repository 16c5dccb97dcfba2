/**
 * <strong>Purpose:</strong> Filesystem adapters: the JSON descriptor file and the per-dataset run lock.
 * <p><strong>Concurrency:</strong> Writes are atomic renames; concurrent runs on one dataset are kept out
 * by {@link gov.lbl.als.ingest.infrastructure.persistence.DatasetLock}.</p>
 * <p><strong>Security:</strong> Files are only written inside the dataset root.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.infrastructure.persistence;
