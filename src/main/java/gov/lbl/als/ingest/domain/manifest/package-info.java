/**
 * <strong>Purpose:</strong> Manifest value types describing which files make up a dataset.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by the manifest builder, persisted in the
 * descriptor and diffed against Tracker file records.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.domain.manifest;
