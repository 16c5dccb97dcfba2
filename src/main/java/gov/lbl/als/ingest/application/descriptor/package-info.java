/**
 * Descriptor lifecycle: load, guard against double ingestion, merge manifests, persist.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.descriptor;
