/**
 * Descriptor aggregate: the per-dataset provenance record and its Catalog and Tracker links.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.domain.descriptor;
