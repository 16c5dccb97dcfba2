/**
 * Documents submitted to the Catalog registry.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.domain.catalog;
