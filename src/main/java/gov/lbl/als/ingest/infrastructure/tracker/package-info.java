/**
 * Tracker registry adapter.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.infrastructure.tracker;
