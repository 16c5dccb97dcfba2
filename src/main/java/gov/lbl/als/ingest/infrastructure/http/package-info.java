/**
 * JSON-over-HTTP plumbing shared by the Catalog and Tracker adapters.
 */
package gov.lbl.als.ingest.infrastructure.http;
