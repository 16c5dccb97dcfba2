/**
 * Per-run context handed through the ingestion pipeline.
 * <p><strong>Concurrency:</strong> Records are immutable; one context per run.</p>
 */
package gov.lbl.als.ingest.application.port.context;
