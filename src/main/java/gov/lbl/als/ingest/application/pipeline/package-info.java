/**
 * <strong>Purpose:</strong> Ingestion orchestration: the {@code ingest} and {@code reconcile} use cases.
 * <p><strong>Pipeline role:</strong> Entry point called by the CLI; composes manifest building,
 * descriptor handling, extraction and Tracker reconciliation.</p>
 * <p><strong>Concurrency:</strong> One run per call; runs on different datasets may proceed in parallel.</p>
 * <p><strong>Metrics:</strong> {@code ingest.run.*} and {@code reconcile.run.*}.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.pipeline;
