/**
 * <strong>Purpose:</strong> Tracker reconciliation: record upserts and the three-way file diff.
 * <p><strong>Pipeline role:</strong> Runs after extraction, or alone when an operator re-runs
 * reconciliation for an ingested dataset.</p>
 * <p><strong>Concurrency:</strong> Stateless services; one call per run.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.reconcile;
