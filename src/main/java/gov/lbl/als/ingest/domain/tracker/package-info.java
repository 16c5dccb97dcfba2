/**
 * <strong>Purpose:</strong> Records held by the Tracker registry (beamlines, proposals, datasets,
 * dataset instances, instance files and shares).
 * <p><strong>Pipeline role:</strong> Domain values exchanged through
 * {@link gov.lbl.als.ingest.application.port.TrackerPort}; the reconciliation engine upserts them.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.domain.tracker;
