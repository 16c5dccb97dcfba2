/**
 * <strong>Purpose:</strong> Ports the ingestion pipeline depends on: registries, descriptor storage,
 * run log capture, metrics and time.
 * <p><strong>Pipeline role:</strong> Application layer boundary; infrastructure adapters implement these
 * interfaces and tests substitute in-memory fakes.</p>
 * <p><strong>Concurrency:</strong> Registry ports are used by one run at a time; metrics and clock
 * ports must be thread-safe.</p>
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.port;
