/**
 * OpenTelemetry bridge for {@link gov.lbl.als.ingest.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; safe for parallel runs.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code ingest.*} and {@code reconcile.*} namespaces.</p>
 */
package gov.lbl.als.ingest.infrastructure.metrics;
