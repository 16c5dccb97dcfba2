/**
 * <strong>Purpose:</strong> Logging support: per-run log capture for descriptors, verbosity control and
 * redaction helpers.
 * <p><strong>Concurrency:</strong> Run captures filter by run id, so concurrent runs do not mix lines.
 * <p><strong>Security:</strong> Provides redaction helpers so credentials never reach a persisted run log.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.logging;
