/**
 * <strong>Purpose:</strong> Configuration layering (defaults, YAML, environment, CLI) into a validated
 * {@link gov.lbl.als.ingest.config.IngestConfig}, and the composition root that wires adapters from it.
 * <p><strong>Security:</strong> Credentials are only logged through redacting views.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.config;
