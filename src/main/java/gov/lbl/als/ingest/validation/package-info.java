/**
 * <strong>Purpose:</strong> Input validation for configuration values: strings, URLs, numbers and
 * dataset paths.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Errors:</strong> Every violation is an {@link java.lang.IllegalArgumentException} whose message
 * names the offending setting.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.validation;
