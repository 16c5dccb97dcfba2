/**
 * Builds dataset file manifests from the filesystem.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.application.manifest;
