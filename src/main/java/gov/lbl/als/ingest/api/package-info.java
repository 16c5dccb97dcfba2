/**
 * <strong>Purpose:</strong> Command-line surface: the {@code beamline-ingest} dispatcher and its
 * {@code ingest} and {@code reconcile} commands.
 * <p><strong>Contract:</strong> Commands never call {@link java.lang.System#exit(int)} outside
 * {@code main}; they return an {@link gov.lbl.als.ingest.api.ExitCode} so tests can drive them.
 *
 * @since 0.1.0
 */
package gov.lbl.als.ingest.api;
