package gov.lbl.als.ingest.domain.ingest;

/**
 * Coarse grouping of {@link FailureKind}s; callers branch on it to choose an exit code or a retry
 * policy.
 *
 * @since 0.1.0
 */
public enum FailureCategory {
  CONFIGURATION,
  VALIDATION,
  EXTRACTION,
  RECONCILIATION,
  PERSISTENCE,
  INTERNAL
}
