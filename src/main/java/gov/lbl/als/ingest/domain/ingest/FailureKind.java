package gov.lbl.als.ingest.domain.ingest;

/**
 * <strong>What:</strong> Every way an ingestion or reconciliation run can fail.
 * <p><strong>Why:</strong> Callers need to tell "fix the input" from "retry later" without parsing
 * messages.</p>
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** No extraction strategy is registered under the requested name. */
  UNKNOWN_SPEC(FailureCategory.CONFIGURATION),
  MISSING_CREDENTIALS(FailureCategory.CONFIGURATION),
  /** The configured share slug is unknown to the Tracker. */
  SHARE_NOT_CONFIGURED(FailureCategory.CONFIGURATION),
  INVALID_DATASET_ROOT(FailureCategory.CONFIGURATION),

  NO_VALID_FILES(FailureCategory.VALIDATION),
  /** An explicit file is not listed in the persisted manifest. */
  MANIFEST_MISMATCH(FailureCategory.VALIDATION),
  /** The descriptor already names a Catalog dataset. */
  ALREADY_INGESTED(FailureCategory.VALIDATION),
  /** Reconciliation was requested for a dataset that has no Catalog dataset yet. */
  NOT_INGESTED(FailureCategory.VALIDATION),
  MULTIPLE_DESCRIPTORS(FailureCategory.VALIDATION),
  DESCRIPTOR_UNREADABLE(FailureCategory.VALIDATION),
  /** Another run holds the dataset lock. */
  RUN_IN_PROGRESS(FailureCategory.VALIDATION),
  EMPTY_MANIFEST(FailureCategory.VALIDATION),

  EXTRACTION_FAILED(FailureCategory.EXTRACTION),

  TRACKER_RECORD_MISSING(FailureCategory.RECONCILIATION),
  /** Timeout or connection failure; the run may succeed when retried. */
  REGISTRY_UNAVAILABLE(FailureCategory.RECONCILIATION),
  REGISTRY_REJECTED(FailureCategory.RECONCILIATION),
  FILE_SYNC_FAILED(FailureCategory.RECONCILIATION),

  DESCRIPTOR_WRITE_FAILED(FailureCategory.PERSISTENCE),

  /** A runtime fault escaped a step; the run stopped where it was. */
  UNEXPECTED_ERROR(FailureCategory.INTERNAL);

  private final FailureCategory category;

  FailureKind(FailureCategory category) {
    this.category = category;
  }

  public FailureCategory category() {
    return category;
  }

  /**
   * Indicates whether re-running unchanged could succeed.
   *
   * @return {@code true} only for {@link #REGISTRY_UNAVAILABLE}
   */
  public boolean isTransient() {
    return this == REGISTRY_UNAVAILABLE;
  }
}
