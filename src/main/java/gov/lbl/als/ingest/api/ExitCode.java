package gov.lbl.als.ingest.api;

import gov.lbl.als.ingest.domain.ingest.FailureKind;

/**
 * <strong>What:</strong> Process exit codes of the {@code beamline-ingest} command.
 * <p><strong>Why:</strong> Orchestrators retry on {@link #TRANSIENT_FAILURE} and page an operator on the
 * others, so the mapping from failure kinds must be stable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The descriptor could not be written, or the configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Extraction or reconciliation failed in a way a retry will not fix. */
  RUNTIME_FAILURE(5),
  /** The dataset or its descriptor does not allow the requested run. */
  VALIDATION_ERROR(6),
  /** A registry was unreachable; re-running later may succeed. Matches {@code EX_TEMPFAIL}. */
  TRANSIENT_FAILURE(75);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Maps a failure kind to the exit code reported for it.
   *
   * @param kind failure kind
   * @return exit code
   */
  public static ExitCode forFailure(FailureKind kind) {
    if (kind.isTransient()) {
      return TRANSIENT_FAILURE;
    }
    return switch (kind.category()) {
      case CONFIGURATION -> CONFIG_ERROR;
      case VALIDATION -> VALIDATION_ERROR;
      case EXTRACTION, RECONCILIATION, INTERNAL -> RUNTIME_FAILURE;
      case PERSISTENCE -> IO_ERROR;
    };
  }
}
