package gov.lbl.als.ingest.domain.ingest;

import java.util.Objects;

/**
 * Expected failure of an ingestion step, classified by {@link FailureKind}.
 *
 * @since 0.1.0
 */
public class IngestException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FailureKind kind;

  public IngestException(FailureKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public IngestException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public FailureKind kind() {
    return kind;
  }

  public FailureCategory category() {
    return kind.category();
  }
}
