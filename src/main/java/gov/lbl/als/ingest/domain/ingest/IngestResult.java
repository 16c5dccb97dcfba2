package gov.lbl.als.ingest.domain.ingest;

import gov.lbl.als.ingest.domain.descriptor.Descriptor;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed outcome of an ingestion or reconciliation run.
 * <p><strong>Why:</strong> The use case never lets an exception escape; callers branch on
 * {@link #isSuccess()} and {@link #failureKind()} instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class IngestResult {
  private final Descriptor descriptor;
  private final ReconciliationReport report;
  private final FailureKind failureKind;
  private final String message;

  private IngestResult(
      Descriptor descriptor, ReconciliationReport report, FailureKind failureKind, String message) {
    this.descriptor = descriptor;
    this.report = report;
    this.failureKind = failureKind;
    this.message = message;
  }

  /**
   * Successful run.
   *
   * @param descriptor descriptor as persisted at the end of the run
   * @param report reconciliation outcome, or {@code null} when the Tracker was not configured
   * @return success result
   */
  public static IngestResult success(Descriptor descriptor, ReconciliationReport report) {
    return new IngestResult(Objects.requireNonNull(descriptor, "descriptor"), report, null, null);
  }

  /**
   * Failed run.
   *
   * @param kind failure classification
   * @param message human-readable reason
   * @param persisted descriptor written before the failure was reported, or {@code null}
   * @return failure result
   */
  public static IngestResult failure(FailureKind kind, String message, Descriptor persisted) {
    return new IngestResult(persisted, null, Objects.requireNonNull(kind, "kind"), message);
  }

  public static IngestResult failure(IngestException e, Descriptor persisted) {
    return failure(e.kind(), e.getMessage(), persisted);
  }

  public boolean isSuccess() {
    return failureKind == null;
  }

  /**
   * Descriptor of the run: the persisted one on success, and on failure the one that was persisted
   * before the failure was reported, if any.
   */
  public Optional<Descriptor> descriptor() {
    return Optional.ofNullable(descriptor);
  }

  public Optional<ReconciliationReport> report() {
    return Optional.ofNullable(report);
  }

  public Optional<FailureKind> failureKind() {
    return Optional.ofNullable(failureKind);
  }

  public Optional<FailureCategory> failureCategory() {
    return failureKind == null ? Optional.empty() : Optional.of(failureKind.category());
  }

  public String message() {
    return message == null ? "" : message;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "IngestResult[success, catalogId=" + descriptor.catalog().datasetId() + "]";
    }
    return "IngestResult[failure, kind=" + failureKind + ", message=" + message + "]";
  }
}
