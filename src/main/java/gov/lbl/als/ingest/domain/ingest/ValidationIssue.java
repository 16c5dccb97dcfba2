package gov.lbl.als.ingest.domain.ingest;

/**
 * Non-fatal problem found while validating input, such as a listed file that does not exist.
 *
 * @param severity how serious the issue is
 * @param path offending path, as supplied
 * @param message human-readable explanation
 * @since 0.1.0
 */
public record ValidationIssue(Severity severity, String path, String message) {

  public enum Severity {
    WARNING,
    ERROR
  }

  public static ValidationIssue warning(String path, String message) {
    return new ValidationIssue(Severity.WARNING, path, message);
  }

  public static ValidationIssue error(String path, String message) {
    return new ValidationIssue(Severity.ERROR, path, message);
  }
}
