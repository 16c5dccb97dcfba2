package gov.lbl.als.ingest.application.extract;

/**
 * Failure raised by an {@link ExtractionStrategy}.
 *
 * @since 0.1.0
 */
public class ExtractionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
