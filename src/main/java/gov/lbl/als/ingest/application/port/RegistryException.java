package gov.lbl.als.ingest.application.port;

/**
 * Failure reported by a registry adapter.
 *
 * <p>Transient failures (timeouts, refused connections, 5xx answers) may succeed when retried;
 * the others mean the registry rejected the request.</p>
 *
 * @since 0.1.0
 */
public class RegistryException extends Exception {
  private static final long serialVersionUID = 1L;

  private final boolean transientFailure;
  private final int status;

  public RegistryException(String message, boolean transientFailure, int status) {
    super(message);
    this.transientFailure = transientFailure;
    this.status = status;
  }

  public RegistryException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
    this.status = -1;
  }

  public static RegistryException rejected(String message, int status) {
    return new RegistryException(message, false, status);
  }

  public static RegistryException unavailable(String message, Throwable cause) {
    return new RegistryException(message, true, cause);
  }

  public boolean isTransient() {
    return transientFailure;
  }

  /**
   * HTTP status of the failed call.
   *
   * @return status code, or {@code -1} when no response was received
   */
  public int status() {
    return status;
  }
}
