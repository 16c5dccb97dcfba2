package gov.lbl.als.ingest.application.port;

import java.util.List;

/**
 * Collects the log lines of one run so they can be embedded in the descriptor.
 *
 * <p>Lines are attributed to a run through the SLF4J MDC key {@link #MDC_KEY}; the caller sets it
 * for the duration of the run.</p>
 *
 * @since 0.1.0
 */
public interface RunLogPort {
  /** MDC key carrying the id of the active run. */
  String MDC_KEY = "ingest.run";

  /**
   * Starts capturing lines tagged with a run id.
   *
   * @param runId id placed in the MDC under {@link #MDC_KEY}
   * @return recording; closing it stops capture
   */
  Recording start(String runId);

  /** Lines captured for one run. */
  interface Recording extends AutoCloseable {
    /**
     * Returns the lines captured so far, oldest first.
     *
     * @return snapshot of captured lines
     */
    List<String> lines();

    @Override
    void close();
  }

  /** Sink that captures nothing. */
  RunLogPort NONE = runId -> new Recording() {
    @Override
    public List<String> lines() {
      return List.of();
    }

    @Override
    public void close() {}
  };
}
