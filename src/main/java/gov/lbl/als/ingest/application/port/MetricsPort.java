package gov.lbl.als.ingest.application.port;

/**
 * <strong>What:</strong> Port abstracting ingestion metrics emission.
 * <p><strong>Why:</strong> Lets the use case record run outcomes and reconciliation counts without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent runs on different datasets.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (for example
 * {@code ingest.run.latencyMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (for example {@code reconcile.files.created}); must not be
   *     {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Adds {@code count} to the named counter. The default implementation calls
   * {@link #increment(String)} repeatedly.
   *
   * @param key dotted metric identifier
   * @param count non-negative amount
   */
  default void add(String key, long count) {
    for (long i = 0; i < count; i++) {
      increment(key);
    }
  }

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}

    @Override public void add(String key, long count) {}
  };
}
