package gov.lbl.als.ingest.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the ingestion pipeline.
 * <p><strong>Why:</strong> Ingestion dates and run latencies come from here so tests can pin them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see gov.lbl.als.ingest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an instant.
   *
   * @return {@link Instant} for {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
