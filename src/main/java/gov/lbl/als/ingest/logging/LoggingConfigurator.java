package gov.lbl.als.ingest.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts ingestion logging verbosity for CLI runs.
 * <p><strong>Why:</strong> Operators debugging a failed ingest need registry request traces without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 * @see RunLogCapture
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String ENGINE_LOGGER = "gov.lbl.als.ingest";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the engine's loggers to DEBUG. Third-party loggers keep their configured levels so HTTP and
   * exporter internals do not flood the run log.
   *
   * @return {@code true} when the level was changed or already DEBUG
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger engine = context.getLogger(ENGINE_LOGGER);
      if (!Level.DEBUG.equals(engine.getLevel())) {
        engine.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
