package gov.lbl.als.ingest.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Logger engine;
  private Level previous;

  @BeforeEach
  void setUp() {
    engine = (Logger) LoggerFactory.getLogger(LoggingConfigurator.ENGINE_LOGGER);
    previous = engine.getLevel();
  }

  @AfterEach
  void tearDown() {
    engine.setLevel(previous);
  }

  @Test
  void verboseLoggingRaisesEngineLoggerToDebug() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    assertEquals(Level.DEBUG, engine.getLevel());
    assertTrue(LoggerFactory.getLogger("gov.lbl.als.ingest.application.pipeline.IngestUseCase").isDebugEnabled());
  }
}
