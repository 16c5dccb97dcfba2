package gov.lbl.als.ingest.logging;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import gov.lbl.als.ingest.application.port.RunLogPort;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Captures the log lines of one ingestion run so they can be embedded in the
 * descriptor.
 * <p><strong>Why:</strong> The descriptor travels with the data; its run log is the only trace an operator
 * has once the CLI output is gone.</p>
 * <p><strong>Behavior:</strong> {@link #start(String)} attaches an appender to the root logger that keeps
 * events whose MDC {@value RunLogPort#MDC_KEY} equals the run id. Lines are formatted as
 * {@code MM/dd/yyyy hh:mm:ss a [LEVEL] message}. Closing the recording detaches the appender.</p>
 * <p><strong>Thread-safety:</strong> Each recording is independent; concurrent runs on different threads
 * only see their own lines because filtering is by run id.</p>
 *
 * @implNote Requires Logback; with another SLF4J backend recordings stay empty and a warning is logged.
 * @since 0.1.0
 */
public final class RunLogCapture implements RunLogPort {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(RunLogCapture.class);
  static final DateTimeFormatter LINE_TIME =
      DateTimeFormatter.ofPattern("MM/dd/yyyy hh:mm:ss a", Locale.US);

  private final ZoneId zone;

  /** Creates a capture that renders timestamps in the system time zone. */
  public RunLogCapture() {
    this(ZoneId.systemDefault());
  }

  /**
   * Creates a capture rendering timestamps in the given zone.
   *
   * @param zone time zone of rendered lines
   */
  public RunLogCapture(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public Recording start(String runId) {
    Objects.requireNonNull(runId, "runId");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Run log capture needs Logback; backend {} is active, run log will be empty",
          factory.getClass().getName());
      return new DetachedRecording();
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    RunAppender appender = new RunAppender(runId, zone);
    appender.setContext(context);
    appender.setName("run-log-" + runId);
    appender.start();
    root.addAppender(appender);
    return new AttachedRecording(root, appender);
  }

  static String format(ILoggingEvent event, ZoneId zone) {
    String time = LINE_TIME.format(Instant.ofEpochMilli(event.getTimeStamp()).atZone(zone));
    return time + " [" + event.getLevel() + "] " + event.getFormattedMessage();
  }

  private static final class RunAppender extends AppenderBase<ILoggingEvent> {
    private final String runId;
    private final ZoneId zone;
    private final List<String> lines = new ArrayList<>();

    RunAppender(String runId, ZoneId zone) {
      this.runId = runId;
      this.zone = zone;
    }

    @Override
    protected void append(ILoggingEvent event) {
      Map<String, String> mdc = event.getMDCPropertyMap();
      if (mdc != null && runId.equals(mdc.get(RunLogPort.MDC_KEY))) {
        String line = format(event, zone);
        synchronized (lines) {
          lines.add(line);
        }
      }
    }

    List<String> snapshot() {
      synchronized (lines) {
        return List.copyOf(lines);
      }
    }
  }

  private static final class AttachedRecording implements Recording {
    private final Logger root;
    private final RunAppender appender;

    AttachedRecording(Logger root, RunAppender appender) {
      this.root = root;
      this.appender = appender;
    }

    @Override
    public List<String> lines() {
      return appender.snapshot();
    }

    @Override
    public void close() {
      root.detachAppender(appender);
      appender.stop();
    }
  }

  private static final class DetachedRecording implements Recording {
    @Override
    public List<String> lines() {
      return List.of();
    }

    @Override
    public void close() {
      // Nothing attached
    }
  }
}
