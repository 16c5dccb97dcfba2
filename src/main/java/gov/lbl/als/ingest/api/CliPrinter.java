package gov.lbl.als.ingest.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for the ingest commands.
 *
 * <p>Plans, help text and run summaries go to stdout; usage after a rejected invocation and failure
 * summaries go to stderr so a wrapping orchestrator can keep them apart from the normal report. Both
 * bypass the logging appenders.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = console(FileDescriptor.out);
  private static final PrintWriter STDERR = console(FileDescriptor.err);
  private static volatile PrintWriter override;

  private CliPrinter() {}

  public static void println(String message) {
    out().println(message);
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = out();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /** Writes a line to stderr, for usage and failure summaries. */
  public static void errorln(String message) {
    PrintWriter writer = override != null ? override : STDERR;
    writer.println(message);
  }

  /** Sends both streams to {@code writer} until {@link #clearTestWriter()}. */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter out() {
    return override != null ? override : STDOUT;
  }

  private static PrintWriter console(FileDescriptor fd) {
    return new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(fd), StandardCharsets.UTF_8), true);
  }
}
