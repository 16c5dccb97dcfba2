package gov.lbl.als.ingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: beamline-ingest"));
  }

  @Test
  void unknownCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"publish"}));
    assertTrue(buffer.toString().contains("usage: beamline-ingest"));
  }

  @Test
  void globalHelpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("reconcile   Re-run Tracker reconciliation"));
  }

  @Test
  void dispatchesToCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"INGEST", "--help"}));
    assertTrue(buffer.toString().contains("Beamline dataset ingestion"));
    assertTrue(buffer.toString().contains("spec=NAME"));

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"reconcile", "--help"}));
    assertTrue(buffer.toString().contains("Tracker reconciliation for an ingested dataset"));
  }
}
