package gov.lbl.als.ingest.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromSettings() {
    CliInput input = CliInput.parse(new String[] {"spec=generic", "--DRY-RUN", "-v", "datasetPath=x"});

    assertArrayEquals(new String[] {"spec=generic", "datasetPath=x"}, input.keyValueArgs());
    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {" --HELP "}).help());
  }

  @Test
  void dashedSettingStaysASetting() {
    CliInput input = CliInput.parse(new String[] {"--config=ingest.yaml"});
    assertArrayEquals(new String[] {"--config=ingest.yaml"}, input.keyValueArgs());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void unrecognisedFlagsAreReportedSeparately() {
    CliInput input = CliInput.parse(new String[] {"--force", "datasetPath=x"});
    assertEquals(Set.of("--force"), input.unknownFlags());
    assertArrayEquals(new String[] {"datasetPath=x"}, input.keyValueArgs());
  }

  @Test
  void emptyInputHasNothing() {
    CliInput input = CliInput.parse(null);
    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.dryRun());
    assertFalse(input.verbose());
  }
}
