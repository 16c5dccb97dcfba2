package gov.lbl.als.ingest.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"spec=generic", " datasetPath = a/b "});
    assertEquals("generic", map.get("spec"));
    assertEquals("a/b", map.get("datasetPath"));
    assertEquals(List.of("spec", "datasetPath"), List.copyOf(map.keySet()));
  }

  @Test
  void keepsBlankValuesSoTheyCanClearLowerLayers() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"trackerUrl="});
    assertTrue(map.containsKey("trackerUrl"));
    assertEquals("", map.get("trackerUrl"));
  }

  @Test
  void rejectsArgumentsWithoutKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertTrue(ex.getMessage().contains("key=value"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
  }

  @Test
  void rejectsMalformedNamesAndControlCharacters() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"files=a\u0000b"}));
  }

  @Test
  void ignoresNullAndBlankEntries() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {null, "  ", "spec=generic"});
    assertEquals(Map.of("spec", "generic"), map);
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
