package gov.lbl.als.ingest.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateCutsOnCharacterBoundary() {
    String result = Logs.truncate("héllo world", 2);

    assertTrue(result.startsWith("h... (truncated"), result);
    assertTrue(result.endsWith("2 of 12 bytes)"), result);
  }

  @Test
  void truncateRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactSecretsMasksOnlySecretKeys() {
    Map<String, String> settings = new LinkedHashMap<>();
    settings.put("catalogUsername", "ingestor");
    settings.put("catalogPassword", "hunter2");
    settings.put("trackerPassword", "");
    settings.put("apiToken", "abc");

    Map<String, String> safe = Logs.redactSecrets(settings);

    assertEquals("ingestor", safe.get("catalogUsername"));
    assertEquals("[REDACTED]", safe.get("catalogPassword"));
    assertEquals("", safe.get("trackerPassword"));
    assertEquals("[REDACTED]", safe.get("apiToken"));
  }
}
