package gov.lbl.als.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("ingest.yaml");
    Files.writeString(yaml, """
        common:
          catalogUrl: https://catalog.lbl.gov/api/v3
          registryTimeoutSeconds: 45
        ingest:
          spec: generic
          catalogUrl: https://staging.lbl.gov/api/v3
        reconcile:
          flowRunId: ignored
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "ingest").orElseThrow();

    assertEquals("https://staging.lbl.gov/api/v3", map.get("catalogUrl"));
    assertEquals("45", map.get("registryTimeoutSeconds"));
    assertEquals("generic", map.get("spec"));
    assertFalse(map.containsKey("flowRunId"));
  }

  @Test
  void filesListIsJoinedWithCommas() throws IOException {
    Path yaml = tempDir.resolve("files.yaml");
    Files.writeString(yaml, """
        ingest:
          files:
            - raw/a.h5
            - raw/b.h5
        """);

    assertEquals("raw/a.h5,raw/b.h5", YamlConfigLoader.load(yaml, "ingest").orElseThrow().get("files"));
  }

  @Test
  void otherListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, """
        common:
          catalogUrl: [a, b]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "ingest");

    assertTrue(result.isEmpty());
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("bad.yaml");
    Files.writeString(yaml, "common: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "ingest"));
  }

  @Test
  void emptyDocumentIsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "reconcile").orElseThrow());
  }
}
