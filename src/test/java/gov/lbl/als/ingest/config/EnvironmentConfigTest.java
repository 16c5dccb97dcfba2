package gov.lbl.als.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentConfigTest {

  @Test
  void mapsKnownVariablesAndIgnoresBlankOnes() {
    Map<String, String> settings = EnvironmentConfig.fromEnvironment(Map.of(
        "SCICAT_INGEST_URL", " https://catalog/api ",
        "SCICAT_INGEST_USERNAME", "ingestor",
        "SCICAT_INGEST_PASSWORD", "",
        "DATASETTRACKER_SHARE_IDENTIFIER", "nersc-cfs",
        "HOME", "/root"));

    assertEquals(Map.of(
        "catalogUrl", "https://catalog/api",
        "catalogUsername", "ingestor",
        "shareIdentifier", "nersc-cfs"), settings);
  }
}
