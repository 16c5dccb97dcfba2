package gov.lbl.als.ingest.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps the environment variables understood by the beamline deployment onto configuration keys.
 *
 * <p>Blank variables are ignored so an exported-but-empty variable never masks a YAML value.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentConfig {
  static final Map<String, String> VARIABLES = buildVariables();

  private EnvironmentConfig() {}

  /**
   * Reads the process environment.
   *
   * @return settings keyed by configuration key
   */
  public static Map<String, String> fromSystem() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Extracts known variables from an environment map.
   *
   * @param environment variable name to value
   * @return settings keyed by configuration key, in declaration order
   */
  public static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Objects.requireNonNull(environment, "environment");
    Map<String, String> settings = new LinkedHashMap<>();
    VARIABLES.forEach((variable, key) -> {
      String value = environment.get(variable);
      if (value != null && !value.isBlank()) {
        settings.put(key, value.trim());
      }
    });
    return Map.copyOf(settings);
  }

  private static Map<String, String> buildVariables() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("SCICAT_INGEST_SPEC", IngestConfig.SPEC);
    map.put("SCICAT_INGEST_URL", IngestConfig.CATALOG_URL);
    map.put("SCICAT_INGEST_USERNAME", IngestConfig.CATALOG_USERNAME);
    map.put("SCICAT_INGEST_PASSWORD", IngestConfig.CATALOG_PASSWORD);
    map.put("SCICAT_INGEST_OWNER_USERNAME", IngestConfig.OWNER_USERNAME);
    map.put("SCICAT_INGEST_INTERNAL_BASE_FOLDER", IngestConfig.INTERNAL_BASE_FOLDER);
    map.put("SCICAT_INGEST_BASE_FOLDER", IngestConfig.BASE_FOLDER);
    map.put("DATASETTRACKER_URL", IngestConfig.TRACKER_URL);
    map.put("DATASETTRACKER_USERNAME", IngestConfig.TRACKER_USERNAME);
    map.put("DATASETTRACKER_PASSWORD", IngestConfig.TRACKER_PASSWORD);
    map.put("DATASETTRACKER_SHARE_IDENTIFIER", IngestConfig.SHARE_IDENTIFIER);
    return Collections.unmodifiableMap(map);
  }
}
