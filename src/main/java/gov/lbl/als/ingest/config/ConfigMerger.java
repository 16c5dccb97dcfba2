package gov.lbl.als.ingest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, environment and CLI sources while enforcing precedence and
 * cross-field rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; environment &gt; YAML &gt; defaults.
   *
   * @param mode active command ({@code ingest} or {@code reconcile})
   * @param yaml optional YAML-derived settings for the command
   * @param environment settings taken from environment variables
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn receives operator warnings: overrides of YAML values, default Catalog URL in use,
   *     partially configured Tracker
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a required key is missing for the command
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> { } : warn;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> envCopy = environment == null ? Map.of() : environment;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : envCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey())) {
        warnings.accept("Environment overrides YAML for key: " + entry.getKey());
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) || envCopy.containsKey(key)) {
        warnings.accept("CLI overrides configured value for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    boolean catalogUrlGiven = yamlCopy.containsKey(IngestConfig.CATALOG_URL)
        || envCopy.containsKey(IngestConfig.CATALOG_URL)
        || cliCopy.containsKey(IngestConfig.CATALOG_URL);
    if (!catalogUrlGiven || trim(merged.get(IngestConfig.CATALOG_URL)).isEmpty()) {
      merged.put(IngestConfig.CATALOG_URL, DefaultsForMode.DEFAULT_CATALOG_URL);
      warnings.accept("Using default Catalog URL " + DefaultsForMode.DEFAULT_CATALOG_URL);
    }

    validate(mode, merged, warnings);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective, Consumer<String> warn) {
    if (trim(effective.get(IngestConfig.DATASET_PATH)).isEmpty()) {
      throw new IllegalArgumentException(IngestConfig.DATASET_PATH + " is required");
    }
    if ("ingest".equals(mode.trim().toLowerCase(Locale.ROOT))
        && trim(effective.get(IngestConfig.SPEC)).isEmpty()) {
      throw new IllegalArgumentException(IngestConfig.SPEC + " is required for ingest");
    }

    boolean trackerUrl = !trim(effective.get(IngestConfig.TRACKER_URL)).isEmpty();
    boolean trackerUser = !trim(effective.get(IngestConfig.TRACKER_USERNAME)).isEmpty();
    boolean trackerPassword = !trim(effective.get(IngestConfig.TRACKER_PASSWORD)).isEmpty();
    if (trackerUrl && (!trackerUser || !trackerPassword)) {
      warn.accept("Tracker URL is set but its credentials are incomplete; the Tracker will not be used");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
