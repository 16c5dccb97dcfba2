package gov.lbl.als.ingest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for the {@code ingest} and {@code reconcile} commands.
 *
 * <p>The defaults are the single source of truth for optional keys; YAML, environment and CLI values
 * are layered on top by {@link ConfigMerger}.</p>
 */
public final class DefaultsForMode {
  /** Catalog URL used when none is configured. */
  public static final String DEFAULT_CATALOG_URL = "http://localhost:3000/api/v3";
  /** Tracker share used when none is configured. */
  public static final String DEFAULT_SHARE_IDENTIFIER = "als-beegfs";
  /** Registry request timeout used when none is configured. */
  public static final int DEFAULT_REGISTRY_TIMEOUT_SECONDS = 30;

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command merged with the common defaults.
   *
   * @param mode {@code ingest} or {@code reconcile}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for any other mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      case "reconcile" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(IngestConfig.CATALOG_URL, DEFAULT_CATALOG_URL);
    map.put(IngestConfig.SHARE_IDENTIFIER, DEFAULT_SHARE_IDENTIFIER);
    map.put(IngestConfig.REGISTRY_TIMEOUT_SECONDS, Integer.toString(DEFAULT_REGISTRY_TIMEOUT_SECONDS));
    map.put(IngestConfig.METRICS_EXPORTER, "otlp");
    map.put(IngestConfig.OTLP_ENDPOINT, "");
    map.put(IngestConfig.INTERNAL_BASE_FOLDER, "");
    map.put(IngestConfig.BASE_FOLDER, "");
    map.put(IngestConfig.FLOW_RUN_ID, "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(IngestConfig.FILES, "");
    map.put(IngestConfig.DRY_RUN, "false");
    return map;
  }
}
