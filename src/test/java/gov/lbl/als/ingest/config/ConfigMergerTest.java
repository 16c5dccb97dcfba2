package gov.lbl.als.ingest.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesEnvironmentWhichOverridesYaml() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> yaml = Map.of("catalogUrl", "https://yaml/api", "spec", "yaml-spec", "datasetPath", "a");
    Map<String, String> env = Map.of("catalogUrl", "https://env/api", "catalogUsername", "ingestor");
    Map<String, String> cli = Map.of("spec", "generic", "catalogUsername", "operator");

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig("ingest", Optional.of(yaml), env, cli,
        DefaultsForMode.asFlatMap("ingest"), warnings::add);

    assertEquals("https://env/api", effective.get("catalogUrl"));
    assertEquals("generic", effective.get("spec"));
    assertEquals("operator", effective.get("catalogUsername"));
    assertEquals("30", effective.get("registryTimeoutSeconds"));
    assertTrue(warnings.contains("Environment overrides YAML for key: catalogUrl"));
    assertTrue(warnings.contains("CLI overrides configured value for key: spec"));
    assertTrue(warnings.contains("CLI overrides configured value for key: catalogUsername"));
  }

  @Test
  void defaultCatalogUrlIsAnnounced() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig("reconcile", Optional.empty(), Map.of(),
        Map.of("datasetPath", "a"), DefaultsForMode.asFlatMap("reconcile"), warnings::add);

    assertEquals(DefaultsForMode.DEFAULT_CATALOG_URL, effective.get("catalogUrl"));
    assertEquals(List.of("Using default Catalog URL " + DefaultsForMode.DEFAULT_CATALOG_URL), warnings);
  }

  @Test
  void incompleteTrackerCredentialsWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig("reconcile", Optional.empty(),
        Map.of("catalogUrl", "https://catalog/api", "trackerUrl", "https://tracker/api", "trackerUsername", "u"),
        Map.of("datasetPath", "a"), DefaultsForMode.asFlatMap("reconcile"), warnings::add);

    assertEquals(List.of("Tracker URL is set but its credentials are incomplete; the Tracker will not be used"),
        warnings);
  }

  @Test
  void requiredKeysAreEnforcedPerMode() {
    IllegalArgumentException noPath = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("reconcile", Optional.empty(), Map.of(), Map.of(),
            DefaultsForMode.asFlatMap("reconcile"), null));
    IllegalArgumentException noSpec = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("ingest", Optional.empty(), Map.of(),
            Map.of("datasetPath", "a"), DefaultsForMode.asFlatMap("ingest"), null));

    assertEquals("datasetPath is required", noPath.getMessage());
    assertEquals("spec is required for ingest", noSpec.getMessage());
  }
}
