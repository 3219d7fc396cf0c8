package ca.gc.cra.edgeingest.config;

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
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> defaults = DefaultsForMode.asFlatMap("ingest");
    Map<String, String> yaml = Map.of(
        "activePath", "/yaml/fortigate.log",
        "tailSliceMillis", "1000");
    Map<String, String> cli = Map.of("tailSliceMillis", "750");

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "ingest", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("/yaml/fortigate.log", effective.get("activePath"));
    assertEquals("750", effective.get("tailSliceMillis"));
    assertEquals("10000", effective.get("metricsIntervalMillis"));
    assertEquals(List.of("CLI overrides YAML for key: tailSliceMillis"), warnings);
  }

  @Test
  void cliKeyAbsentFromYamlDoesNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "ingest",
        Optional.empty(),
        Map.of("outputDir", "/tmp/out"),
        DefaultsForMode.asFlatMap("ingest"),
        warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void rejectsUnknownExporter() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "ingest",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            DefaultsForMode.asFlatMap("ingest"),
            null));

    assertTrue(ex.getMessage().contains("metricsExporter"));
  }

  @Test
  void ingestRequiresActivePath() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "ingest",
            Optional.of(Map.of("activePath", " ")),
            Map.of(),
            DefaultsForMode.asFlatMap("ingest"),
            null));

    assertTrue(ex.getMessage().contains("activePath is required"));
  }

  @Test
  void nullInputsAreTreatedAsEmpty() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "inspect", Optional.empty(), null, null, null);

    assertTrue(effective.isEmpty());
  }
}
