package ca.gc.cra.terf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("build");
    Map<String, String> yaml = Map.of("perShard", "10", "name", "val");
    Map<String, String> cli = Map.of("perShard", "20", "in", "meta.csv");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "build", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("20", merged.get("perShard"));
    assertEquals("val", merged.get("name"));
    assertEquals("meta.csv", merged.get("in"));
    assertEquals("false", merged.get("compress"));
    assertEquals(List.of("CLI overrides YAML for key: perShard"), warnings);
  }

  @Test
  void otelEndpointRequiresOtlpExporter() {
    Map<String, String> cli = Map.of("otelEndpoint", "http://collector:4317");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "summary", Optional.empty(), cli, DefaultsForMode.asFlatMap("summary"), msg -> { }));

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "summary", Optional.empty(), Map.of("otelEndpoint", "http://collector:4317", "metricsExporter", "otlp"),
        DefaultsForMode.asFlatMap("summary"), msg -> { });
    assertEquals("otlp", merged.get("metricsExporter"));
  }

  @Test
  void rejectsUnknownExporterAndMode() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "build", Optional.empty(), Map.of("metricsExporter", "prometheus"), Map.of(), msg -> { }));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "convert", Optional.empty(), Map.of(), Map.of(), msg -> { }));
  }

  @Test
  void defaultsDifferPerMode() {
    assertEquals("train", DefaultsForMode.asFlatMap("build").get("name"));
    assertEquals("none", DefaultsForMode.asFlatMap("extract").get("metricsExporter"));
    assertNull(DefaultsForMode.asFlatMap("summary").get("perShard"));
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
