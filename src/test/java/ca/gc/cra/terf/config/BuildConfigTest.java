package ca.gc.cra.terf.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuildConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    BuildConfig config = BuildConfig.fromMap(Map.of("in", "meta.csv", "out", "shards"));

    assertEquals(Path.of("meta.csv").toAbsolutePath().normalize(), config.input());
    assertEquals(Path.of("shards").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals("train", config.name());
    assertEquals(1024, config.perShard());
    assertTrue(config.threads() >= 1);
    assertFalse(config.compress());
    assertFalse(config.normalizeJpeg());
    assertFalse(config.allowOverwrite());
    assertFalse(config.verbose());
  }

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> options = new HashMap<>();
    options.put("in", "meta.csv");
    options.put("out", "shards");
    options.put("name", "val");
    options.put("perShard", "64");
    options.put("threads", "3");
    options.put("compress", "TRUE");
    options.put("jpeg", "true");
    options.put("allowOverwrite", "true");
    options.put("verbose", "true");

    BuildConfig config = BuildConfig.fromMap(options);

    assertEquals("val", config.name());
    assertEquals(64, config.perShard());
    assertEquals(3, config.threads());
    assertTrue(config.compress());
    assertTrue(config.normalizeJpeg());
    assertTrue(config.allowOverwrite());
    assertTrue(config.verbose());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> BuildConfig.fromMap(Map.of("out", "shards")));
    assertThrows(IllegalArgumentException.class,
        () -> BuildConfig.fromMap(Map.of("in", "meta.csv", "out", "shards", "perShard", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> BuildConfig.fromMap(Map.of("in", "meta.csv", "out", "shards", "threads", "5000")));
    assertThrows(IllegalArgumentException.class,
        () -> BuildConfig.fromMap(Map.of("in", "meta.csv", "out", "shards", "name", "../up")));
    assertThrows(IllegalArgumentException.class,
        () -> BuildConfig.fromMap(Map.of("in", "meta.csv", "out", "shards", "compress", "yes")));
  }

  @Test
  void aggregationConfigsShareTheCommonKeys() {
    ExtractConfig extract = ExtractConfig.fromMap(
        Map.of("in", "shards", "out", "images", "threads", "2", "compress", "true"));
    assertEquals(2, extract.threads());
    assertTrue(extract.compressed());

    SummaryConfig summary = SummaryConfig.fromMap(Map.of("in", "shards", "verbose", "true"));
    assertTrue(summary.verbose());
    assertThrows(IllegalArgumentException.class, () -> SummaryConfig.fromMap(Map.of()));
  }
}
