package ca.gc.cra.terf.config;

import ca.gc.cra.terf.domain.shard.ShardAccumulator;
import ca.gc.cra.terf.domain.shard.ShardNaming;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each terf command.
 *
 * <p>The defaults are the lowest-precedence layer, below the YAML file and {@code key=value}
 * arguments. Required keys ({@code in}, and {@code out} for {@code build} and {@code extract}) have no
 * default.</p>
 */
public final class DefaultsForMode {
  /** Commands that accept configuration. */
  public static final Set<String> MODES = Set.of("build", "extract", "summary");

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command name (build, extract, summary)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if {@code mode} is not a known command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "build" -> buildBuildDefaults();
      case "extract" -> buildExtractDefaults();
      case "summary" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("threads", Integer.toString(ConfigValues.defaultThreads()));
    map.put("compress", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildBuildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("name", ShardNaming.DEFAULT_NAME);
    map.put("perShard", Integer.toString(ShardAccumulator.DEFAULT_PER_SHARD));
    map.put("jpeg", "false");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("allowOverwrite", "false");
    return map;
  }
}
