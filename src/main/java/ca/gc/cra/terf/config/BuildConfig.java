package ca.gc.cra.terf.config;

import ca.gc.cra.terf.domain.shard.ShardAccumulator;
import ca.gc.cra.terf.domain.shard.ShardNaming;
import ca.gc.cra.terf.validation.Numbers;
import ca.gc.cra.terf.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for the {@code build} command, which shards a metadata table and
 * its images into frame files.
 * <p><strong>Role:</strong> Produced by the build CLI from defaults, YAML and {@code key=value}
 * arguments; consumed by {@link ca.gc.cra.terf.application.pipeline.BuildUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input metadata table; read twice, so it must be a regular file
 * @param outputDirectory directory receiving the shard files
 * @param name shard base name, restricted to {@code [A-Za-z0-9._-]}
 * @param perShard maximum records per shard
 * @param threads number of shard-writing workers
 * @param compress wrap each shard file in zlib
 * @param normalizeJpeg re-encode every image as RGB JPEG before writing
 * @param allowOverwrite write into a populated output directory, replacing same-named shards
 * @param verbose log per-shard progress at INFO instead of DEBUG
 * @since 0.1.0
 */
public record BuildConfig(
    Path input,
    Path outputDirectory,
    String name,
    int perShard,
    int threads,
    boolean compress,
    boolean normalizeJpeg,
    boolean allowOverwrite,
    boolean verbose) {

  public BuildConfig {
    input = Objects.requireNonNull(input, "input").toAbsolutePath().normalize();
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    name = Strings.sanitizeShardName("name", name);
    Numbers.requireRange("perShard", perShard, 1, Integer.MAX_VALUE);
    ConfigValues.requireThreads(threads);
  }

  /**
   * Creates a configuration from flattened {@code key=value} settings.
   *
   * @param options settings such as {@code in}, {@code out}, {@code perShard}, {@code threads}
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static BuildConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new BuildConfig(
        ConfigValues.requiredPath(options, "in"),
        ConfigValues.requiredPath(options, "out"),
        options.getOrDefault("name", ShardNaming.DEFAULT_NAME),
        ConfigValues.integer(options, "perShard", ShardAccumulator.DEFAULT_PER_SHARD, 1, Integer.MAX_VALUE),
        ConfigValues.threads(options),
        ConfigValues.flag(options, "compress", false),
        ConfigValues.flag(options, "jpeg", false),
        ConfigValues.flag(options, "allowOverwrite", false),
        ConfigValues.flag(options, "verbose", false));
  }
}
