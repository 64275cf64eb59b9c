package ca.gc.cra.terf.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code extract} command, which turns frame files back into image files plus an
 * {@code info.csv} metadata table.
 *
 * @param input a frame file or a directory of frame files
 * @param outputDirectory directory receiving the images and {@code info.csv}
 * @param threads number of file readers
 * @param compressed the input files are zlib streams
 * @param allowOverwrite extract into a populated output directory
 * @param verbose log per-file progress at INFO instead of DEBUG
 * @since 0.1.0
 */
public record ExtractConfig(
    Path input, Path outputDirectory, int threads, boolean compressed, boolean allowOverwrite, boolean verbose) {

  public ExtractConfig {
    input = Objects.requireNonNull(input, "input").toAbsolutePath().normalize();
    outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
    ConfigValues.requireThreads(threads);
  }

  /**
   * Creates a configuration from flattened {@code key=value} settings.
   *
   * @param options settings such as {@code in}, {@code out}, {@code threads}, {@code compress}
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new ExtractConfig(
        ConfigValues.requiredPath(options, "in"),
        ConfigValues.requiredPath(options, "out"),
        ConfigValues.threads(options),
        ConfigValues.flag(options, "compress", false),
        ConfigValues.flag(options, "allowOverwrite", false),
        ConfigValues.flag(options, "verbose", false));
  }
}
