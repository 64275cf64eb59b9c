package ca.gc.cra.terf.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the {@code summary} command.
 *
 * @param input a frame file or a directory of frame files
 * @param threads number of file readers
 * @param compressed the input files are zlib streams
 * @param verbose log per-file progress at INFO instead of DEBUG
 * @since 0.1.0
 */
public record SummaryConfig(Path input, int threads, boolean compressed, boolean verbose) {

  public SummaryConfig {
    input = Objects.requireNonNull(input, "input").toAbsolutePath().normalize();
    ConfigValues.requireThreads(threads);
  }

  public static SummaryConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new SummaryConfig(
        ConfigValues.requiredPath(options, "in"),
        ConfigValues.threads(options),
        ConfigValues.flag(options, "compress", false),
        ConfigValues.flag(options, "verbose", false));
  }
}
