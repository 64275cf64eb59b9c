package ca.gc.cra.terf.api;

import ca.gc.cra.terf.config.CompositionRoot;
import ca.gc.cra.terf.config.ExtractConfig;
import ca.gc.cra.terf.logging.LoggingConfigurator;
import ca.gc.cra.terf.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for writing the images of a dataset back to disk with an {@code info.csv} table.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final Set<String> FLAGS = Set.of("--compress", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: extract in=FILE|DIR out=DIR [threads=N] [compress=true|--compress] [--allow-overwrite] "
          + "[config=FILE] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      terf extract: write dataset images and their metadata table

      Usage:
        extract in=./shards out=./images [options]

      Required:
        in=FILE|DIR              One frame file or a directory of frame files
        out=DIR                  Directory receiving the images and info.csv

      Optional:
        threads=N                Files read in parallel (default: available processors)
        compress=true|--compress Input files are zlib streams
        --allow-overwrite        Permit writing into a non-empty output directory
        config=FILE              YAML file with common/extract sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                Log per-file progress and DEBUG output
        --help                   Show this message

      Notes:
        A corrupt file stops the whole extraction; info.csv is only written on success.
      """;

  private ExtractCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the extract CLI and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    List<String> unknownFlags = input.unknownFlags(FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applyFlag(input, "--verbose", kv, "verbose");
    ConfigCliUtils.applyFlag(input, "--compress", kv, "compress");
    ConfigCliUtils.applyFlag(input, "--allow-overwrite", kv, "allowOverwrite");

    ExtractConfig config;
    Path output;
    try {
      config = ExtractConfig.fromMap(CliSupport.effectiveConfig("extract", kv, log));
      Paths.requireReadableInput("in", config.input());
      output = Paths.validateOutputDir(config.outputDirectory(), true, config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    log.info("Configured extract: input={}, output={}, threads={}, compressed={}",
        config.input(), output, config.threads(), config.compressed());
    return CliSupport.execute("extract", config.input(), log, () -> {
      try (CompositionRoot root = new CompositionRoot()) {
        root.extractUseCase(config).run();
      }
    });
  }
}
