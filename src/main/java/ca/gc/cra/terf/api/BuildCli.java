package ca.gc.cra.terf.api;

import ca.gc.cra.terf.application.pipeline.BuildReport;
import ca.gc.cra.terf.config.BuildConfig;
import ca.gc.cra.terf.config.CompositionRoot;
import ca.gc.cra.terf.logging.LoggingConfigurator;
import ca.gc.cra.terf.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for sharding a metadata table and its images into frame files.
 *
 * @since 0.1.0
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final Set<String> FLAGS = Set.of("--compress", "--jpeg", "--allow-overwrite", "--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: build in=FILE out=DIR [name=train] [perShard=1024] [threads=N] "
          + "[compress=true|--compress] [jpeg=true|--jpeg] [--allow-overwrite] [--dry-run] "
          + "[config=FILE] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      terf build: shard labeled images into frame files

      Usage:
        build in=./meta.csv out=./shards [options]

      Required:
        in=FILE                  Metadata table (image_path,image_id,label_id,label_text,label_raw,source)
        out=DIR                  Directory receiving {name}-{id:05d}-of-{total:05d} files

      Optional:
        name=NAME                Shard base name, [A-Za-z0-9._-] (default train)
        perShard=N               Maximum records per shard (default 1024)
        threads=N                Shard writers (default: available processors)
        compress=true|--compress Wrap every shard in a zlib stream
        jpeg=true|--jpeg         Re-encode every image as RGB JPEG
        --allow-overwrite        Permit writing into a non-empty output directory
        --dry-run                Validate inputs and print the plan without writing
        config=FILE              YAML file with common/build sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Log per-shard progress and DEBUG output
        --help                   Show this message

      Notes:
        Rows that do not parse or whose image cannot be read are logged and skipped.
        The metadata table is read twice, so it must be a regular file.
      """;

  private BuildCli() {}

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
   * Executes the build CLI and returns its exit code without terminating the JVM.
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
      log.debug("Verbose logging enabled for build CLI");
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
    ConfigCliUtils.applyFlag(input, "--jpeg", kv, "jpeg");
    ConfigCliUtils.applyFlag(input, "--allow-overwrite", kv, "allowOverwrite");
    ConfigCliUtils.applyFlag(input, "--dry-run", kv, "dryRun");

    Map<String, String> effective;
    BuildConfig config;
    try {
      effective = CliSupport.effectiveConfig("build", kv, log);
      config = BuildConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    boolean dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (Files.isDirectory(config.input())) {
      log.error("build input must be a metadata file, not a directory: {}", config.input());
      return ExitCode.CONFIG_ERROR;
    }
    Path output;
    try {
      Paths.requireReadableFile("in", config.input());
      output = Paths.validateOutputDir(config.outputDirectory(), !dryRun, config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, output);
      return ExitCode.SUCCESS;
    }

    log.info("Configured build: input={}, output={}, name={}, perShard={}, threads={}, compress={}",
        config.input(), output, config.name(), config.perShard(), config.threads(), config.compress());
    return CliSupport.execute("build", config.input(), log, () -> {
      try (CompositionRoot root = new CompositionRoot()) {
        BuildReport report = root.buildUseCase(config).run();
        if (report.rowsSkipped() > 0) {
          log.warn("Build finished with {} skipped row(s); see warnings above", report.rowsSkipped());
        }
      }
    });
  }

  private static void printDryRunPlan(BuildConfig config, Path output) {
    CliPrinter.printLines(
        "Build dry-run: no shards will be written.",
        " Metadata table    : " + config.input(),
        " Output directory  : " + output,
        " Shard name        : " + config.name() + "-NNNNN-of-NNNNN",
        " Records per shard : " + config.perShard(),
        " Threads           : " + config.threads(),
        " Compress          : " + config.compress(),
        " Re-encode as JPEG : " + config.normalizeJpeg(),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Re-run without --dry-run to build shards.");
  }
}
