package ca.gc.cra.terf.api;

import ca.gc.cra.terf.config.CompositionRoot;
import ca.gc.cra.terf.config.SummaryConfig;
import ca.gc.cra.terf.domain.dataset.DatasetStats;
import ca.gc.cra.terf.logging.LoggingConfigurator;
import ca.gc.cra.terf.validation.Paths;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for printing record counts of a dataset by label, source, format and colorspace.
 *
 * @since 0.1.0
 */
public final class SummaryCli {
  private static final Logger log = LoggerFactory.getLogger(SummaryCli.class);
  private static final Set<String> FLAGS = Set.of("--compress");
  private static final String SUMMARY_USAGE =
      "usage: summary in=FILE|DIR [threads=N] [compress=true|--compress] "
          + "[config=FILE] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      terf summary: count dataset records

      Usage:
        summary in=./shards [options]

      Required:
        in=FILE|DIR              One frame file or a directory of frame files

      Optional:
        threads=N                Files read in parallel (default: available processors)
        compress=true|--compress Input files are zlib streams
        config=FILE              YAML file with common/summary sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose                Log per-file progress and DEBUG output
        --help                   Show this message

      The report is printed to stdout; logs go to stderr.
      """;

  private SummaryCli() {}

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
   * Executes the summary CLI and returns its exit code without terminating the JVM.
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

    SummaryConfig config;
    try {
      config = SummaryConfig.fromMap(CliSupport.effectiveConfig("summary", kv, log));
      Paths.requireReadableInput("in", config.input());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid summary arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    return CliSupport.execute("summary", config.input(), log, () -> {
      try (CompositionRoot root = new CompositionRoot()) {
        DatasetStats stats = root.summaryUseCase(config).run();
        CliPrinter.printLines(stats.reportLines());
      }
    });
  }
}
