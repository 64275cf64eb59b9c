package ca.gc.cra.terf.api;

import ca.gc.cra.terf.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * terf CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: terf <build|extract|summary> [options]";
  private static final String HELP_TEXT = """
      terf: sharded image datasets in length-delimited, checksummed frame files

      Usage:
        terf <command> [options]

      Commands:
        build     Shard a metadata table and its images (build --help for details)
        extract   Write dataset images and an info.csv table
        summary   Print record counts by label, source, format and colorspace

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = commandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(Arrays.asList(safeArgs).subList(0, commandIndex));
    delegate.addAll(Arrays.asList(safeArgs).subList(commandIndex + 1, safeArgs.length));
    String[] delegateArgs = delegate.toArray(String[]::new);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    return switch (command) {
      case "build" -> BuildCli.run(delegateArgs);
      case "extract" -> ExtractCli.run(delegateArgs);
      case "summary" -> SummaryCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int commandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
