package ca.gc.cra.terf.api;

import ca.gc.cra.terf.config.ConfigMerger;
import ca.gc.cra.terf.config.DefaultsForMode;
import ca.gc.cra.terf.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Steps shared by the build, extract and summary CLIs: layering configuration sources and mapping
 * use case failures to exit codes.
 */
final class CliSupport {

  /** Body of a command once its configuration has been validated. */
  @FunctionalInterface
  interface Job {
    void run() throws Exception;
  }

  private CliSupport() {
    // Utility class
  }

  /**
   * Merges defaults, the optional {@code config=FILE} YAML and {@code args}, then moves the telemetry
   * settings into system properties.
   *
   * @param mode command name
   * @param args parsed {@code key=value} arguments; {@code config} is consumed
   * @param log logger receiving CLI-over-YAML override warnings
   * @return mutable effective configuration without telemetry keys
   * @throws IllegalArgumentException if the YAML file is missing or malformed, or a value is invalid
   * @throws IOException if the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> args, Logger log)
      throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(args);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} setting(s) for {} from {}", yamlConfig.map(Map::size).orElse(0), mode, yamlPath);
    }

    Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        mode, yamlConfig, args, DefaultsForMode.asFlatMap(mode), log::warn));
    TelemetryConfigurator.configureMetrics(effective);
    return effective;
  }

  /**
   * Runs {@code job} and translates its outcome into an exit code, logging failures.
   *
   * @param command command name used in log messages
   * @param input the command's input, used in log messages
   * @param log the CLI's logger
   * @param job validated work
   * @return exit code capturing the outcome
   */
  static ExitCode execute(String command, Path input, Logger log, Job job) {
    try {
      job.run();
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", command, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure while processing {}: {}", command, input, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", command, ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in {}", command, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
