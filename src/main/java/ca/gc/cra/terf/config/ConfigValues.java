package ca.gc.cra.terf.config;

import ca.gc.cra.terf.validation.Numbers;
import ca.gc.cra.terf.validation.Paths;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Typed lookups over flattened {@code key=value} configuration maps.
 */
final class ConfigValues {
  /** Upper bound for {@code threads}. */
  static final int MAX_THREADS = 1024;

  private ConfigValues() {}

  static Path requiredPath(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Paths.parse(key, raw);
  }

  static boolean flag(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
  }

  static int integer(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  static int threads(Map<String, String> options) {
    return integer(options, "threads", defaultThreads(), 1, MAX_THREADS);
  }

  static int defaultThreads() {
    return Math.min(MAX_THREADS, Runtime.getRuntime().availableProcessors());
  }

  static void requireThreads(int threads) {
    Numbers.requireRange("threads", threads, 1, MAX_THREADS);
  }
}
