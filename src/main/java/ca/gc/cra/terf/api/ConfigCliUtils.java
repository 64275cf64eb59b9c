package ca.gc.cra.terf.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Records a boolean {@code --flag} as {@code key=true} unless the same key was given explicitly.
   */
  static void applyFlag(CliInput input, String flag, Map<String, String> args, String key) {
    if (input.hasFlag(flag)) {
      args.putIfAbsent(key, "true");
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
