package ca.gc.cra.lookout.api;

import ca.gc.cra.lookout.config.ConfigMerger;
import ca.gc.cra.lookout.config.DefaultsForMode;
import ca.gc.cra.lookout.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Resolves the effective settings of a command from defaults, an optional {@code config=} YAML file and CLI
 * arguments.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Builds the effective settings for {@code mode}.
   *
   * @param mode command name
   * @param cli parsed CLI arguments; {@code config} is removed from the map
   * @param log logger receiving override warnings
   * @return merged settings
   * @throws IOException when the YAML file is missing or unreadable
   * @throws IllegalArgumentException when YAML or merged values are invalid
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Map<String, String> yaml = Map.of();
    if (configPath != null) {
      yaml = YamlConfigLoader.load(Path.of(configPath), mode);
      log.debug("Loaded {} setting(s) for {} from {}", yaml.size(), mode, configPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn);
  }

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

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  static long parseLong(Map<String, String> map, String key, long defaultValue) {
    String value = map == null ? null : map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer but was: " + value, ex);
    }
  }
}
