package com.heatlabs.replay.api;

import com.heatlabs.replay.config.ConfigMerger;
import com.heatlabs.replay.config.DefaultsForMode;
import com.heatlabs.replay.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
public final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes {@code config} (or {@code --config}) from the CLI map and returns its value.
   *
   * @param args mutable CLI map
   * @return YAML path, or {@code null} when none was given
   */
  public static String extractConfigPath(Map<String, String> args) {
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
   * Resolves the effective configuration of a command: embedded defaults, then the optional YAML
   * file named by {@code config=}, then the CLI arguments.
   *
   * @param mode command name
   * @param cli mutable CLI map; {@code config} is removed from it
   * @param warn receives CLI-over-YAML override notices
   * @return merged configuration
   * @throws IllegalArgumentException if the YAML file is missing or malformed, or validation fails
   * @throws IOException if the YAML file cannot be read
   */
  public static Map<String, String> effectiveConfig(
      String mode, Map<String, String> cli, Consumer<String> warn) throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(
        mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  public static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  public static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
