package com.heatlabs.replay.config;

import com.heatlabs.replay.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Typed accessors over flattened configuration maps. */
final class ConfigValues {

  private ConfigValues() {}

  static Optional<String> optionalString(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static String requireString(Map<String, String> options, String key) {
    return optionalString(options, key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    Optional<String> value = optionalString(options, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    String normalized = value.get().toLowerCase(Locale.ROOT);
    if (normalized.equals("true")) {
      return true;
    }
    if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value.get() + ")");
  }

  static int parseInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
    Optional<String> value = optionalString(options, key);
    if (value.isEmpty()) {
      return defaultValue;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value.get());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value.get() + ")", ex);
    }
    return Numbers.requireRange(key, parsed, min, max);
  }

  static Path parsePath(String key, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    return optionalString(options, key).map(value -> parsePath(key, value));
  }
}
