package com.heatlabs.replay.config;

import com.heatlabs.replay.domain.scan.PrintableStringExtractor;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for {@code replay inspect}.
 *
 * @param replayFile replay to dump
 * @param includeStrings whether printable strings are listed
 * @param minStringLength shortest printable run listed
 * @param includeZlib whether embedded zlib streams are listed
 * @param outputFile destination file; empty writes to stdout
 * @since 0.1.0
 */
public record InspectConfig(
    Path replayFile,
    boolean includeStrings,
    int minStringLength,
    boolean includeZlib,
    Optional<Path> outputFile) {
  private static final int MAX_STRING_LENGTH = 4_096;

  public InspectConfig {
    Objects.requireNonNull(replayFile, "replayFile");
    outputFile = Objects.requireNonNullElse(outputFile, Optional.empty());
  }

  /**
   * Builds an inspect configuration from an effective key/value map.
   *
   * @param options merged configuration; {@code file} is required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static InspectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new InspectConfig(
        ConfigValues.parsePath("file", ConfigValues.requireString(options, "file")),
        ConfigValues.parseBoolean(options, "strings", false),
        ConfigValues.parseInt(
            options,
            "minStringLength",
            PrintableStringExtractor.DEFAULT_MIN_LENGTH,
            1,
            MAX_STRING_LENGTH),
        ConfigValues.parseBoolean(options, "zlib", true),
        ConfigValues.optionalPath(options, "out"));
  }
}
