package com.heatlabs.replay.config;

import com.heatlabs.replay.infrastructure.exec.ExecutorFactories;
import com.heatlabs.replay.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Validated settings for {@code replay scan}.
 * <p><strong>Why:</strong> Gives the composition root typed values instead of raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param inputDirectory directory holding replay files
 * @param corpusFile corpus document that is created or extended
 * @param extension lower-case file extension with a leading dot
 * @param recursive whether subdirectories are scanned
 * @param workers extraction worker threads
 * @param queueCapacity maximum files in flight at once
 * @param flushEvery records applied between corpus rewrites
 * @param metrics metrics exporter settings
 * @since 0.1.0
 */
public record ScanConfig(
    Path inputDirectory,
    Path corpusFile,
    String extension,
    boolean recursive,
    int workers,
    int queueCapacity,
    int flushEvery,
    MetricsSettings metrics) {
  /** Corpus file written next to the working directory. */
  public static final String DEFAULT_CORPUS = "replays_output.json";
  public static final String DEFAULT_EXTENSION = ".replay";
  public static final int DEFAULT_QUEUE_CAPACITY = 64;
  public static final int DEFAULT_FLUSH_EVERY = 1;

  private static final int MAX_WORKERS = 256;
  private static final int MAX_QUEUE_CAPACITY = 65_536;
  private static final int MAX_FLUSH_EVERY = 1_000_000;

  public ScanConfig {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    Objects.requireNonNull(corpusFile, "corpusFile");
    Objects.requireNonNull(extension, "extension");
    Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a scan configuration from an effective key/value map.
   *
   * @param options merged configuration; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or out of range
   */
  public static ScanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path input = ConfigValues.parsePath("in", ConfigValues.requireString(options, "in"));
    Path corpus = ConfigValues.optionalPath(options, "corpus").orElse(Path.of(DEFAULT_CORPUS));
    String extension = Strings.requireExtension(
        "extension", ConfigValues.optionalString(options, "extension").orElse(DEFAULT_EXTENSION));
    boolean recursive = ConfigValues.parseBoolean(options, "recursive", false);
    int workers = ConfigValues.parseInt(
        options, "workers", ExecutorFactories.defaultWorkerCount(), 1, MAX_WORKERS);
    int queueCapacity = ConfigValues.parseInt(
        options, "queueCapacity", DEFAULT_QUEUE_CAPACITY, 1, MAX_QUEUE_CAPACITY);
    int flushEvery = ConfigValues.parseInt(
        options, "flushEvery", DEFAULT_FLUSH_EVERY, 1, MAX_FLUSH_EVERY);
    return new ScanConfig(
        input,
        corpus,
        extension,
        recursive,
        workers,
        queueCapacity,
        flushEvery,
        MetricsSettings.fromMap(options));
  }
}
