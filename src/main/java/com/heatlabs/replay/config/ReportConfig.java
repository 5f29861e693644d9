package com.heatlabs.replay.config;

import com.heatlabs.replay.application.stats.AnalyzerSettings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated settings for {@code replay report}.
 *
 * @param corpusFile corpus document to analyze
 * @param format output format
 * @param outputFile destination file; empty writes to stdout
 * @param analyzer leaderboard sizes and thresholds
 * @param metrics metrics exporter settings
 * @since 0.1.0
 */
public record ReportConfig(
    Path corpusFile,
    ReportFormat format,
    Optional<Path> outputFile,
    AnalyzerSettings analyzer,
    MetricsSettings metrics) {
  private static final int MAX_LEADERBOARD = 10_000;

  public ReportConfig {
    Objects.requireNonNull(corpusFile, "corpusFile");
    Objects.requireNonNull(format, "format");
    outputFile = Objects.requireNonNullElse(outputFile, Optional.empty());
    Objects.requireNonNull(analyzer, "analyzer");
    Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds a report configuration from an effective key/value map.
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  public static ReportConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path corpus = ConfigValues.optionalPath(options, "corpus").orElse(Path.of(ScanConfig.DEFAULT_CORPUS));
    ReportFormat format = ReportFormat.parse(options.get("format"));
    Optional<Path> out = ConfigValues.optionalPath(options, "out");
    AnalyzerSettings analyzer = new AnalyzerSettings(
        ConfigValues.parseInt(
            options, "topPlayers", AnalyzerSettings.DEFAULT_TOP_ACTIVE, 1, MAX_LEADERBOARD),
        ConfigValues.parseInt(
            options, "topWinRate", AnalyzerSettings.DEFAULT_TOP_WIN_RATE, 1, MAX_LEADERBOARD),
        ConfigValues.parseInt(
            options, "topPartnerships", AnalyzerSettings.DEFAULT_TOP_PARTNERSHIPS, 1, MAX_LEADERBOARD),
        ConfigValues.parseInt(
            options,
            "minQualifyingMatches",
            AnalyzerSettings.DEFAULT_MIN_QUALIFYING,
            1,
            Integer.MAX_VALUE));
    return new ReportConfig(corpus, format, out, analyzer, MetricsSettings.fromMap(options));
  }
}
