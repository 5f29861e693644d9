package com.heatlabs.replay.config;

import com.heatlabs.replay.application.stats.AnalyzerSettings;
import com.heatlabs.replay.domain.scan.PrintableStringExtractor;
import com.heatlabs.replay.infrastructure.exec.ExecutorFactories;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each {@code replay} command.
 *
 * <p>The defaults are the single source of truth for keys that YAML files and CLI arguments may
 * override.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (scan, report, inspect)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "scan" -> buildScanDefaults();
      case "report" -> buildReportDefaults();
      case "inspect" -> buildInspectDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildScanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("corpus", ScanConfig.DEFAULT_CORPUS);
    map.put("extension", ScanConfig.DEFAULT_EXTENSION);
    map.put("recursive", "false");
    map.put("workers", Integer.toString(ExecutorFactories.defaultWorkerCount()));
    map.put("queueCapacity", Integer.toString(ScanConfig.DEFAULT_QUEUE_CAPACITY));
    map.put("flushEvery", Integer.toString(ScanConfig.DEFAULT_FLUSH_EVERY));
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildReportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("corpus", ScanConfig.DEFAULT_CORPUS);
    map.put("format", ReportFormat.TEXT.name().toLowerCase(Locale.ROOT));
    map.put("out", "");
    map.put("topPlayers", Integer.toString(AnalyzerSettings.DEFAULT_TOP_ACTIVE));
    map.put("topWinRate", Integer.toString(AnalyzerSettings.DEFAULT_TOP_WIN_RATE));
    map.put("topPartnerships", Integer.toString(AnalyzerSettings.DEFAULT_TOP_PARTNERSHIPS));
    map.put("minQualifyingMatches", Integer.toString(AnalyzerSettings.DEFAULT_MIN_QUALIFYING));
    return map;
  }

  private static Map<String, String> buildInspectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("file", "");
    map.put("strings", "false");
    map.put("minStringLength", Integer.toString(PrintableStringExtractor.DEFAULT_MIN_LENGTH));
    map.put("zlib", "true");
    map.put("out", "");
    return map;
  }
}
