package com.heatlabs.replay.infrastructure.metrics;

import com.heatlabs.replay.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards scan counters and observations to OpenTelemetry.
 *
 * <p>Instruments are created lazily per key and cached. Each data point carries the original key as the
 * {@code replay.metric.key} attribute in case the instrument name had to be sanitized. Closing the adapter
 * flushes and shuts down the provider so a short CLI run still exports its data.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("replay.metric.key");
  private static final String FALLBACK_METRIC_NAME = "replay.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /**
   * Creates an adapter exporting over OTLP gRPC.
   *
   * @param endpoint collector endpoint
   * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be blank
   * @return started adapter; close it to flush
   */
  public static OpenTelemetryMetricsAdapter otlp(String endpoint, String resourceAttributes) {
    return new OpenTelemetryMetricsAdapter(
        OpenTelemetryBootstrap.startOtlp(endpoint, resourceAttributes));
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.counter().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.histogram().record(value, histogram.attributes());
  }

  void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.forceFlush();
    handle.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = handle.meter()
        .counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Replay analyzer counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = handle.meter()
        .histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("Replay analyzer observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
