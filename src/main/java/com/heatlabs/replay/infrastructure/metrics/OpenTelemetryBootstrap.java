package com.heatlabs.replay.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a CLI run.
 *
 * <p>Runs are short, so the periodic reader interval is kept low and the provider is flushed on close.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "com.heatlabs.replay";
  private static final String SERVICE = "replay-analyzer";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Starts a provider exporting over OTLP gRPC.
   *
   * @param endpoint collector endpoint, e.g. {@code http://localhost:4317}
   * @param resourceAttributes comma separated {@code key=value} pairs added to the resource
   * @return started provider handle
   */
  static MeterHandle startOtlp(String endpoint, String resourceAttributes) {
    OtlpGrpcMetricExporter exporter =
        OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
    MetricReader reader =
        PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
    MeterHandle handle = start(reader, parseResourceAttributes(resourceAttributes));
    log.info("OpenTelemetry metrics exporting to {}", endpoint);
    return handle;
  }

  static MeterHandle forTesting(MetricReader reader) {
    return start(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle start(MetricReader reader, Attributes extra) {
    String version = detectServiceVersion();
    AttributesBuilder base = Attributes.builder()
        .put(SERVICE_NAME, SERVICE)
        .put(SERVICE_VERSION, version);
    Resource resource = Resource.getDefault()
        .merge(Resource.create(base.build()))
        .merge(Resource.create(extra));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new MeterHandle(provider, meter);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute entry: {}", trimmed);
        continue;
      }
      builder.put(
          AttributeKey.stringKey(trimmed.substring(0, idx).trim()),
          trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    return "0.0.0-dev";
  }

  /** Started provider plus the meter the adapter records into. */
  static final class MeterHandle implements AutoCloseable {
    private final SdkMeterProvider provider;
    private final Meter meter;

    private MeterHandle(SdkMeterProvider provider, Meter meter) {
      this.provider = provider;
      this.meter = meter;
    }

    Meter meter() {
      return meter;
    }

    void forceFlush() {
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
