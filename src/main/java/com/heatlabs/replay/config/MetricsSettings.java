package com.heatlabs.replay.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Metrics exporter selection shared by every command.
 *
 * @param exporter selected exporter
 * @param endpoint OTLP endpoint used when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes, possibly empty
 * @since 0.1.0
 */
public record MetricsSettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Endpoint of a local collector. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /** Supported exporters. */
  public enum Exporter {
    OTLP,
    NONE
  }

  public MetricsSettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(resourceAttributes, "resourceAttributes");
  }

  /**
   * Reads {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param options effective configuration
   * @return validated settings
   * @throws IllegalArgumentException if a value is invalid
   */
  public static MetricsSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String rawExporter = ConfigValues.optionalString(options, "metricsExporter").orElse("none");
    Exporter exporter = switch (rawExporter.toLowerCase(Locale.ROOT)) {
      case "otlp" -> Exporter.OTLP;
      case "none" -> Exporter.NONE;
      default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    };
    String endpoint = ConfigValues.optionalString(options, "otelEndpoint").orElse(DEFAULT_ENDPOINT);
    validateEndpoint(endpoint);
    String attributes = ConfigValues.optionalString(options, "otelResourceAttributes").orElse("");
    if (attributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
      throw new IllegalArgumentException(
          "otelResourceAttributes must be at most " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
    }
    return new MetricsSettings(exporter, endpoint, attributes);
  }

  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  public boolean enabled() {
    return exporter == Exporter.OTLP;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
