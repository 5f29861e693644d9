/**
 * Metrics adapters: OpenTelemetry SDK with an OTLP exporter, and a no-op fallback.
 *
 * @since 0.1.0
 */
package com.heatlabs.replay.infrastructure.metrics;
