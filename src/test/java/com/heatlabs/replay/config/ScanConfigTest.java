package com.heatlabs.replay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScanConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    ScanConfig config = ScanConfig.fromMap(Map.of("in", "./replays"));

    assertEquals(Path.of("./replays"), config.inputDirectory());
    assertEquals(Path.of("replays_output.json"), config.corpusFile());
    assertEquals(".replay", config.extension());
    assertFalse(config.recursive());
    assertEquals(64, config.queueCapacity());
    assertEquals(1, config.flushEvery());
    assertTrue(config.workers() >= 1);
    assertFalse(config.metrics().enabled());
  }

  @Test
  void fromMapParsesOverrides() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("scan"));
    options.put("in", "/data/replays");
    options.put("corpus", "/data/corpus.json");
    options.put("extension", "REP");
    options.put("recursive", "TRUE");
    options.put("workers", "3");
    options.put("queueCapacity", "9");
    options.put("flushEvery", "25");
    options.put("metricsExporter", "otlp");
    options.put("otelEndpoint", "https://collector:4317");

    ScanConfig config = ScanConfig.fromMap(options);

    assertEquals(".rep", config.extension());
    assertTrue(config.recursive());
    assertEquals(3, config.workers());
    assertEquals(9, config.queueCapacity());
    assertEquals(25, config.flushEvery());
    assertTrue(config.metrics().enabled());
    assertEquals("https://collector:4317", config.metrics().endpoint());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of()));
    assertThrows(
        IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of("in", "x", "workers", "0")));
    assertThrows(
        IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of("in", "x", "workers", "four")));
    assertThrows(
        IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of("in", "x", "recursive", "yes")));
    assertThrows(
        IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of("in", "x", "extension", "a/b")));
    assertThrows(
        IllegalArgumentException.class,
        () -> ScanConfig.fromMap(Map.of("in", "x", "metricsExporter", "otlp", "otelEndpoint", "ftp://h")));
  }
}
