package com.heatlabs.replay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void scanDefaultsIncludeCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("scan");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("replays_output.json", defaults.get("corpus"));
    assertEquals(".replay", defaults.get("extension"));
    assertEquals("1", defaults.get("flushEvery"));
    assertTrue(Integer.parseInt(defaults.get("workers")) >= 1);
    assertFalse(defaults.containsKey("format"));
  }

  @Test
  void reportDefaultsMatchAnalyzerSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Report ");

    assertEquals("text", defaults.get("format"));
    assertEquals("10", defaults.get("topPlayers"));
    assertEquals("5", defaults.get("topWinRate"));
    assertEquals("10", defaults.get("topPartnerships"));
    assertEquals("2", defaults.get("minQualifyingMatches"));
  }

  @Test
  void inspectDefaultsEnableZlibOnly() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("inspect");

    assertEquals("true", defaults.get("zlib"));
    assertEquals("false", defaults.get("strings"));
    assertEquals("4", defaults.get("minStringLength"));
  }

  @Test
  void unknownModeThrows() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("replay"));
  }

  @Test
  void defaultsAreUnmodifiable() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("scan");

    assertThrows(UnsupportedOperationException.class, () -> defaults.put("in", "x"));
  }
}
