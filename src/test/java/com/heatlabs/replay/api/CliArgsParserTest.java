package com.heatlabs.replay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"in=./replays", " workers = 4 ", "otelResourceAttributes=a=b,c=d"});

    assertEquals("./replays", map.get("in"));
    assertEquals("4", map.get("workers"));
    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
  }

  @Test
  void laterKeysWinAndBlankTokensAreSkipped() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"format=text", "", null, "format=json"});

    assertEquals(Map.of("format", "json"), map);
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    for (String bad : List.of("replays", "=value", "key=", "bad key=1", "in=a\u0001b")) {
      assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {bad}), bad);
    }
  }
}
