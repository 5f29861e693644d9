package com.heatlabs.replay.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
  }

  @Test
  void truncateCutsOnByteBudgetWithoutSplittingCodePoints() {
    String truncated = Logs.truncate("ab\u00e9cd", 3);

    assertTrue(truncated.startsWith("ab..."), truncated);
    assertTrue(truncated.endsWith("(truncated, 3 of 6 bytes)"), truncated);
  }

  @Test
  void truncateHandlesNullAndRejectsNonPositiveBudget() {
    assertEquals("<null>", Logs.truncate(null, 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
