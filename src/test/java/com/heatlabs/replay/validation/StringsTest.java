package com.heatlabs.replay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
  }

  @Test
  void requireExtensionAddsDotAndLowercases() {
    assertEquals(".replay", Strings.requireExtension("extension", "REPLAY"));
    assertEquals(".wotreplay", Strings.requireExtension("extension", ".WotReplay"));
  }

  @Test
  void requireExtensionRejectsSeparatorsAndBareDot() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("extension", "."));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("extension", ".a b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireExtension("extension", "..\\x"));
  }
}
