package com.heatlabs.replay.config;

import java.util.Locale;

/** Output format of {@code replay report}. */
public enum ReportFormat {
  TEXT,
  JSON;

  /**
   * Parses a case-insensitive format name.
   *
   * @param value raw value
   * @return matching format
   * @throws IllegalArgumentException if the value names no format
   */
  public static ReportFormat parse(String value) {
    if (value == null || value.isBlank()) {
      return TEXT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("format must be text or json (was " + value + ")", ex);
    }
  }
}
