package com.heatlabs.replay.domain.scan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists runs of printable ASCII ({@code 0x20..0x7E}) found in a byte buffer, the way {@code strings(1)}
 * does.
 *
 * @since 0.1.0
 */
public final class PrintableStringExtractor {
  /** Default shortest run that is reported. */
  public static final int DEFAULT_MIN_LENGTH = 4;

  private final int minLength;

  public PrintableStringExtractor() {
    this(DEFAULT_MIN_LENGTH);
  }

  public PrintableStringExtractor(int minLength) {
    if (minLength < 1) {
      throw new IllegalArgumentException("minLength must be >= 1 (was " + minLength + ")");
    }
    this.minLength = minLength;
  }

  public int minLength() {
    return minLength;
  }

  /**
   * Extracts printable runs in buffer order.
   *
   * @param buffer raw bytes
   * @return runs of at least {@link #minLength()} printable bytes
   */
  public List<String> extract(byte[] buffer) {
    Objects.requireNonNull(buffer, "buffer");
    List<String> out = new ArrayList<>();
    int runStart = -1;
    for (int i = 0; i <= buffer.length; i++) {
      boolean printable = i < buffer.length && isPrintable(buffer[i]);
      if (printable) {
        if (runStart < 0) {
          runStart = i;
        }
        continue;
      }
      if (runStart >= 0 && i - runStart >= minLength) {
        out.add(new String(buffer, runStart, i - runStart, StandardCharsets.US_ASCII));
      }
      runStart = -1;
    }
    return out;
  }

  private static boolean isPrintable(byte b) {
    return b >= 0x20 && b <= 0x7E;
  }
}
