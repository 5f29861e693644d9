package com.heatlabs.replay.domain.replay;

import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import java.util.Objects;

/**
 * Structured object recovered from a byte range of a replay file.
 *
 * @param startOffset index of the opening brace
 * @param endOffset index of the closing brace (inclusive)
 * @param value decoded object
 * @since 0.1.0
 */
public record Segment(int startOffset, int endOffset, JsonObject value) {
  public Segment {
    Objects.requireNonNull(value, "value");
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException(
          "invalid segment range " + startOffset + ".." + endOffset);
    }
  }

  /**
   * Returns the number of bytes covered by this segment.
   *
   * @return inclusive span length
   */
  public int length() {
    return endOffset - startOffset + 1;
  }
}
