package com.heatlabs.replay.domain.scan;

import java.util.Objects;
import java.util.Optional;

/**
 * Compressed stream found inside a replay.
 *
 * @param startOffset index of the zlib header
 * @param endOffset exclusive end of the smallest reported window that holds the whole stream
 * @param inflatedSize number of bytes produced by inflating the stream
 * @param text inflated payload when it is valid UTF-8
 * @since 0.1.0
 */
public record ZlibChunk(int startOffset, int endOffset, int inflatedSize, Optional<String> text) {
  public ZlibChunk {
    if (startOffset < 0 || endOffset <= startOffset) {
      throw new IllegalArgumentException("invalid chunk range " + startOffset + ".." + endOffset);
    }
    if (inflatedSize < 0) {
      throw new IllegalArgumentException("inflatedSize must not be negative");
    }
    text = Objects.requireNonNullElse(text, Optional.empty());
  }

  public boolean isText() {
    return text.isPresent();
  }
}
