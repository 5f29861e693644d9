package com.heatlabs.replay.infrastructure.persistence;

import java.io.IOException;

/**
 * Signals a corpus document that is well-formed JSON but not shaped like a corpus, or not JSON at all.
 *
 * @since 0.1.0
 */
public final class CorpusFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public CorpusFormatException(String message) {
    super(message);
  }

  public CorpusFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
