package com.heatlabs.replay.application.port;

import com.heatlabs.replay.domain.replay.Corpus;
import java.io.IOException;

/**
 * Read-only access to a corpus snapshot for reporting.
 *
 * @since 0.1.0
 */
public interface CorpusSource {
  /**
   * Loads the corpus.
   *
   * @return corpus snapshot
   * @throws IOException if the corpus is missing, unreadable or malformed
   */
  Corpus load() throws IOException;
}
