package com.heatlabs.replay.application.port;

import com.heatlabs.replay.domain.replay.MatchRecord;

/**
 * <strong>What:</strong> Port turning the bytes of one replay into a {@link MatchRecord}.
 * <p><strong>Why:</strong> Keeps the batch pipeline independent of the heuristic used to read the container.</p>
 * <p><strong>Role:</strong> Implemented by {@code HeuristicReplayExtractor}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe; the pipeline calls
 * them from every worker.</p>
 *
 * @since 0.1.0
 */
public interface ReplayExtractor {
  /**
   * Extracts everything recoverable from one replay.
   *
   * @param fileName base filename used as the corpus key
   * @param content complete file content; must not be modified
   * @return populated record; never {@code null}
   */
  MatchRecord extract(String fileName, byte[] content);
}
