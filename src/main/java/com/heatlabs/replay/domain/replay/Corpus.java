package com.heatlabs.replay.domain.replay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated document holding one {@link MatchRecord} per processed replay, in insertion order.
 *
 * <p>{@link #processedFiles()} is always derived from {@link #results()}, so it can never drift from
 * the number of records.</p>
 *
 * @param totalFiles number of inputs discovered by the last batch run
 * @param results records keyed by filename, in insertion order
 * @since 0.1.0
 */
public record Corpus(int totalFiles, Map<String, MatchRecord> results) {
  private static final Corpus EMPTY = new Corpus(0, Map.of());

  public Corpus {
    if (totalFiles < 0) {
      throw new IllegalArgumentException("totalFiles must not be negative (was " + totalFiles + ")");
    }
    Objects.requireNonNull(results, "results");
    results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
  }

  public static Corpus empty() {
    return EMPTY;
  }

  public int processedFiles() {
    return results.size();
  }

  public Corpus withTotalFiles(int total) {
    return new Corpus(total, results);
  }

  /**
   * Returns a copy with {@code record} set under its filename, replacing any prior record in place.
   *
   * @param record record to store
   * @return updated corpus
   */
  public Corpus withRecord(MatchRecord record) {
    Objects.requireNonNull(record, "record");
    Map<String, MatchRecord> updated = new LinkedHashMap<>(results);
    updated.put(record.fileName(), record);
    return new Corpus(totalFiles, updated);
  }
}
