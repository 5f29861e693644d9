package com.heatlabs.replay.domain.stats;

/**
 * Processing counters copied from the corpus header.
 *
 * @param totalFiles inputs discovered by the last batch run
 * @param processedFiles records stored in the corpus
 * @param matchesAnalyzed records the report was computed over
 * @since 0.1.0
 */
public record CorpusProgress(int totalFiles, int processedFiles, int matchesAnalyzed) {}
