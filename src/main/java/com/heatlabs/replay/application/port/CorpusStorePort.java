package com.heatlabs.replay.application.port;

import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MatchRecord;
import java.io.IOException;

/**
 * <strong>What:</strong> Port persisting match records into the aggregated corpus document.
 * <p><strong>Why:</strong> Batch runs must survive interruption; every flushed state of the document is a
 * complete, valid corpus.</p>
 * <p><strong>Role:</strong> Implemented by {@code JsonCorpusStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record the size of the discovered input set.</li>
 *   <li>Insert or replace one record per filename.</li>
 *   <li>Keep {@code processed_files} equal to the number of records.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single writer; the pipeline calls the store from one thread.</p>
 *
 * @since 0.1.0
 */
public interface CorpusStorePort extends AutoCloseable {
  /**
   * Sets {@code total_files} for the current batch run.
   *
   * @param totalFiles number of discovered inputs; must be {@code >= 0}
   * @throws IOException if the corpus cannot be loaded or written
   */
  void initialize(int totalFiles) throws IOException;

  /**
   * Inserts or replaces the record stored under {@code record.fileName()}.
   *
   * @param record record to store
   * @throws IOException if the corpus cannot be written
   */
  void update(MatchRecord record) throws IOException;

  /**
   * Writes pending updates to durable storage.
   *
   * @throws IOException if the write fails; the previous on-disk corpus is left intact
   */
  void flush() throws IOException;

  /**
   * Returns the corpus as the store currently sees it, including unflushed updates.
   *
   * @return current corpus
   * @throws IOException if the corpus has to be loaded and cannot be
   */
  Corpus snapshot() throws IOException;

  /**
   * Flushes pending updates and releases the store.
   *
   * @throws IOException if the final flush fails
   */
  @Override
  void close() throws IOException;
}
