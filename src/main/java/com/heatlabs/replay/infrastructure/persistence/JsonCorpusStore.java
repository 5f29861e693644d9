package com.heatlabs.replay.infrastructure.persistence;

import com.heatlabs.replay.application.port.CorpusStorePort;
import com.heatlabs.replay.application.port.MetricsPort;
import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MatchRecord;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CorpusStorePort} backed by a single JSON corpus file.
 * <p><strong>Why:</strong> Keeps one crash-safe document that later runs extend incrementally.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the current document lazily, recovering from a missing or corrupt file with an empty corpus.</li>
 *   <li>Apply each record as a delta on the in-memory document.</li>
 *   <li>Rewrite the whole document atomically every {@code flushEvery} updates.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; drive from one writer thread.</p>
 * <p><strong>Observability:</strong> Emits {@code corpus.flush} and {@code corpus.recovered}; recovery is
 * logged at WARN and reported to the warning sink supplied by the caller.</p>
 *
 * @since 0.1.0
 */
public final class JsonCorpusStore implements CorpusStorePort {
  private static final Logger log = LoggerFactory.getLogger(JsonCorpusStore.class);

  private final JsonCorpusFile file;
  private final int flushEvery;
  private final MetricsPort metrics;
  private final Consumer<String> warnings;

  private Corpus pending;
  private int unflushed;

  /**
   * Creates a store that flushes after every update.
   *
   * @param file corpus file
   */
  public JsonCorpusStore(JsonCorpusFile file) {
    this(file, 1, MetricsPort.NO_OP, message -> {});
  }

  /**
   * Creates a store.
   *
   * @param file corpus file
   * @param flushEvery updates kept in memory before a flush; {@code 1} rewrites on every update
   * @param metrics metrics sink
   * @param warnings receives a message whenever an existing corpus had to be discarded
   */
  public JsonCorpusStore(
      JsonCorpusFile file, int flushEvery, MetricsPort metrics, Consumer<String> warnings) {
    if (flushEvery <= 0) {
      throw new IllegalArgumentException("flushEvery must be > 0 (was " + flushEvery + ")");
    }
    this.file = Objects.requireNonNull(file, "file");
    this.flushEvery = flushEvery;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.warnings = Objects.requireNonNull(warnings, "warnings");
  }

  @Override
  public void initialize(int totalFiles) throws IOException {
    if (totalFiles < 0) {
      throw new IllegalArgumentException("totalFiles must not be negative (was " + totalFiles + ")");
    }
    pending = current().withTotalFiles(totalFiles);
    unflushed++;
    flush();
  }

  @Override
  public void update(MatchRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    pending = current().withRecord(record);
    unflushed++;
    if (unflushed >= flushEvery) {
      flush();
    }
  }

  @Override
  public void flush() throws IOException {
    if (pending == null || unflushed == 0) {
      return;
    }
    file.write(pending);
    log.debug(
        "Corpus flushed to {} ({} records, {} updates)",
        file.path(),
        pending.processedFiles(),
        unflushed);
    metrics.increment("corpus.flush");
    unflushed = 0;
    // the next update reloads, so edits made to the file between flushes are not overwritten
    pending = null;
  }

  @Override
  public Corpus snapshot() throws IOException {
    return current();
  }

  @Override
  public void close() throws IOException {
    flush();
  }

  private Corpus current() {
    if (pending != null) {
      return pending;
    }
    if (!file.exists()) {
      log.info("No corpus at {}; starting a new one", file.path());
      pending = Corpus.empty();
      return pending;
    }
    try {
      pending = file.load();
    } catch (IOException ex) {
      String message = "Discarding unreadable corpus " + file.path() + ": " + ex.getMessage();
      log.warn(message, ex);
      warnings.accept(message);
      metrics.increment("corpus.recovered");
      pending = Corpus.empty();
    }
    return pending;
  }
}
