package com.heatlabs.replay.application.pipeline;

import com.heatlabs.replay.application.port.CorpusStorePort;
import com.heatlabs.replay.application.port.MetricsPort;
import com.heatlabs.replay.application.port.ReplayExtractor;
import com.heatlabs.replay.application.port.ReplaySource;
import com.heatlabs.replay.domain.replay.MatchRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Batch pipeline that extracts every discovered replay into the corpus store.
 * <p><strong>Why:</strong> Reading and scanning are pure per-file work and parallelize well, while the corpus
 * document needs a single writer and a deterministic record order.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Discover inputs and record their count as {@code total_files}.</li>
 *   <li>Read and extract files on a bounded worker pool.</li>
 *   <li>Apply results on the calling thread in discovery order.</li>
 *   <li>Turn unreadable inputs into error records instead of aborting the run.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run one instance at a time. The store is only touched
 * from the thread calling {@link #run()}.</p>
 * <p><strong>Performance:</strong> At most {@code queueCapacity} files are in flight (read, scanned or
 * waiting to be applied) at any time, which bounds memory to that many file buffers.</p>
 * <p><strong>Observability:</strong> Emits {@code scan.file.processed}, {@code scan.file.missing},
 * {@code scan.file.failed}, {@code scan.segments} and {@code scan.players}; sets MDC {@code replayFile} on
 * workers and logs progress roughly every tenth of the batch.</p>
 *
 * @since 0.1.0
 */
public final class CorpusBuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(CorpusBuildUseCase.class);
  static final String MDC_FILE = "replayFile";
  static final String EXTRACTION_FAILED = "Extraction failed";
  static final String UNREADABLE_FILE = "Unreadable file";

  private final ReplaySource source;
  private final ReplayExtractor extractor;
  private final CorpusStorePort store;
  private final MetricsPort metrics;
  private final IntFunction<ExecutorService> poolFactory;
  private final int workers;
  private final int queueCapacity;

  /**
   * Creates the pipeline.
   *
   * @param source replay discovery
   * @param extractor per-file extraction
   * @param store corpus store; flushed but not closed by {@link #run()}
   * @param metrics metrics sink
   * @param poolFactory builds the worker pool for a given size
   * @param workers number of extraction workers; must be positive
   * @param queueCapacity maximum files in flight; must be positive
   */
  public CorpusBuildUseCase(
      ReplaySource source,
      ReplayExtractor extractor,
      CorpusStorePort store,
      MetricsPort metrics,
      IntFunction<ExecutorService> poolFactory,
      int workers,
      int queueCapacity) {
    this.source = Objects.requireNonNull(source, "source");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.workers = workers;
    this.queueCapacity = queueCapacity;
  }

  /**
   * Processes every discovered input.
   *
   * @return run summary
   * @throws IOException if discovery fails or the corpus cannot be written
   * @throws InterruptedException if the calling thread is interrupted; pending updates are flushed first
   */
  public BuildSummary run() throws IOException, InterruptedException {
    long started = System.nanoTime();
    List<Path> inputs = source.discover();
    int total = inputs.size();
    store.initialize(total);
    log.info("Scanning {} replay files with {} workers", total, workers);

    Tally tally = new Tally();
    ExecutorService pool = poolFactory.apply(workers);
    try {
      CompletionService<Completed> completions =
          new ExecutorCompletionService<>(pool, new ArrayBlockingQueue<>(queueCapacity));
      Map<Integer, MatchRecord> reorder = new HashMap<>();
      int progressStep = Math.max(1, total / 10);
      int nextSubmit = 0;
      int nextApply = 0;
      while (nextApply < total) {
        while (nextSubmit < total && nextSubmit - nextApply < queueCapacity) {
          Path input = inputs.get(nextSubmit);
          int index = nextSubmit;
          completions.submit(() -> new Completed(index, process(input)));
          nextSubmit++;
        }
        Completed completed = await(completions);
        reorder.put(completed.index(), completed.record());
        MatchRecord next;
        while ((next = reorder.remove(nextApply)) != null) {
          store.update(next);
          tally.count(next);
          nextApply++;
          if (nextApply % progressStep == 0 || nextApply == total) {
            log.info("Progress: {}/{} files", nextApply, total);
          }
        }
      }
    } finally {
      pool.shutdownNow();
      try {
        store.flush();
      } catch (IOException ex) {
        log.error("Failed to flush corpus after scan", ex);
        throw ex;
      }
    }

    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
    BuildSummary summary = new BuildSummary(
        total,
        tally.extracted,
        tally.missing,
        tally.failed,
        store.snapshot().processedFiles(),
        elapsed);
    log.info(
        "Scan complete: {} extracted, {} missing, {} failed, {} records in corpus ({} ms)",
        summary.extracted(),
        summary.missing(),
        summary.failed(),
        summary.corpusRecords(),
        elapsed.toMillis());
    return summary;
  }

  private static Completed await(CompletionService<Completed> completions)
      throws InterruptedException {
    try {
      return completions.take().get();
    } catch (ExecutionException ex) {
      // process() converts every expected failure into an error record
      throw new IllegalStateException("Replay worker failed", ex.getCause());
    }
  }

  private MatchRecord process(Path input) {
    String fileName = input.getFileName().toString();
    String previous = MDC.get(MDC_FILE);
    MDC.put(MDC_FILE, fileName);
    try {
      byte[] content = Files.readAllBytes(input);
      MatchRecord record = extractor.extract(fileName, content);
      metrics.increment("scan.file.processed");
      metrics.observe("scan.segments", record.matchDetails().size());
      metrics.observe("scan.players", record.players().size());
      return record;
    } catch (NoSuchFileException ex) {
      log.warn("Replay file disappeared before it could be read: {}", input);
      metrics.increment("scan.file.missing");
      return MatchRecord.failed(fileName, MatchRecord.FILE_NOT_FOUND);
    } catch (IOException ex) {
      log.warn("Unable to read replay file {}", input, ex);
      metrics.increment("scan.file.failed");
      return MatchRecord.failed(fileName, UNREADABLE_FILE + ": " + describe(ex));
    } catch (RuntimeException ex) {
      log.error("Extraction failed for {}", input, ex);
      metrics.increment("scan.file.failed");
      return MatchRecord.failed(fileName, EXTRACTION_FAILED + ": " + describe(ex));
    } finally {
      if (previous == null) {
        MDC.remove(MDC_FILE);
      } else {
        MDC.put(MDC_FILE, previous);
      }
    }
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }

  private record Completed(int index, MatchRecord record) {}

  private static final class Tally {
    private int extracted;
    private int missing;
    private int failed;

    void count(MatchRecord record) {
      if (!record.isFailed()) {
        extracted++;
      } else if (MatchRecord.FILE_NOT_FOUND.equals(record.error().orElse(null))) {
        missing++;
      } else {
        failed++;
      }
    }
  }
}
