package com.heatlabs.replay.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one {@link CorpusBuildUseCase} run.
 *
 * @param discovered inputs found by the replay source
 * @param extracted inputs read and scanned successfully
 * @param missing inputs that vanished before they could be read
 * @param failed inputs that could not be read or scanned for another reason
 * @param corpusRecords records in the corpus after the run
 * @param elapsed wall-clock duration of the run
 * @since 0.1.0
 */
public record BuildSummary(
    int discovered, int extracted, int missing, int failed, int corpusRecords, Duration elapsed) {
  public BuildSummary {
    Objects.requireNonNull(elapsed, "elapsed");
  }

  public int processed() {
    return extracted + missing + failed;
  }
}
