package com.heatlabs.replay.domain.replay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CorpusTest {

  @Test
  void processedFilesTracksRecordCount() {
    Corpus corpus = Corpus.empty()
        .withTotalFiles(5)
        .withRecord(record("a.replay"))
        .withRecord(record("b.replay"))
        .withRecord(record("a.replay"));

    assertEquals(5, corpus.totalFiles());
    assertEquals(2, corpus.processedFiles());
    assertEquals(List.of("a.replay", "b.replay"), List.copyOf(corpus.results().keySet()));
  }

  @Test
  void replacingRecordKeepsPosition() {
    Corpus corpus = Corpus.empty().withRecord(record("a.replay")).withRecord(record("b.replay"));

    Corpus updated = corpus.withRecord(MatchRecord.failed("a.replay", "boom"));

    assertEquals(List.of("a.replay", "b.replay"), List.copyOf(updated.results().keySet()));
    assertEquals("boom", updated.results().get("a.replay").error().orElseThrow());
  }

  @Test
  void rejectsNegativeTotal() {
    assertThrows(IllegalArgumentException.class, () -> Corpus.empty().withTotalFiles(-1));
  }

  private static MatchRecord record(String name) {
    return MatchRecord.extracted(name, List.of(), BuildInfo.empty(), Set.of());
  }
}
