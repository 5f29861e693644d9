package com.heatlabs.replay.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.json.JsonValue;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import com.heatlabs.replay.domain.replay.BuildInfo;
import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MapInfo;
import com.heatlabs.replay.domain.replay.MatchRecord;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CorpusJsonCodecTest {
  private final CorpusJsonCodec codec = new CorpusJsonCodec();

  @Test
  void writesDocumentLayout() throws Exception {
    MatchRecord match = new MatchRecord(
        "1_harbor_assault_2024_03_01_x.replay",
        List.of(JsonCodec.parse("{\"details\":{\"m_endGameType\":\"Win\"}}")),
        new BuildInfo(Optional.of("build-9"), Optional.empty()),
        List.of("Bob#222", "Amy#111"),
        Optional.of(new MapInfo("harbor", "assault")),
        Optional.empty());
    Corpus corpus = Corpus.empty()
        .withTotalFiles(3)
        .withRecord(match)
        .withRecord(MatchRecord.failed("gone.replay", MatchRecord.FILE_NOT_FOUND));

    JsonObject root = (JsonObject) JsonCodec.parse(write(corpus));

    assertEquals(List.of("total_files", "processed_files", "results"), List.copyOf(root.members().keySet()));
    assertEquals("2", ((JsonValue.JsonNumber) root.get("processed_files").orElseThrow()).literal());
    JsonObject record = root.path("results", match.fileName()).flatMap(JsonValue::asObject).orElseThrow();
    assertEquals(Optional.of("build-9"), record.path("game_version", "build").flatMap(JsonValue::asText));
    assertTrue(record.path("game_version", "branch").orElseThrow() instanceof JsonValue.JsonNull);
    assertEquals(Optional.of("harbor"), record.path("map_info", "map").flatMap(JsonValue::asText));
    JsonObject failed = root.path("results", "gone.replay").flatMap(JsonValue::asObject).orElseThrow();
    assertEquals(List.of("error"), List.copyOf(failed.members().keySet()));
  }

  @Test
  void readsBackWhatItWrites() throws Exception {
    Corpus corpus = Corpus.empty()
        .withTotalFiles(2)
        .withRecord(MatchRecord.extracted(
            "a.replay",
            List.of(),
            new BuildInfo(Optional.of("b"), Optional.of("main")),
            List.of("Amy#111")))
        .withRecord(MatchRecord.failed("b.replay", "Unreadable file: denied"));

    assertEquals(corpus, read(write(corpus)));
  }

  @Test
  void recomputesProcessedFilesAndToleratesMissingMembers() throws Exception {
    String json = "{\"total_files\": 4, \"processed_files\": 99, \"results\": {"
        + "\"a.replay\": {\"players\": [\"Amy#111\", 7, \"Amy#111\"]},"
        + "\"b.replay\": {\"map_info\": {\"map\": \"harbor\"}},"
        + "\"c.replay\": []}}";

    Corpus corpus = read(json);

    assertEquals(4, corpus.totalFiles());
    assertEquals(3, corpus.processedFiles());
    assertEquals(List.of("Amy#111"), corpus.results().get("a.replay").players());
    assertEquals(Optional.empty(), corpus.results().get("b.replay").mapInfo());
    assertTrue(corpus.results().get("c.replay").isFailed());
  }

  @Test
  void missingSkeletonMembersDefaultToEmpty() throws Exception {
    Corpus corpus = read("{}");

    assertEquals(0, corpus.totalFiles());
    assertEquals(0, corpus.processedFiles());
  }

  @Test
  void rejectsDocumentsThatAreNotCorpora() {
    assertThrows(CorpusFormatException.class, () -> read("not json"));
    assertThrows(CorpusFormatException.class, () -> read("[1, 2]"));
    assertThrows(CorpusFormatException.class, () -> read("{\"results\": []}"));
    assertThrows(CorpusFormatException.class, () -> read("{\"total_files\": \"5\"}"));
    assertThrows(CorpusFormatException.class, () -> read("{\"total_files\": 1.5}"));
    assertThrows(CorpusFormatException.class, () -> read("{\"total_files\": -1}"));
    assertThrows(CorpusFormatException.class, () -> read("{\"total_files\": NaN}"));
    assertThrows(CorpusFormatException.class, () -> read("{} {}"));
  }

  @Test
  void nonFiniteNumbersInDetailsSurviveRewrite() throws Exception {
    MatchRecord match = new MatchRecord(
        "a.replay",
        List.of(JsonCodec.parse("{\"kd\": NaN, \"best\": Infinity}")),
        BuildInfo.empty(),
        List.of(),
        Optional.empty(),
        Optional.empty());
    Corpus corpus = Corpus.empty().withTotalFiles(1).withRecord(match);

    Corpus reread = read(write(corpus));

    assertEquals(match.matchDetails(), reread.results().get("a.replay").matchDetails());
  }

  private String write(Corpus corpus) throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(corpus, out);
    return out.toString(StandardCharsets.UTF_8);
  }

  private Corpus read(String json) throws Exception {
    return codec.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }
}
