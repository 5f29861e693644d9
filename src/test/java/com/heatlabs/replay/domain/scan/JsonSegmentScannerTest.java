package com.heatlabs.replay.domain.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.replay.Segment;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonSegmentScannerTest {
  private final JsonSegmentScanner scanner = new JsonSegmentScanner();

  @Test
  void findsObjectBetweenJunkBytes() {
    byte[] buffer = "junk{\"a\":     1}trailing".getBytes(StandardCharsets.UTF_8);

    List<Segment> segments = scanner.scan(buffer);

    assertEquals(1, segments.size());
    Segment segment = segments.get(0);
    assertEquals(4, segment.startOffset());
    assertEquals(15, segment.endOffset());
    assertEquals(JsonCodec.parse("{\"a\": 1}"), segment.value());
  }

  @Test
  void objectWithNonFiniteNumberIsReported() {
    byte[] buffer = "\u0001{\"kd\": NaN, \"n\": 1}\u0002".getBytes(StandardCharsets.UTF_8);

    List<Segment> segments = scanner.scan(buffer);

    assertEquals(1, segments.size());
    assertEquals(1, segments.get(0).startOffset());
    assertEquals(JsonCodec.parse("{\"kd\": NaN, \"n\": 1}"), segments.get(0).value());
  }

  @Test
  void objectClosingInsideMinimumLookaheadIsNotReported() {
    byte[] buffer = "junk{\"a\":1}trailing".getBytes(StandardCharsets.UTF_8);

    assertTrue(scanner.scan(buffer).isEmpty());
  }

  @Test
  void nestedObjectsAreReportedFromEachOpeningBrace() {
    byte[] buffer = "{\"outer\": {\"inner\": 1}}".getBytes(StandardCharsets.UTF_8);

    List<Segment> segments = scanner.scan(buffer);

    assertEquals(2, segments.size());
    assertEquals(0, segments.get(0).startOffset());
    assertEquals(22, segments.get(0).endOffset());
    assertEquals(10, segments.get(1).startOffset());
    assertEquals(21, segments.get(1).endOffset());
    assertEquals(JsonCodec.parse("{\"inner\": 1}"), segments.get(1).value());
  }

  @Test
  void firstValidClosingBraceWins() {
    byte[] buffer = "xx{\"text\": \"a}b\", \"n\": 2}yy".getBytes(StandardCharsets.UTF_8);

    List<Segment> segments = scanner.scan(buffer);

    assertEquals(1, segments.size());
    assertEquals(JsonCodec.parse("{\"text\": \"a}b\", \"n\": 2}"), segments.get(0).value());
  }

  @Test
  void invalidUtf8InsideCandidateRejectsIt() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write("{\"name\": \"".getBytes(StandardCharsets.UTF_8));
    out.write(0xFF);
    out.write("abc\"}".getBytes(StandardCharsets.UTF_8));

    assertTrue(scanner.scan(out.toByteArray()).isEmpty());
  }

  @Test
  void multiByteCharactersAreAccepted() {
    byte[] buffer = "\u0001{\"name\": \"héros\"}\u0002".getBytes(StandardCharsets.UTF_8);

    List<Segment> segments = scanner.scan(buffer);

    assertEquals(1, segments.size());
    assertEquals(
        "héros",
        segments.get(0).value().get("name").flatMap(v -> v.asText()).orElseThrow());
  }

  @Test
  void objectsLongerThanWindowAreSkipped() {
    String body = "x".repeat(JsonSegmentScanner.WINDOW);
    byte[] buffer = ("{\"a\": \"" + body + "\"}").getBytes(StandardCharsets.UTF_8);

    assertTrue(scanner.scan(buffer).isEmpty());
  }

  @Test
  void scanningIsDeterministic() {
    byte[] buffer = ("\u0000\u0001{\"m_endGameType\": \"Win\"}\u0003{\"players\": [1, 2, 3]}")
        .getBytes(StandardCharsets.UTF_8);

    assertEquals(scanner.scan(buffer), scanner.scan(buffer.clone()));
    assertEquals(2, scanner.scan(buffer).size());
  }

  @Test
  void arraysAndScalarsAreIgnored() {
    byte[] buffer = "[1, 2, 3, 4, 5, 6] \"{not json at all}\"".getBytes(StandardCharsets.UTF_8);

    assertTrue(scanner.scan(buffer).isEmpty());
  }
}
