package com.heatlabs.replay.domain.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.domain.json.JsonValue.JsonArray;
import com.heatlabs.replay.domain.json.JsonValue.JsonNumber;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonCodecTest {

  @Test
  void keepsMemberOrderAndNumberLiterals() {
    JsonObject object = (JsonObject) JsonCodec.parse("{\"b\": 1.50, \"a\": [true, null, \"x\"]}");

    assertEquals(List.of("b", "a"), List.copyOf(object.members().keySet()));
    assertEquals(new JsonNumber("1.50"), object.get("b").orElseThrow());
    assertEquals(3, ((JsonArray) object.get("a").orElseThrow()).elements().size());
  }

  @Test
  void pathWalksNestedObjects() {
    JsonObject object = (JsonObject) JsonCodec.parse("{\"details\": {\"m_endGameType\": \"Win\"}}");

    assertEquals("Win", object.path("details", "m_endGameType").flatMap(JsonValue::asText).orElseThrow());
    assertTrue(object.path("details", "missing").isEmpty());
  }

  @Test
  void tryParseRejectsTrailingContentAndLenientSyntax() {
    byte[] trailing = "{\"a\": 1} x".getBytes(StandardCharsets.UTF_8);
    byte[] singleQuotes = "{'a': 1}".getBytes(StandardCharsets.UTF_8);

    assertTrue(JsonCodec.tryParse(trailing, 0, trailing.length).isEmpty());
    assertTrue(JsonCodec.tryParse(singleQuotes, 0, singleQuotes.length).isEmpty());
  }

  @Test
  void acceptsNonFiniteNumbersAndWritesThemBack() {
    byte[] buffer = "{\"ratio\": NaN, \"hi\": Infinity, \"lo\": -Infinity}".getBytes(StandardCharsets.UTF_8);

    JsonObject object = (JsonObject) JsonCodec.tryParse(buffer, 0, buffer.length).orElseThrow();

    assertEquals(new JsonNumber("NaN"), object.get("ratio").orElseThrow());
    assertEquals(new JsonNumber("Infinity"), object.get("hi").orElseThrow());
    assertEquals(new JsonNumber("-Infinity"), object.get("lo").orElseThrow());
    assertFalse(((JsonNumber) object.get("ratio").orElseThrow()).isFinite());
    assertThrows(ArithmeticException.class, () -> new JsonNumber("NaN").decimalValue());
    assertEquals(object, JsonCodec.parse(JsonCodec.toPrettyString(object)));
  }

  @Test
  void tryParseHonoursRange() {
    byte[] buffer = "xx{\"a\": 1}yy".getBytes(StandardCharsets.UTF_8);

    assertEquals(JsonCodec.parse("{\"a\":1}"), JsonCodec.tryParse(buffer, 2, 8).orElseThrow());
  }

  @Test
  void parseRejectsMalformedText() {
    assertThrows(IllegalArgumentException.class, () -> JsonCodec.parse("{\"a\": }"));
  }

  @Test
  void prettyStringParsesBackToSameTree() {
    JsonValue value = JsonCodec.parse("{\"name\": \"Amy#222\", \"stats\": {\"kills\": 12, \"ratio\": 0.75}}");

    assertEquals(value, JsonCodec.parse(JsonCodec.toPrettyString(value)));
  }
}
