package com.heatlabs.replay.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.json.JsonValue;
import com.heatlabs.replay.domain.json.JsonValue.JsonArray;
import com.heatlabs.replay.domain.json.JsonValue.JsonNull;
import com.heatlabs.replay.domain.json.JsonValue.JsonNumber;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import com.heatlabs.replay.domain.stats.StatisticsReport;
import java.io.StringWriter;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonReportRendererTest {
  private final JsonReportRenderer renderer = new JsonReportRenderer();

  @Test
  void rendersParseableDocumentWithSnakeCaseFields() throws Exception {
    JsonObject root = render(ReportFixtures.sampleReport());

    assertEquals(Optional.of("6"), number(root, "progress", "total_files"));
    assertEquals(Optional.of("5"), number(root, "progress", "processed_files"));
    assertEquals(Optional.of("2"), number(root, "results", "wins"));
    assertEquals(Optional.of("2"), number(root, "dates", "most_active_date_matches"));
    assertEquals(Optional.of("2024-03-01"), root.path("dates", "most_active_date").flatMap(JsonValue::asText));

    JsonArray maps = (JsonArray) root.get("maps").orElseThrow();
    assertEquals(3, maps.elements().size());
    JsonObject first = (JsonObject) maps.elements().get(0);
    assertEquals(Optional.of("harbor"), first.path("map").flatMap(JsonValue::asText));

    JsonArray pairs = (JsonArray) root.get("partnerships").orElseThrow();
    JsonObject pair = (JsonObject) pairs.elements().get(0);
    JsonArray players = (JsonArray) pair.get("players").orElseThrow();
    assertEquals(Optional.of("Amy#111"), players.elements().get(0).asText());
    assertEquals(Optional.of("Bob#222"), players.elements().get(1).asText());
  }

  @Test
  void emptyReportWritesNullDate() throws Exception {
    JsonObject root = render(ReportFixtures.emptyReport());

    assertTrue(root.path("dates", "most_active_date").orElseThrow() instanceof JsonNull);
    assertEquals(Optional.of("0"), number(root, "team_sizes", "min"));
  }

  private JsonObject render(StatisticsReport report) throws Exception {
    StringWriter out = new StringWriter();
    renderer.render(report, out);
    assertTrue(out.toString().endsWith("\n"));
    return (JsonObject) JsonCodec.parse(out.toString());
  }

  private static Optional<String> number(JsonObject root, String... path) {
    return root.path(path).map(value -> ((JsonNumber) value).literal());
  }
}
