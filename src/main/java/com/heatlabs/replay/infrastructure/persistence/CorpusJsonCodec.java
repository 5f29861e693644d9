package com.heatlabs.replay.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.heatlabs.replay.domain.json.JsonCodec;
import com.heatlabs.replay.domain.json.JsonValue;
import com.heatlabs.replay.domain.json.JsonValue.JsonArray;
import com.heatlabs.replay.domain.json.JsonValue.JsonNumber;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import com.heatlabs.replay.domain.replay.BuildInfo;
import com.heatlabs.replay.domain.replay.Corpus;
import com.heatlabs.replay.domain.replay.MapInfo;
import com.heatlabs.replay.domain.replay.MatchRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps {@link Corpus} to and from its JSON document.
 *
 * <pre>
 * {"total_files": 5, "processed_files": 3, "results": {
 *   "&lt;file&gt;": {"match_details": [...], "game_version": {"build": "..", "branch": null},
 *              "players": ["name#123"], "map_info": {"map": "..", "mode": ".."}},
 *   "&lt;failed file&gt;": {"error": "File not found"}}}
 * </pre>
 *
 * <p>Reading is lenient about optional record members and strict about the document skeleton:
 * {@code processed_files} is ignored and recomputed, while a non-object root, a non-object
 * {@code results} or a non-integer {@code total_files} raise {@link CorpusFormatException}.</p>
 *
 * @since 0.1.0
 */
public final class CorpusJsonCodec {
  static final String TOTAL_FILES = "total_files";
  static final String PROCESSED_FILES = "processed_files";
  static final String RESULTS = "results";
  static final String MATCH_DETAILS = "match_details";
  static final String GAME_VERSION = "game_version";
  static final String BUILD = "build";
  static final String BRANCH = "branch";
  static final String PLAYERS = "players";
  static final String MAP_INFO = "map_info";
  static final String MAP = "map";
  static final String MODE = "mode";
  static final String ERROR = "error";

  /**
   * Reads a corpus document.
   *
   * @param in UTF-8 JSON stream; not closed
   * @return decoded corpus
   * @throws CorpusFormatException if the stream is not a corpus document
   * @throws IOException if reading fails
   */
  public Corpus read(InputStream in) throws IOException {
    JsonValue root;
    try (JsonParser parser = JsonCodec.factory().createParser(in)) {
      root = JsonCodec.readDocument(parser);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new CorpusFormatException("Corpus is not valid JSON: " + ex.getMessage(), ex);
    }
    if (!(root instanceof JsonObject document)) {
      throw new CorpusFormatException("Corpus root must be a JSON object");
    }
    int totalFiles = readTotalFiles(document);
    Map<String, MatchRecord> results = new LinkedHashMap<>();
    Optional<JsonValue> rawResults = document.get(RESULTS);
    if (rawResults.isPresent()) {
      JsonObject resultObject = rawResults.get().asObject()
          .orElseThrow(() -> new CorpusFormatException("Corpus 'results' must be a JSON object"));
      for (Map.Entry<String, JsonValue> entry : resultObject.members().entrySet()) {
        results.put(entry.getKey(), readRecord(entry.getKey(), entry.getValue()));
      }
    }
    return new Corpus(totalFiles, results);
  }

  /**
   * Writes {@code corpus} as a pretty-printed document.
   *
   * @param corpus corpus to write
   * @param out destination; flushed but not closed
   * @throws IOException if writing fails
   */
  public void write(Corpus corpus, OutputStream out) throws IOException {
    try (JsonGenerator gen = JsonCodec.factory().createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      gen.writeNumberField(TOTAL_FILES, corpus.totalFiles());
      gen.writeNumberField(PROCESSED_FILES, corpus.processedFiles());
      gen.writeObjectFieldStart(RESULTS);
      for (MatchRecord record : corpus.results().values()) {
        gen.writeFieldName(record.fileName());
        writeRecord(gen, record);
      }
      gen.writeEndObject();
      gen.writeEndObject();
    }
    out.flush();
  }

  private static void writeRecord(JsonGenerator gen, MatchRecord record) throws IOException {
    gen.writeStartObject();
    if (record.isFailed()) {
      gen.writeStringField(ERROR, record.error().get());
      gen.writeEndObject();
      return;
    }
    gen.writeArrayFieldStart(MATCH_DETAILS);
    for (JsonValue detail : record.matchDetails()) {
      JsonCodec.write(gen, detail);
    }
    gen.writeEndArray();

    gen.writeObjectFieldStart(GAME_VERSION);
    writeOptionalString(gen, BUILD, record.gameVersion().build());
    writeOptionalString(gen, BRANCH, record.gameVersion().branch());
    gen.writeEndObject();

    gen.writeArrayFieldStart(PLAYERS);
    for (String player : record.players()) {
      gen.writeString(player);
    }
    gen.writeEndArray();

    if (record.mapInfo().isPresent()) {
      MapInfo mapInfo = record.mapInfo().get();
      gen.writeObjectFieldStart(MAP_INFO);
      gen.writeStringField(MAP, mapInfo.map());
      gen.writeStringField(MODE, mapInfo.mode());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeOptionalString(JsonGenerator gen, String field, Optional<String> value)
      throws IOException {
    if (value.isPresent()) {
      gen.writeStringField(field, value.get());
    } else {
      gen.writeNullField(field);
    }
  }

  private static int readTotalFiles(JsonObject document) throws CorpusFormatException {
    Optional<JsonValue> raw = document.get(TOTAL_FILES);
    if (raw.isEmpty()) {
      return 0;
    }
    if (!(raw.get() instanceof JsonNumber number)) {
      throw new CorpusFormatException("Corpus 'total_files' must be a number");
    }
    try {
      int total = number.decimalValue().intValueExact();
      if (total < 0) {
        throw new CorpusFormatException("Corpus 'total_files' must not be negative");
      }
      return total;
    } catch (ArithmeticException ex) {
      throw new CorpusFormatException("Corpus 'total_files' must be an integer", ex);
    }
  }

  private static MatchRecord readRecord(String fileName, JsonValue value) {
    Optional<JsonObject> maybeObject = value.asObject();
    if (maybeObject.isEmpty()) {
      return MatchRecord.failed(fileName, "Malformed corpus record");
    }
    JsonObject object = maybeObject.get();
    Optional<String> error = object.get(ERROR).flatMap(JsonValue::asText);
    if (error.isPresent()) {
      return MatchRecord.failed(fileName, error.get());
    }

    List<JsonValue> details = object.get(MATCH_DETAILS)
        .filter(JsonArray.class::isInstance)
        .map(raw -> ((JsonArray) raw).elements())
        .orElse(List.of());

    BuildInfo gameVersion = object.get(GAME_VERSION)
        .flatMap(JsonValue::asObject)
        .map(version -> new BuildInfo(
            version.get(BUILD).flatMap(JsonValue::asText),
            version.get(BRANCH).flatMap(JsonValue::asText)))
        .orElse(BuildInfo.empty());

    List<String> players = new ArrayList<>();
    object.get(PLAYERS)
        .filter(JsonArray.class::isInstance)
        .ifPresent(raw -> ((JsonArray) raw).elements()
            .forEach(element -> element.asText().ifPresent(players::add)));

    Optional<MapInfo> mapInfo = object.get(MAP_INFO)
        .flatMap(JsonValue::asObject)
        .flatMap(info -> {
          Optional<String> map = info.get(MAP).flatMap(JsonValue::asText);
          Optional<String> mode = info.get(MODE).flatMap(JsonValue::asText);
          if (map.isEmpty() || mode.isEmpty()) {
            return Optional.empty();
          }
          return Optional.of(new MapInfo(map.get(), mode.get()));
        });

    return new MatchRecord(fileName, details, gameVersion, players, mapInfo, Optional.empty());
  }
}
