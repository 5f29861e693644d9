package com.heatlabs.replay.domain.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.heatlabs.replay.domain.json.JsonValue.JsonArray;
import com.heatlabs.replay.domain.json.JsonValue.JsonBoolean;
import com.heatlabs.replay.domain.json.JsonValue.JsonNull;
import com.heatlabs.replay.domain.json.JsonValue.JsonNumber;
import com.heatlabs.replay.domain.json.JsonValue.JsonObject;
import com.heatlabs.replay.domain.json.JsonValue.JsonString;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streaming bridge between Jackson tokens and {@link JsonValue} trees.
 *
 * <p>Parsing is strict JSON with one extension: the non-finite numbers {@code NaN}, {@code Infinity}
 * and {@code -Infinity} are accepted and written back unchanged. Comments, single quotes and anything
 * but whitespace after the root value are rejected. Stateless apart from the shared
 * {@link JsonFactory}, which is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JsonCodec {
  private static final JsonFactory FACTORY = JsonFactory.builder()
      .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
      .build();

  private JsonCodec() {}

  /**
   * Returns the shared factory so adapters stream with the same settings.
   *
   * @return shared Jackson factory
   */
  public static JsonFactory factory() {
    return FACTORY;
  }

  /**
   * Parses a UTF-8 byte range as a complete JSON document.
   *
   * @param data source buffer
   * @param offset first byte of the document
   * @param length number of bytes in the document
   * @return parsed value, or empty when the range is not a single well-formed JSON value
   */
  public static Optional<JsonValue> tryParse(byte[] data, int offset, int length) {
    Objects.requireNonNull(data, "data");
    try (JsonParser parser = FACTORY.createParser(data, offset, length)) {
      return Optional.of(readDocument(parser));
    } catch (IOException | IllegalArgumentException ex) {
      // Malformed candidates are expected; callers treat them as misses.
      return Optional.empty();
    }
  }

  /**
   * Parses a JSON document held in a string.
   *
   * @param json document text
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a single well-formed JSON value
   */
  public static JsonValue parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Reads the value starting at {@code token}, consuming every token that belongs to it.
   *
   * @param parser parser positioned on {@code token}
   * @param token current token
   * @return value tree
   * @throws IOException if the underlying stream fails or is malformed
   */
  public static JsonValue readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> new JsonString(parser.getText());
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new JsonNumber(parser.getText());
      case VALUE_TRUE -> JsonBoolean.TRUE;
      case VALUE_FALSE -> JsonBoolean.FALSE;
      case VALUE_NULL -> JsonNull.INSTANCE;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  /**
   * Writes {@code value} at the generator's current position.
   *
   * @param gen target generator
   * @param value value to emit
   * @throws IOException if the generator fails
   */
  public static void write(JsonGenerator gen, JsonValue value) throws IOException {
    if (value instanceof JsonObject object) {
      gen.writeStartObject();
      for (Map.Entry<String, JsonValue> member : object.members().entrySet()) {
        gen.writeFieldName(member.getKey());
        write(gen, member.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof JsonArray array) {
      gen.writeStartArray();
      for (JsonValue element : array.elements()) {
        write(gen, element);
      }
      gen.writeEndArray();
    } else if (value instanceof JsonString string) {
      gen.writeString(string.value());
    } else if (value instanceof JsonNumber number) {
      gen.writeNumber(number.literal());
    } else if (value instanceof JsonBoolean bool) {
      gen.writeBoolean(bool.value());
    } else {
      gen.writeNull();
    }
  }

  /**
   * Renders a value as indented JSON text.
   *
   * @param value value to render
   * @return pretty-printed JSON
   */
  public static String toPrettyString(JsonValue value) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      write(gen, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON value", ex);
    }
    return out.toString();
  }

  /**
   * Reads one complete document from {@code parser}, rejecting anything but whitespace after it.
   *
   * @param parser fresh parser
   * @return root value
   * @throws IOException if the stream fails or is not well-formed JSON
   * @throws IllegalArgumentException if the document is empty or has trailing content
   */
  public static JsonValue readDocument(JsonParser parser) throws IOException {
    JsonValue value = readValue(parser, parser.nextToken());
    JsonToken trailing = parser.nextToken();
    if (trailing != null) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return value;
  }

  private static JsonObject readObject(JsonParser parser) throws IOException {
    Map<String, JsonValue> members = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      members.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return new JsonObject(members);
  }

  private static JsonArray readArray(JsonParser parser) throws IOException {
    List<JsonValue> elements = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      elements.add(readValue(parser, token));
    }
    return new JsonArray(elements);
  }
}
