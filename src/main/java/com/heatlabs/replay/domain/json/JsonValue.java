package com.heatlabs.replay.domain.json;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Tagged union over the six JSON value kinds recovered from replay bytes and corpus documents.
 * <p><strong>Why:</strong> Segment values and match details have no schema; a closed hierarchy keeps every
 * consumer explicit about which shape it expects.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface JsonValue
    permits JsonValue.JsonObject,
        JsonValue.JsonArray,
        JsonValue.JsonString,
        JsonValue.JsonNumber,
        JsonValue.JsonBoolean,
        JsonValue.JsonNull {

  /**
   * Returns the string payload when this value is a {@link JsonString}.
   *
   * @return optional text
   */
  default Optional<String> asText() {
    return Optional.empty();
  }

  /**
   * Returns this value as an object when it is a {@link JsonObject}.
   *
   * @return optional object view
   */
  default Optional<JsonObject> asObject() {
    return Optional.empty();
  }

  /**
   * JSON object with members kept in document order.
   *
   * @param members member map; copied and wrapped unmodifiable
   */
  record JsonObject(Map<String, JsonValue> members) implements JsonValue {
    private static final JsonObject EMPTY = new JsonObject(Map.of());

    public JsonObject {
      Objects.requireNonNull(members, "members");
      members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    public static JsonObject empty() {
      return EMPTY;
    }

    /**
     * Convenience factory for alternating key/value arguments.
     *
     * @param key first member name
     * @param value first member value
     * @return single-member object
     */
    public static JsonObject of(String key, JsonValue value) {
      Map<String, JsonValue> map = new LinkedHashMap<>();
      map.put(key, value);
      return new JsonObject(map);
    }

    public Optional<JsonValue> get(String key) {
      return Optional.ofNullable(members.get(key));
    }

    /**
     * Walks nested objects by member name.
     *
     * @param keys member names from this object downward
     * @return value at the end of the path, or empty when any step is missing or not an object
     */
    public Optional<JsonValue> path(String... keys) {
      JsonValue current = this;
      for (String key : keys) {
        if (!(current instanceof JsonObject object)) {
          return Optional.empty();
        }
        JsonValue next = object.members().get(key);
        if (next == null) {
          return Optional.empty();
        }
        current = next;
      }
      return Optional.of(current);
    }

    public int size() {
      return members.size();
    }

    @Override
    public Optional<JsonObject> asObject() {
      return Optional.of(this);
    }
  }

  /**
   * JSON array.
   *
   * @param elements element list; copied and wrapped unmodifiable
   */
  record JsonArray(List<JsonValue> elements) implements JsonValue {
    public JsonArray {
      Objects.requireNonNull(elements, "elements");
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }
  }

  /**
   * JSON string.
   *
   * @param value decoded string content
   */
  record JsonString(String value) implements JsonValue {
    public JsonString {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Optional<String> asText() {
      return Optional.of(value);
    }
  }

  /**
   * JSON number kept as its source literal so integers and decimals round-trip unchanged.
   *
   * <p>Besides decimal literals, the non-finite tokens {@code NaN}, {@code Infinity} and
   * {@code -Infinity} (and the {@code +Infinity}, {@code INF} spellings the parser accepts) are kept
   * as-is.</p>
   *
   * @param literal number literal as it appeared in the document
   */
  record JsonNumber(String literal) implements JsonValue {
    private static final Set<String> NON_FINITE =
        Set.of("NaN", "Infinity", "+Infinity", "-Infinity", "INF", "+INF", "-INF");

    public JsonNumber {
      Objects.requireNonNull(literal, "literal");
      if (!NON_FINITE.contains(literal)) {
        try {
          new BigDecimal(literal);
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("not a JSON number literal: " + literal, ex);
        }
      }
    }

    public boolean isFinite() {
      return !NON_FINITE.contains(literal);
    }

    public static JsonNumber of(long value) {
      return new JsonNumber(Long.toString(value));
    }

    /**
     * Returns the exact decimal value.
     *
     * @return decimal value
     * @throws ArithmeticException if the literal is not finite
     */
    public BigDecimal decimalValue() {
      if (!isFinite()) {
        throw new ArithmeticException("non-finite number " + literal);
      }
      return new BigDecimal(literal);
    }
  }

  /**
   * JSON boolean.
   *
   * @param value boolean payload
   */
  record JsonBoolean(boolean value) implements JsonValue {
    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    public static JsonBoolean of(boolean value) {
      return value ? TRUE : FALSE;
    }
  }

  /** JSON null. */
  record JsonNull() implements JsonValue {
    public static final JsonNull INSTANCE = new JsonNull();
  }
}
