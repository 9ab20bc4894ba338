/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.simbo1905.json.value;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Static entry points for producing {@link JsonValue}s.
///
/// ## Example
/// ```java
/// JsonValue fromText = Json.parse("{\"name\":\"Eggs\",\"price\":34.99}");
/// JsonValue fromJava = Json.fromUntyped(Map.of("name", "Eggs", "price", 34.99));
/// ```
///
/// Text is tokenised by Jackson and copied into the immutable value model, so
/// nothing downstream depends on Jackson types.
public final class Json {

  private static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.value");

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();

  /// Parses a JSON document.
  ///
  /// Objects keep the member order of the document. Numbers written without a
  /// fraction or exponent become {@link JsonInteger} when they fit a `long`.
  ///
  /// @param in the JSON document. Non-null.
  /// @throws JsonParseException if `in` is not a single well formed JSON value,
  ///         an object repeats a member name, or a number has no finite
  ///         `double` value (such as `1e400`)
  /// @return the parsed value
  public static JsonValue parse(String in) {
    Objects.requireNonNull(in, "in");
    final JsonNode node;
    try {
      node = MAPPER.readTree(in);
    } catch (JsonProcessingException e) {
      JsonLocation loc = e.getLocation();
      long line = loc == null ? -1 : loc.getLineNr();
      long column = loc == null ? -1 : loc.getColumnNr();
      LOG.fine(() -> "parse: rejected input at line=" + line + " column=" + column + ": " + e.getOriginalMessage());
      throw new JsonParseException(e.getOriginalMessage(), line, column, e);
    }
    if (node == null || node.isMissingNode()) {
      throw new JsonParseException("No JSON content", 1, 1, null);
    }
    try {
      return fromJsonNode(node);
    } catch (IllegalArgumentException e) {
      LOG.fine(() -> "parse: rejected value: " + e.getMessage());
      throw new JsonParseException("Number out of range: " + e.getMessage(), -1, -1, e);
    }
  }

  /// {@return the value model copy of a Jackson tree}
  ///
  /// @throws IllegalArgumentException for node types with no JSON counterpart
  ///         (binary, POJO or missing nodes)
  public static JsonValue fromJsonNode(JsonNode node) {
    Objects.requireNonNull(node, "node");
    if (node.isObject()) {
      Map<String, JsonValue> members = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        members.put(field.getKey(), fromJsonNode(field.getValue()));
      }
      return new JsonObject(members);
    }
    if (node.isArray()) {
      List<JsonValue> values = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        values.add(fromJsonNode(element));
      }
      return new JsonArray(values);
    }
    if (node.isTextual()) {
      return new JsonString(node.textValue());
    }
    if (node.isBoolean()) {
      return JsonBoolean.of(node.booleanValue());
    }
    if (node.isNull()) {
      return JsonNull.of();
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong() ? new JsonInteger(node.longValue()) : JsonNumber.of(node.bigIntegerValue());
    }
    if (node.isNumber()) {
      return node.isBigDecimal() ? JsonNumber.of(node.decimalValue()) : new JsonFloat(node.doubleValue());
    }
    throw new IllegalArgumentException(node.getNodeType() + " node has no JSON value equivalent");
  }

  /// {@return a `JsonValue` created from plain Java objects}
  ///
  /// | Untyped Object | JsonValue |
  /// |----------------|-----------|
  /// | `Map<String, ?>` | `JsonObject` |
  /// | `List<?>` | `JsonArray` |
  /// | `String` | `JsonString` |
  /// | `Boolean` | `JsonBoolean` |
  /// | `Byte`, `Short`, `Integer`, `Long`, `BigInteger` | `JsonInteger` |
  /// | `Float`, `Double`, `BigDecimal` | `JsonFloat` (or `JsonInteger` for an integral `BigDecimal`) |
  /// | `null` | `JsonNull` |
  ///
  /// A `JsonValue` is returned as is.
  ///
  /// @throws IllegalArgumentException if `src` or a nested element has another type,
  ///         or a map key is not a `String`
  public static JsonValue fromUntyped(Object src) {
    if (src == null) {
      return JsonNull.of();
    }
    if (src instanceof JsonValue jv) {
      return jv;
    }
    if (src instanceof Map<?, ?> map) {
      Map<String, JsonValue> members = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException(String.format("The key '%s' is not a String", entry.getKey()));
        }
        members.put(key, fromUntyped(entry.getValue()));
      }
      return new JsonObject(members);
    }
    if (src instanceof List<?> list) {
      List<JsonValue> values = new ArrayList<>(list.size());
      for (Object o : list) {
        values.add(fromUntyped(o));
      }
      return new JsonArray(values);
    }
    if (src instanceof String str) {
      return new JsonString(str);
    }
    if (src instanceof Boolean bool) {
      return JsonBoolean.of(bool);
    }
    if (src instanceof Byte || src instanceof Short || src instanceof Integer || src instanceof Long) {
      return new JsonInteger(((Number) src).longValue());
    }
    if (src instanceof Float || src instanceof Double) {
      return new JsonFloat(((Number) src).doubleValue());
    }
    if (src instanceof BigInteger bi) {
      return JsonNumber.of(bi);
    }
    if (src instanceof BigDecimal bd) {
      return JsonNumber.of(bd);
    }
    throw new IllegalArgumentException(src.getClass().getSimpleName() + " is not a recognized type");
  }

  /// {@return plain Java objects for `src`}
  /// The inverse of {@link #fromUntyped(Object)}: unmodifiable `Map` and `List`
  /// for containers, `Long` or `Double` for numbers, `null` for `JsonNull`.
  public static Object toUntyped(JsonValue src) {
    Objects.requireNonNull(src, "src");
    if (src instanceof JsonObject jo) {
      Map<String, Object> map = new LinkedHashMap<>(); // Avoid Collectors.toMap, to allow `null` values
      jo.members().forEach((k, v) -> map.put(k, toUntyped(v)));
      return Collections.unmodifiableMap(map);
    }
    if (src instanceof JsonArray ja) {
      List<Object> list = new ArrayList<>(ja.values().size());
      for (JsonValue v : ja.values()) {
        list.add(toUntyped(v));
      }
      return Collections.unmodifiableList(list);
    }
    if (src instanceof JsonString js) {
      return js.value();
    }
    if (src instanceof JsonBoolean jb) {
      return jb.value();
    }
    if (src instanceof JsonNumber n) {
      return n.toNumber();
    }
    return null;
  }

  // no instantiation is allowed for this class
  private Json() {}
}
