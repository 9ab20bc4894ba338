package io.github.simbo1905.json.value;

import java.util.List;
import java.util.stream.Collectors;

/// An ordered, immutable JSON array. Elements are never `null`; use {@link JsonNull}.
public record JsonArray(List<JsonValue> values) implements JsonValue {

  public JsonArray {
    values = List.copyOf(values); // Implicit NPE on null elements
  }

  public static JsonArray of(List<? extends JsonValue> values) {
    return new JsonArray(List.copyOf(values));
  }

  public static JsonArray of(JsonValue... values) {
    return new JsonArray(List.of(values));
  }

  @Override
  public String typeName() {
    return "array";
  }

  @Override
  public String toString() {
    return values.stream()
        .map(JsonValue::toString)
        .collect(Collectors.joining(",", "[", "]"));
  }
}
