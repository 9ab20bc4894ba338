package io.github.simbo1905.json.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// An immutable JSON object. Member order is the insertion order of the source map.
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

  public JsonObject {
    Map<String, JsonValue> copy = new LinkedHashMap<>();
    members.forEach((k, v) -> copy.put(
        Objects.requireNonNull(k, "member name"),
        Objects.requireNonNull(v, "member value")));
    members = Collections.unmodifiableMap(copy);
  }

  public static JsonObject of(Map<String, ? extends JsonValue> members) {
    return new JsonObject(new LinkedHashMap<String, JsonValue>(members));
  }

  /// {@return the member named `name`, or `null` when absent}
  public JsonValue get(String name) {
    return members.get(name);
  }

  @Override
  public String typeName() {
    return "object";
  }

  @Override
  public String toString() {
    return members.entrySet().stream()
        .map(e -> JsonString.quote(e.getKey()) + ":" + e.getValue())
        .collect(Collectors.joining(",", "{", "}"));
  }
}
