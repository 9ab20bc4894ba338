package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonBoolean;
import io.github.simbo1905.json.value.JsonNull;
import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.util.Objects;
import java.util.Optional;

/// The primitive type names accepted by the `type` keyword.
public enum Type {
  OBJECT("object"),
  ARRAY("array"),
  STRING("string"),
  BOOLEAN("boolean"),
  INTEGER("integer"),
  NUMBER("number"),
  NULL("null");

  private final String jsonName;

  Type(String jsonName) {
    this.jsonName = jsonName;
  }

  /// {@return the name used in schema documents, e.g. `integer`}
  public String jsonName() {
    return jsonName;
  }

  /// {@return `true` if `value` is an instance of this type}
  /// `integer` accepts any number with a zero fractional part, so `5.0`
  /// qualifies. `number` accepts integers. Booleans are neither.
  public boolean matches(JsonValue value) {
    Objects.requireNonNull(value, "value");
    switch (this) {
      case OBJECT:
        return value instanceof JsonObject;
      case ARRAY:
        return value instanceof JsonArray;
      case STRING:
        return value instanceof JsonString;
      case BOOLEAN:
        return value instanceof JsonBoolean;
      case INTEGER:
        return value instanceof JsonNumber n && n.isIntegral();
      case NUMBER:
        return value instanceof JsonNumber;
      case NULL:
        return value instanceof JsonNull;
      default:
        throw new AssertionError("Unexpected type: " + this);
    }
  }

  /// {@return the type called `name`, or empty for an unrecognised name}
  public static Optional<Type> byName(String name) {
    for (Type type : values()) {
      if (type.jsonName().equals(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// {@return `true` if `value` matches the type called `typeName`}
  /// An unrecognised name never matches.
  public static boolean matches(JsonValue value, String typeName) {
    return byName(typeName).map(t -> t.matches(value)).orElse(false);
  }
}
