package io.github.simbo1905.json.value;

/// An immutable JSON value.
///
/// The hierarchy is closed so that code consuming a value can dispatch over
/// every case explicitly:
///
/// | JSON | type |
/// |------|------|
/// | `null` | {@link JsonNull} |
/// | `true` / `false` | {@link JsonBoolean} |
/// | number without fraction or exponent | {@link JsonInteger} |
/// | any other number | {@link JsonFloat} |
/// | string | {@link JsonString} |
/// | array | {@link JsonArray} |
/// | object | {@link JsonObject} |
///
/// Booleans are never numbers: `true` is a `JsonBoolean` and nothing else.
/// `toString()` on every implementation returns compact JSON text.
public sealed interface JsonValue
    permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

  /// {@return the JSON type name of this value, as used in error messages}
  /// One of `null`, `boolean`, `number`, `string`, `array`, `object`.
  String typeName();

  /// Compact JSON text for this value.
  @Override
  String toString();
}
