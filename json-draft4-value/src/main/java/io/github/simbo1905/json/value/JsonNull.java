package io.github.simbo1905.json.value;

/// The JSON `null` literal. All instances are equal; use {@link #of()}.
public record JsonNull() implements JsonValue {

  private static final JsonNull INSTANCE = new JsonNull();

  public static JsonNull of() {
    return INSTANCE;
  }

  @Override
  public String typeName() {
    return "null";
  }

  @Override
  public String toString() {
    return "null";
  }
}
