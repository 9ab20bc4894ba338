package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonValue;

import java.util.LinkedHashSet;
import java.util.Set;

/// Enum - the value must equal one of the listed values.
/// Equality is structural and numbers compare by value, so `1` equals `1.0`.
record EnumRule(JsonArray values, Set<String> canonicalValues) implements Rule {

  EnumRule(JsonArray values) {
    this(values, canonicalize(values));
  }

  private static Set<String> canonicalize(JsonArray values) {
    Set<String> keys = new LinkedHashSet<>();
    for (JsonValue v : values.values()) {
      keys.add(Canonical.of(v, false));
    }
    return Set.copyOf(keys);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    return canonicalValues.contains(Canonical.of(json, false))
        ? ValidationResult.success()
        : ValidationResult.failure(path, new Violation.EnumMismatch(json, values));
  }
}
