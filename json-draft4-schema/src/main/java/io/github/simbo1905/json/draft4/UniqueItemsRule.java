package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonValue;

import java.util.HashSet;
import java.util.Set;

/// `uniqueItems: true`. Elements are compared through canonical keys in which
/// `true` equals `1`, `false` equals `0` and `1` equals `1.0`.
record UniqueItemsRule() implements Rule {

  static final UniqueItemsRule INSTANCE = new UniqueItemsRule();

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonArray arr)) {
      return ValidationResult.success();
    }
    Set<String> seen = new HashSet<>();
    for (JsonValue item : arr.values()) {
      if (!seen.add(Canonical.of(item, true))) {
        return ValidationResult.failure(path, new Violation.UniqueItemsViolated(arr));
      }
    }
    return ValidationResult.success();
  }
}
