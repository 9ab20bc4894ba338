package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.util.Objects;

/// Size bound shared by `maxLength`/`minLength`, `maxItems`/`minItems` and
/// `maxProperties`/`minProperties`.
///
/// String length counts Unicode code points, so an emoji is one character.
/// Values of another kind than `itemType` names pass.
record LengthRule(long bound, Violation.ItemType itemType, Violation.Comparison comparison) implements Rule {

  LengthRule {
    Objects.requireNonNull(itemType, "itemType");
    Objects.requireNonNull(comparison, "comparison");
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    long size;
    if (itemType == Violation.ItemType.STRING && json instanceof JsonString str) {
      size = str.value().codePointCount(0, str.value().length());
    } else if (itemType == Violation.ItemType.ARRAY && json instanceof JsonArray arr) {
      size = arr.values().size();
    } else if (itemType == Violation.ItemType.PROPERTIES && json instanceof JsonObject obj) {
      size = obj.members().size();
    } else {
      return ValidationResult.success();
    }
    boolean violated = comparison == Violation.Comparison.TOO_LARGE ? size > bound : size < bound;
    return violated
        ? ValidationResult.failure(path, new Violation.LengthViolation(bound, itemType, comparison))
        : ValidationResult.success();
  }
}
