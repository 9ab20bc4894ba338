package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonValue;

import java.util.List;

/// `required` - reports the whole list once if any name is missing.
/// A value that is not an object has none of the names and fails too.
record RequiredRule(List<String> required) implements Rule {

  RequiredRule {
    required = List.copyOf(required);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonObject obj)) {
      return ValidationResult.failure(path, new Violation.RequiredMissing(required));
    }
    for (String name : required) {
      if (!obj.members().containsKey(name)) {
        return ValidationResult.failure(path, new Violation.RequiredMissing(required));
      }
    }
    return ValidationResult.success();
  }
}
