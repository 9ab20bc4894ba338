package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

/// Single-name `type` check. An unrecognised name never matches.
record TypeRule(String typeName) implements Rule {
  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    return Type.matches(json, typeName)
        ? ValidationResult.success()
        : ValidationResult.failure(path, new Violation.UnmatchingType(json, typeName));
  }
}
