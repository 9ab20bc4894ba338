package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

/// `format` with a registered validator. Non-strings pass.
record FormatRule(String format, FormatValidator validator) implements Rule {

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonString str) || validator.test(str.value())) {
      return ValidationResult.success();
    }
    return ValidationResult.failure(path, validator.violation(format, str.value()));
  }
}
