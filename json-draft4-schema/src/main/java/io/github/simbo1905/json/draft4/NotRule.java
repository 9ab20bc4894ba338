package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

/// Not composition - inverts the validation result of the inner rule.
record NotRule(Rule rule) implements Rule {
  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    return rule.passes(path, json, ctx)
        ? ValidationResult.failure(path, new Violation.NotFailed(json))
        : ValidationResult.success();
  }
}
