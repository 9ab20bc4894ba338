package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.Objects;

/// A rule whose outcome does not depend on the value.
///
/// {@link #VALID} stands for `true` / absent `additionalItems` and
/// `additionalProperties`. A failing constant carries the violation decided at
/// compile time: `false` for those keywords, or a schema problem such as an
/// unresolvable reference.
record ConstantRule(Violation violation) implements Rule {

  static final ConstantRule VALID = new ConstantRule(null);

  static ConstantRule failing(Violation violation) {
    return new ConstantRule(Objects.requireNonNull(violation, "violation"));
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    return violation == null ? ValidationResult.success() : ValidationResult.failure(path, violation);
  }
}
