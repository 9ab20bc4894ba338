package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

/// A compiled validation rule: one node of the tree that {@link SchemaCompiler}
/// builds from a schema document.
///
/// Rules are immutable and side-effect free. Per-call state such as the
/// recursion depth lives in the {@link ValidationContext}.
sealed interface Rule
    permits AllOfRule,
    AnyOfRule,
    OneOfRule,
    NotRule,
    ConstantRule,
    TypeRule,
    EnumRule,
    LengthRule,
    PatternRule,
    MultipleOfRule,
    BoundRule,
    UniqueItemsRule,
    ItemsRule,
    TupleItemsRule,
    RequiredRule,
    PropertiesRule,
    DependencyRule,
    FormatRule,
    RefRule {

  /// Validates `json`, found at `path` in the instance being validated.
  ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx);

  /// {@return `true` if `json` passes, without collecting errors elsewhere}
  default boolean passes(String path, JsonValue json, ValidationContext ctx) {
    return validateAt(path, json, ctx).valid();
  }
}
