package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// One `dependencies` entry, applied only when the object has member `key`.
///
/// A schema dependency (`schema` non-null) validates the whole object. A
/// property dependency reports each name in `names` the object lacks.
record DependencyRule(String key, Rule schema, List<String> names) implements Rule {

  DependencyRule {
    Objects.requireNonNull(key, "key");
    names = List.copyOf(names);
  }

  static DependencyRule onSchema(String key, Rule schema) {
    return new DependencyRule(key, Objects.requireNonNull(schema, "schema"), List.of());
  }

  static DependencyRule onProperties(String key, List<String> names) {
    return new DependencyRule(key, null, names);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonObject obj) || !obj.members().containsKey(key)) {
      return ValidationResult.success();
    }
    if (schema != null) {
      return schema.validateAt(path, json, ctx);
    }
    List<ValidationResult> results = new ArrayList<>();
    for (String name : names) {
      if (!obj.members().containsKey(name)) {
        results.add(ValidationResult.failure(path, new Violation.DependencyMissing(key, name)));
      }
    }
    return ValidationResult.merge(results);
  }
}
