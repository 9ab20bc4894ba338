package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.List;

/// Conjunction - every rule is evaluated, even after one fails, and all errors are kept.
record AllOfRule(List<Rule> rules) implements Rule {

  AllOfRule {
    rules = List.copyOf(rules);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    List<ValidationResult> results = new ArrayList<>(rules.size());
    for (Rule rule : rules) {
      results.add(rule.validateAt(path, json, ctx));
    }
    return ValidationResult.merge(results);
  }
}
