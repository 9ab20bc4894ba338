package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.List;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// AnyOf composition - must satisfy at least one branch.
/// Branch errors are discarded; a failure reports a single {@link Violation.AnyOfFailed}.
record AnyOfRule(List<Rule> branches) implements Rule {

  AnyOfRule {
    branches = List.copyOf(branches);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    for (int i = 0; i < branches.size(); i++) {
      if (branches.get(i).passes(path, json, ctx)) {
        final int matched = i;
        LOG.finest(() -> "anyOf BRANCH MATCH: index=" + matched + " path=" + path);
        return ValidationResult.success();
      }
    }
    return ValidationResult.failure(path, new Violation.AnyOfFailed(json));
  }
}
