package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.List;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// OneOf composition - exactly one branch must pass.
/// Every branch is evaluated so the failure can report how many passed.
record OneOfRule(List<Rule> branches) implements Rule {

  OneOfRule {
    branches = List.copyOf(branches);
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    int validCount = 0;
    for (Rule branch : branches) {
      if (branch.passes(path, json, ctx)) {
        validCount++;
      }
    }
    final int passing = validCount;
    LOG.finest(() -> "oneOf: " + passing + " of " + branches.size() + " branches passed at path=" + path);
    return validCount == 1
        ? ValidationResult.success()
        : ValidationResult.failure(path, new Violation.OneOfFailed(validCount));
  }
}
