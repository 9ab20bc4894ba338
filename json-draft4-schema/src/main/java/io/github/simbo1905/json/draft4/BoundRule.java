package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/// `minimum` or `maximum`, inclusive unless `exclusive`. Non-numbers pass.
record BoundRule(BigDecimal bound, Violation.Comparison comparison, boolean exclusive) implements Rule {

  BoundRule {
    Objects.requireNonNull(bound, "bound");
    Objects.requireNonNull(comparison, "comparison");
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonNumber num)) {
      return ValidationResult.success();
    }
    int cmp = num.toBigDecimal().compareTo(bound);
    boolean violated;
    if (comparison == Violation.Comparison.TOO_SMALL) {
      violated = exclusive ? cmp <= 0 : cmp < 0;
    } else {
      violated = exclusive ? cmp >= 0 : cmp > 0;
    }
    return violated
        ? ValidationResult.failure(path, new Violation.ValueBoundsViolation(bound, comparison, exclusive))
        : ValidationResult.success();
  }
}
