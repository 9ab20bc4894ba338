package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonValue;

import java.math.BigDecimal;

/// `multipleOf` with exact decimal arithmetic, so `0.3` is a multiple of `0.1`.
/// A divisor that is zero or negative disables the check.
record MultipleOfRule(BigDecimal divisor) implements Rule {

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonNumber num) || divisor.signum() <= 0) {
      return ValidationResult.success();
    }
    BigDecimal remainder = num.toBigDecimal().remainder(divisor);
    return remainder.signum() == 0
        ? ValidationResult.success()
        : ValidationResult.failure(path, new Violation.MultipleOfFailed(num, divisor));
  }
}
