package io.github.simbo1905.json.draft4;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Outcome of validating one value: valid, or invalid with every error found.
///
/// Errors keep the order in which constraints were evaluated and are never
/// deduplicated.
public record ValidationResult(boolean valid, List<ValidationError> errors) {

  private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

  public ValidationResult {
    errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    if (valid != errors.isEmpty()) {
      throw new IllegalArgumentException("valid=" + valid + " with " + errors.size() + " errors");
    }
  }

  public static ValidationResult success() {
    return SUCCESS;
  }

  public static ValidationResult failure(List<ValidationError> errors) {
    return new ValidationResult(false, errors);
  }

  public static ValidationResult failure(String path, Violation violation) {
    return new ValidationResult(false, List.of(new ValidationError(path, violation)));
  }

  /// Combines results: valid iff all are valid, otherwise all errors in order.
  public static ValidationResult merge(List<ValidationResult> results) {
    List<ValidationError> errors = new ArrayList<>();
    for (ValidationResult result : results) {
      errors.addAll(result.errors());
    }
    return errors.isEmpty() ? SUCCESS : failure(errors);
  }
}
