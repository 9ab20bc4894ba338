package io.github.simbo1905.json.draft4;

import java.util.Objects;

/// A single violation located in the validated value.
///
/// `path` is `""` for the root, `name` for a member of the root object,
/// `a.b` for nested members and `items[2]` for array elements.
public record ValidationError(String path, Violation violation) {

  public ValidationError {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(violation, "violation");
  }

  public String message() {
    return violation.message();
  }

  @Override
  public String toString() {
    return (path.isEmpty() ? "<root>" : path) + ": " + message();
  }
}
