package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.util.regex.Pattern;

/// `pattern` - unanchored search, so `"b"` matches `"abc"`.
///
/// `compiled` is `null` when the source text is not a valid regular
/// expression; every string value then reports {@link Violation.InvalidRegex}.
record PatternRule(String pattern, Pattern compiled) implements Rule {

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonString str)) {
      return ValidationResult.success();
    }
    if (compiled == null) {
      return ValidationResult.failure(path, new Violation.InvalidRegex(pattern));
    }
    return compiled.matcher(str.value()).find()
        ? ValidationResult.success()
        : ValidationResult.failure(path, new Violation.UnmatchingRegex(str.value(), pattern));
  }
}
