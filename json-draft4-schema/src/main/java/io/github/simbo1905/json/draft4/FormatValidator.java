package io.github.simbo1905.json.draft4;

/// Validates strings for one `format` name.
///
/// Register custom implementations with {@link JsonSchemaOptions#withFormat}.
@FunctionalInterface
public interface FormatValidator {

  /// Test if the string value matches the format
  /// @param s the string to test
  /// @return true if the string matches the format, false otherwise
  boolean test(String s);

  /// {@return the violation reported when `value` fails {@link #test}}
  default Violation violation(String format, String value) {
    return new Violation.FormatMismatch(format, value);
  }
}
