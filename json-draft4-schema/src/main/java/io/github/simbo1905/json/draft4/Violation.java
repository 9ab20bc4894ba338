package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/// What went wrong, as data. One record per kind of constraint failure.
///
/// Callers tell a malformed schema apart from a failing value by the kind:
/// {@link InvalidType}, {@link InvalidRegex}, {@link ReferenceNotFound},
/// {@link RemoteReferenceUnsupported} and {@link FormatUnsupported} describe the
/// schema, the others describe the value.
public sealed interface Violation {

  /// {@return an English description suitable for logs and simple UIs}
  String message();

  /// Collection whose size a length keyword bounds.
  enum ItemType {STRING, ARRAY, PROPERTIES}

  /// Direction in which a bound was crossed.
  enum Comparison {TOO_LARGE, TOO_SMALL}

  enum IpVersion {V4, V6}

  record UnmatchingType(JsonValue value, String expectedType) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' is not of type '" + expectedType + "'";
    }
  }

  /// The `type` keyword itself is neither a string nor an array of strings.
  record InvalidType(JsonValue type) implements Violation {
    @Override
    public String message() {
      return "'" + type + "' is not a valid 'type'";
    }
  }

  record AnyOfFailed(JsonValue value) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' does not match any of the anyOf schemas";
    }
  }

  record OneOfFailed(int passingCount) implements Violation {
    @Override
    public String message() {
      return passingCount + " oneOf schemas matched instead of exactly 1";
    }
  }

  record NotFailed(JsonValue value) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' matched a schema it must not match";
    }
  }

  record EnumMismatch(JsonValue value, JsonArray values) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' is not one of " + values;
    }
  }

  record UnmatchingRegex(String value, String pattern) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' does not match pattern '" + pattern + "'";
    }
  }

  /// A `pattern` or `patternProperties` key is not a valid regular expression.
  record InvalidRegex(String pattern) implements Violation {
    @Override
    public String message() {
      return "Regex pattern '" + pattern + "' is not valid";
    }
  }

  record MultipleOfFailed(JsonNumber value, BigDecimal divisor) implements Violation {
    @Override
    public String message() {
      return value + " is not a multiple of " + divisor.toPlainString();
    }
  }

  record UniqueItemsViolated(JsonArray value) implements Violation {
    @Override
    public String message() {
      return value + " does not have unique items";
    }
  }

  /// Names the whole `required` list, not only the missing keys.
  record RequiredMissing(List<String> required) implements Violation {
    public RequiredMissing {
      required = List.copyOf(required);
    }

    @Override
    public String message() {
      return "Required properties are missing " + required;
    }
  }

  record InvalidIp(String value, IpVersion version) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' is not a valid " + (version == IpVersion.V4 ? "IPv4" : "IPv6") + " address";
    }
  }

  /// `segment` is the pointer token at which the walk failed.
  record ReferenceNotFound(String reference, String segment) implements Violation {
    @Override
    public String message() {
      return "Reference '" + reference + "' not found at segment '" + segment + "'";
    }
  }

  record RemoteReferenceUnsupported(String reference) implements Violation {
    @Override
    public String message() {
      return "Remote $ref '" + reference + "' is not supported";
    }
  }

  record LengthViolation(long bound, ItemType itemType, Comparison comparison) implements Violation {
    public LengthViolation {
      Objects.requireNonNull(itemType, "itemType");
      Objects.requireNonNull(comparison, "comparison");
    }

    @Override
    public String message() {
      boolean tooLarge = comparison == Comparison.TOO_LARGE;
      switch (itemType) {
        case STRING:
          return "Length of string is " + (tooLarge ? "larger than maximum" : "smaller than minimum") + " length of " + bound;
        case ARRAY:
          return "Length of array is " + (tooLarge ? "larger than maximum" : "smaller than minimum") + " length of " + bound;
        default:
          return "The number of properties is " + (tooLarge ? "larger than maximum" : "smaller than minimum") + " number of " + bound;
      }
    }
  }

  record ValueBoundsViolation(BigDecimal bound, Comparison comparison, boolean exclusive) implements Violation {
    @Override
    public String message() {
      String kind = comparison == Comparison.TOO_LARGE
          ? (exclusive ? "Value must be below " : "Value exceeds the maximum value of ")
          : (exclusive ? "Value must be above " : "Value is lower than the minimum value of ");
      return kind + bound.toPlainString();
    }
  }

  /// `additionalItems: false` or `additionalProperties: false` rejected an element.
  /// `itemType` is {@link ItemType#ARRAY} or {@link ItemType#PROPERTIES}.
  record AdditionalItemsOrProperties(ItemType itemType) implements Violation {
    @Override
    public String message() {
      return itemType == ItemType.ARRAY
          ? "Additional items are not permitted in this array"
          : "Additional properties are not permitted in this object";
    }
  }

  record DependencyMissing(String key, String dependency) implements Violation {
    @Override
    public String message() {
      return "'" + key + "' is missing its dependency '" + dependency + "'";
    }
  }

  record FormatUnsupported(String format) implements Violation {
    @Override
    public String message() {
      return "'format' validation of '" + format + "' is not supported";
    }
  }

  record FormatMismatch(String format, String value) implements Violation {
    @Override
    public String message() {
      return "'" + value + "' is not a valid '" + format + "'";
    }
  }

  /// A `$ref` was re-entered for the same value before its first evaluation finished.
  record CyclicReference(String reference) implements Violation {
    @Override
    public String message() {
      return "Reference '" + reference + "' recurses without consuming the value";
    }
  }

  record DepthLimitExceeded(int limit) implements Violation {
    @Override
    public String message() {
      return "Schema or value nesting exceeds the limit of " + limit;
    }
  }
}
