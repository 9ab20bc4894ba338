package io.github.simbo1905.json.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/// A JSON number, either {@link JsonInteger} or {@link JsonFloat}.
///
/// The split records how the number was written. Numeric comparisons should go
/// through {@link #toBigDecimal()} so that `1` and `1.0` compare equal.
public sealed interface JsonNumber extends JsonValue permits JsonInteger, JsonFloat {

  /// {@return the exact decimal value of this number}
  BigDecimal toBigDecimal();

  /// {@return this number as a `double`, possibly losing precision}
  double toDouble();

  /// {@return the boxed Java number: `Long` for integers, `Double` otherwise}
  Number toNumber();

  /// {@return `true` if this number has no fractional part}
  /// `5` and `5.0` are both integral; `5.5` is not.
  boolean isIntegral();

  @Override
  default String typeName() {
    return "number";
  }

  static JsonNumber of(long value) {
    return new JsonInteger(value);
  }

  /// @throws IllegalArgumentException if `value` is NaN or infinite
  static JsonNumber of(double value) {
    return new JsonFloat(value);
  }

  /// Integers that fit a `long` become {@link JsonInteger}, larger ones are
  /// approximated as {@link JsonFloat}.
  ///
  /// @throws IllegalArgumentException if the value does not fit a finite double
  static JsonNumber of(BigInteger value) {
    Objects.requireNonNull(value, "value");
    if (value.bitLength() < Long.SIZE) {
      return new JsonInteger(value.longValueExact());
    }
    return new JsonFloat(value.doubleValue());
  }

  /// @throws IllegalArgumentException if the value does not fit a finite double
  static JsonNumber of(BigDecimal value) {
    Objects.requireNonNull(value, "value");
    if (value.scale() <= 0) {
      return of(value.toBigIntegerExact());
    }
    return new JsonFloat(value.doubleValue());
  }
}
