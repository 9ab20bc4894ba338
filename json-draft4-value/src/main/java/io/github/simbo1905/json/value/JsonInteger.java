package io.github.simbo1905.json.value;

import java.math.BigDecimal;

/// A JSON number written without a fraction or exponent that fits a `long`.
public record JsonInteger(long value) implements JsonNumber {

  @Override
  public BigDecimal toBigDecimal() {
    return BigDecimal.valueOf(value);
  }

  @Override
  public double toDouble() {
    return value;
  }

  @Override
  public Number toNumber() {
    return value;
  }

  @Override
  public boolean isIntegral() {
    return true;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
