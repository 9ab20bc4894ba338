package io.github.simbo1905.json.value;

import java.math.BigDecimal;

/// A JSON number carrying a fraction or an exponent, held as a finite `double`.
public record JsonFloat(double value) implements JsonNumber {

  public JsonFloat {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("Not a valid JSON number: " + value);
    }
  }

  /// Goes through `Double.toString` so `0.1` stays `0.1` rather than its binary expansion.
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
    return value == Math.rint(value);
  }

  @Override
  public String toString() {
    return Double.toString(value);
  }
}
