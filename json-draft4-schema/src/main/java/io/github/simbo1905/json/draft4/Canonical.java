package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonBoolean;
import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Canonical text keys for value equality in `enum` and `uniqueItems`.
///
/// Two values have the same key iff they are equal as JSON: member order is
/// ignored and numbers compare by value (`1`, `1.0` and `1e0` share a key).
final class Canonical {

  private Canonical() {}

  /// @param booleansAsNumbers when `true`, `true` keys as `1` and `false` as `0`
  static String of(JsonValue v, boolean booleansAsNumbers) {
    StringBuilder sb = new StringBuilder();
    append(sb, v, booleansAsNumbers);
    return sb.toString();
  }

  private static void append(StringBuilder sb, JsonValue v, boolean booleansAsNumbers) {
    if (v instanceof JsonObject o) {
      List<String> keys = new ArrayList<>(o.members().keySet());
      Collections.sort(keys);
      sb.append('{');
      for (int i = 0; i < keys.size(); i++) {
        String k = keys.get(i);
        if (i > 0) sb.append(',');
        sb.append(new JsonString(k)).append(':');
        append(sb, o.members().get(k), booleansAsNumbers);
      }
      sb.append('}');
    } else if (v instanceof JsonArray a) {
      sb.append('[');
      for (int i = 0; i < a.values().size(); i++) {
        if (i > 0) sb.append(',');
        append(sb, a.values().get(i), booleansAsNumbers);
      }
      sb.append(']');
    } else if (v instanceof JsonNumber n) {
      sb.append(number(n.toBigDecimal()));
    } else if (v instanceof JsonBoolean b && booleansAsNumbers) {
      sb.append(b.value() ? "1" : "0");
    } else {
      // strings, booleans and null render unambiguously
      sb.append(v);
    }
  }

  private static String number(BigDecimal d) {
    return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
  }
}
