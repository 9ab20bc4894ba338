package io.github.simbo1905.json.value;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUntypedTest {

  @Test
  void javaCollectionsBecomeJsonValues() {
    Map<String, Object> src = new LinkedHashMap<>();
    src.put("name", "Eggs");
    src.put("price", 34.99);
    src.put("count", 3);
    src.put("tags", List.of("a", "b"));
    src.put("note", null);

    JsonValue json = Json.fromUntyped(src);

    assertThat(json).isEqualTo(Json.parse("""
        {"name":"Eggs","price":34.99,"count":3,"tags":["a","b"],"note":null}
        """));
  }

  @Test
  void bigNumbersPickTheNarrowestTag() {
    assertThat(Json.fromUntyped(BigInteger.TEN)).isEqualTo(new JsonInteger(10));
    assertThat(Json.fromUntyped(new BigDecimal("2.50"))).isEqualTo(new JsonFloat(2.5));
    assertThat(Json.fromUntyped(new BigDecimal("7"))).isEqualTo(new JsonInteger(7));
  }

  @Test
  void nonStringKeysAreRejected() {
    assertThatThrownBy(() -> Json.fromUntyped(Map.of(1, "x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not a String");
  }

  @Test
  void unknownTypesAreRejected() {
    assertThatThrownBy(() -> Json.fromUntyped(new Object()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void untypedRoundTripKeepsNulls() {
    JsonValue json = Json.parse("{\"a\":[1,2.5,null,false],\"b\":\"x\"}");
    Object untyped = Json.toUntyped(json);
    assertThat(untyped).isEqualTo(Map.of("a", Arrays.asList(1L, 2.5, null, false), "b", "x"));
    assertThat(Json.fromUntyped(untyped)).isEqualTo(json);
  }

  @Test
  void nonFiniteDoublesAreRejected() {
    assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
  }
}
