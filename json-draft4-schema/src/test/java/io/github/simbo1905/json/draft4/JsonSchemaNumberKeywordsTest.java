package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.Json;
import io.github.simbo1905.json.value.JsonNumber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaNumberKeywordsTest extends JsonSchemaTestBase {

    @ParameterizedTest(name = "{1} multipleOf {0} -> {2}")
    @CsvSource({
        "2, 4, true",
        "2, 7, false",
        "0.1, 0.3, true",
        "0.01, 19.99, true",
        "0.1, 0.35, false",
        "1.5, 4.5, true",
        "3, 9.0, true",
        "0, 7, true",
        "-2, 7, true"
    })
    void multipleOfUsesExactDecimals(String divisor, String value, boolean expected) {
        var result = validate("{\"multipleOf\": " + divisor + "}", value);
        assertThat(result.valid()).isEqualTo(expected);
        if (!expected) {
            assertThat(violations(result)).containsExactly(
                new Violation.MultipleOfFailed((JsonNumber) Json.parse(value), new BigDecimal(divisor)));
        }
    }

    @Test
    void multipleOfIgnoresNonNumbers() {
        assertThat(validate("{\"multipleOf\": 2}", "\"7\"").valid()).isTrue();
    }

    @Test
    void inclusiveBounds() {
        String schemaJson = "{\"minimum\": 1, \"maximum\": 3}";
        assertThat(validate(schemaJson, "1").valid()).isTrue();
        assertThat(validate(schemaJson, "3.0").valid()).isTrue();
        assertThat(violations(validate(schemaJson, "0.5"))).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.ONE, Violation.Comparison.TOO_SMALL, false));
        assertThat(violations(validate(schemaJson, "4"))).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.valueOf(3), Violation.Comparison.TOO_LARGE, false));
    }

    @Test
    void exclusiveBoundsAreStrict() {
        String schemaJson = """
            {"minimum": 1, "exclusiveMinimum": true, "maximum": 3, "exclusiveMaximum": true}
            """;
        assertThat(validate(schemaJson, "2").valid()).isTrue();
        assertThat(violations(validate(schemaJson, "1"))).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.ONE, Violation.Comparison.TOO_SMALL, true));
        assertThat(violations(validate(schemaJson, "3"))).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.valueOf(3), Violation.Comparison.TOO_LARGE, true));
    }

    @Test
    void exclusiveFlagFalseKeepsBoundInclusive() {
        assertThat(validate("{\"maximum\": 3, \"exclusiveMaximum\": false}", "3").valid()).isTrue();
    }

    @Test
    void boundsIgnoreNonNumbers() {
        assertThat(validate("{\"minimum\": 10}", "\"5\"").valid()).isTrue();
        assertThat(validate("{\"maximum\": 0}", "true").valid()).isTrue();
    }

    @Test
    void largeIntegersCompareExactly() {
        var result = validate("{\"maximum\": 9007199254740992}", "9007199254740993");
        assertThat(result.valid()).isFalse();
    }
}
