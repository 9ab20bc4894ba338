package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonNull;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ValidationResultTest extends JsonSchemaTestBase {

    private static final ValidationError FIRST = new ValidationError("a", new Violation.OneOfFailed(0));
    private static final ValidationError SECOND = new ValidationError("b", new Violation.NotFailed(JsonNull.of()));

    @Test
    void validIffNoErrors() {
        assertThat(ValidationResult.success().valid()).isTrue();
        assertThat(ValidationResult.success().errors()).isEmpty();
        assertThatThrownBy(() -> new ValidationResult(true, List.of(FIRST))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ValidationResult.failure(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeKeepsOrderAndDuplicates() {
        var merged = ValidationResult.merge(List.of(
            ValidationResult.failure(List.of(FIRST)),
            ValidationResult.success(),
            ValidationResult.failure(List.of(SECOND, FIRST))));
        assertThat(merged.valid()).isFalse();
        assertThat(merged.errors()).containsExactly(FIRST, SECOND, FIRST);
        assertThat(ValidationResult.merge(List.of(ValidationResult.success(), ValidationResult.success())).valid()).isTrue();
    }

    @Test
    void errorsAreImmutable() {
        var result = ValidationResult.failure(List.of(FIRST));
        assertThatThrownBy(() -> result.errors().add(SECOND)).isInstanceOf(UnsupportedOperationException.class);
    }
}
