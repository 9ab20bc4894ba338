package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.Json;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaDepthTest extends JsonSchemaTestBase {

    private static final String NESTED_ARRAYS = "{\"items\": {\"$ref\": \"#\"}}";

    @Test
    void deepValueStopsAtDepthLimit() {
        var schema = JsonSchema.compile(Json.parse(NESTED_ARRAYS), JsonSchemaOptions.DEFAULT.withMaxDepth(3));
        var result = schema.validate(Json.parse("[[[[[]]]]]"));
        assertThat(violations(result)).containsExactly(new Violation.DepthLimitExceeded(3));
        assertThat(schema.validate(Json.parse("[[]]")).valid()).isTrue();
    }

    @Test
    void defaultDepthAllowsOrdinaryNesting() {
        var result = validate(NESTED_ARRAYS, "[[[[[[[[[[[]]]]]]]]]]]");
        assertThat(result.valid()).isTrue();
    }

    @Test
    void deepSchemaStopsAtDepthLimit() {
        var schema = JsonSchema.compile(Json.parse("""
            {"properties": {"a": {"properties": {"b": {"type": "string"}}}}}
            """), JsonSchemaOptions.DEFAULT.withMaxDepth(2));
        var result = schema.validate(Json.parse("{\"a\": {\"b\": \"x\"}}"));
        assertThat(paths(result)).containsExactly("a.b");
        assertThat(violations(result)).containsExactly(new Violation.DepthLimitExceeded(2));
        assertThat(schema.validate(Json.parse("{\"a\": {}}")).valid()).isTrue();
    }

    @Test
    void systemPropertyOverridesConfiguredDepth() {
        withDepthProperty("3", () -> {
            var result = validate(NESTED_ARRAYS, "[[[[[]]]]]");
            assertThat(violations(result)).containsExactly(new Violation.DepthLimitExceeded(3));
        });
    }

    @Test
    void unparseableSystemPropertyFallsBackToOptions() {
        withDepthProperty("deep", () -> assertThat(validate(NESTED_ARRAYS, "[[[[[]]]]]").valid()).isTrue());
    }

    @Test
    void depthPropertyIsRestoredAfterOverride() {
        String before = System.getProperty(SchemaCompiler.MAX_DEPTH_PROPERTY);
        withDepthProperty("7", () -> {
            withDepthProperty("deep", () -> assertThat(System.getProperty(SchemaCompiler.MAX_DEPTH_PROPERTY)).isEqualTo("deep"));
            assertThat(System.getProperty(SchemaCompiler.MAX_DEPTH_PROPERTY)).isEqualTo("7");
        });
        assertThat(System.getProperty(SchemaCompiler.MAX_DEPTH_PROPERTY)).isEqualTo(before);
    }

    private static void withDepthProperty(String value, Runnable body) {
        String previous = System.getProperty(SchemaCompiler.MAX_DEPTH_PROPERTY);
        System.setProperty(SchemaCompiler.MAX_DEPTH_PROPERTY, value);
        try {
            body.run();
        } finally {
            if (previous == null) {
                System.clearProperty(SchemaCompiler.MAX_DEPTH_PROPERTY);
            } else {
                System.setProperty(SchemaCompiler.MAX_DEPTH_PROPERTY, previous);
            }
        }
    }
}
