package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.Json;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaRefTest extends JsonSchemaTestBase {

    private static final String POSITIVE_INTEGER = """
        {
          "definitions": {
            "positiveInteger": {"type": "integer", "minimum": 0, "exclusiveMinimum": true}
          },
          "properties": {
            "n": {"$ref": "#/definitions/positiveInteger"}
          }
        }
        """;

    @Test
    void refToDefinitionAppliesItsConstraints() {
        var schema = schema(POSITIVE_INTEGER);
        assertThat(schema.validate(Json.parse("{\"n\": 5}")).valid()).isTrue();

        var zero = schema.validate(Json.parse("{\"n\": 0}"));
        assertThat(paths(zero)).containsExactly("n");
        assertThat(violations(zero)).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.ZERO, Violation.Comparison.TOO_SMALL, true));

        var fraction = schema.validate(Json.parse("{\"n\": 1.5}"));
        assertThat(violations(fraction)).containsExactly(new Violation.UnmatchingType(Json.parse("1.5"), "integer"));
    }

    @Test
    void rootRefToDefinitionAppliesItsConstraints() {
        var schema = schema("""
            {
              "$ref": "#/definitions/positiveInteger",
              "definitions": {"positiveInteger": {"type": "integer", "minimum": 0}}
            }
            """);
        assertThat(schema.validate(Json.parse("5")).valid()).isTrue();

        var negative = schema.validate(Json.parse("-5"));
        assertThat(paths(negative)).containsExactly("");
        assertThat(violations(negative)).containsExactly(
            new Violation.ValueBoundsViolation(BigDecimal.ZERO, Violation.Comparison.TOO_SMALL, false));

        var text = schema.validate(Json.parse("\"a\""));
        assertThat(violations(text)).containsExactly(new Violation.UnmatchingType(Json.parse("\"a\""), "integer"));
    }

    @Test
    void unresolvablePointerReportsFailingSegment() {
        var result = validate("{\"$ref\": \"#/missing\"}", "1");
        assertThat(violations(result)).containsExactly(new Violation.ReferenceNotFound("#/missing", "missing"));

        var deeper = validate("{\"definitions\": {}, \"$ref\": \"#/definitions/a\"}", "1");
        assertThat(violations(deeper)).containsExactly(new Violation.ReferenceNotFound("#/definitions/a", "a"));
    }

    @Test
    void refToNonSchemaValueIsNotFound() {
        var result = validate("{\"definitions\": {\"n\": 5}, \"$ref\": \"#/definitions/n\"}", "1");
        assertThat(violations(result)).containsExactly(new Violation.ReferenceNotFound("#/definitions/n", "n"));
    }

    @Test
    void remoteAndPlainNameReferencesAreUnsupported() {
        var remote = validate("{\"$ref\": \"http://example.com/schema.json#/a\"}", "1");
        assertThat(violations(remote)).containsExactly(
            new Violation.RemoteReferenceUnsupported("http://example.com/schema.json#/a"));

        var plainName = validate("{\"$ref\": \"#foo\"}", "1");
        assertThat(violations(plainName)).containsExactly(new Violation.RemoteReferenceUnsupported("#foo"));
    }

    @Test
    void pointerWalksArraysByIndex() {
        String schemaJson = """
            {
              "definitions": {"list": [{"type": "string"}, {"type": "integer"}, 3]},
              "properties": {
                "x": {"$ref": "#/definitions/list/1"},
                "y": {"$ref": "#/definitions/list/5"},
                "z": {"$ref": "#/definitions/list"},
                "w": {"$ref": "#/definitions/list/2"}
              }
            }
            """;
        var schema = schema(schemaJson);
        assertThat(schema.validate(Json.parse("{\"x\": 1}")).valid()).isTrue();
        assertThat(violations(schema.validate(Json.parse("{\"x\": \"s\"}"))))
            .containsExactly(new Violation.UnmatchingType(Json.parse("\"s\""), "integer"));
        assertThat(violations(schema.validate(Json.parse("{\"y\": 1}"))))
            .containsExactly(new Violation.ReferenceNotFound("#/definitions/list/5", "5"));
        assertThat(violations(schema.validate(Json.parse("{\"z\": 1}"))))
            .containsExactly(new Violation.ReferenceNotFound("#/definitions/list", "list"));
        assertThat(violations(schema.validate(Json.parse("{\"w\": 1}"))))
            .containsExactly(new Violation.ReferenceNotFound("#/definitions/list/2", "2"));
    }

    @Test
    void pointerSegmentsAreUnescapedAndPercentDecoded() {
        String schemaJson = """
            {
              "definitions": {
                "a/b": {"type": "string"},
                "t~x": {"type": "integer"},
                "with space": {"type": "boolean"}
              },
              "properties": {
                "p": {"$ref": "#/definitions/a~1b"},
                "q": {"$ref": "#/definitions/t~0x"},
                "r": {"$ref": "#/definitions/with%20space"}
              }
            }
            """;
        var result = validate(schemaJson, "{\"p\": 1, \"q\": \"s\", \"r\": null}");
        assertThat(paths(result)).containsExactly("p", "q", "r");
        assertThat(violations(result)).containsExactly(
            new Violation.UnmatchingType(Json.parse("1"), "string"),
            new Violation.UnmatchingType(Json.parse("\"s\""), "integer"),
            new Violation.UnmatchingType(Json.parse("null"), "boolean"));
    }

    @Test
    void percentEncodedSlashSeparatesSegments() {
        var result = validate("""
            {
              "definitions": {"a": {"b": {"type": "string"}}},
              "$ref": "#/definitions/a%2Fb"
            }
            """, "1");
        assertThat(violations(result)).containsExactly(new Violation.UnmatchingType(Json.parse("1"), "string"));

        var escaped = validate("""
            {
              "definitions": {"a/b": {"type": "integer"}, "a": {"b": {"type": "string"}}},
              "$ref": "#/definitions/a~1b"
            }
            """, "\"x\"");
        assertThat(violations(escaped)).containsExactly(new Violation.UnmatchingType(Json.parse("\"x\""), "integer"));
    }

    @Test
    void percentDecodingLeavesMalformedEscapesAlone() {
        assertThat(SchemaCompiler.percentDecode("a%20b")).isEqualTo("a b");
        assertThat(SchemaCompiler.percentDecode("%C3%A9")).isEqualTo("é");
        assertThat(SchemaCompiler.percentDecode("100%")).isEqualTo("100%");
        assertThat(SchemaCompiler.percentDecode("%zz")).isEqualTo("%zz");
    }

    @Test
    void selfReferenceToRootTerminatesWithCycleViolation() {
        var result = validate("{\"$ref\": \"#\"}", "1");
        assertThat(violations(result)).containsExactly(new Violation.CyclicReference("#"));
        assertThat(paths(result)).containsExactly("");
    }

    @Test
    void mutuallyReferencingDefinitionsTerminate() {
        String schemaJson = """
            {
              "definitions": {
                "a": {"$ref": "#/definitions/b"},
                "b": {"$ref": "#/definitions/a"}
              },
              "$ref": "#/definitions/a"
            }
            """;
        var result = validate(schemaJson, "\"x\"");
        assertThat(violations(result)).containsExactly(new Violation.CyclicReference("#/definitions/a"));
    }

    @Test
    void recursiveTreeSchemaValidatesNestedNodes() {
        String tree = """
            {
              "type": "object",
              "properties": {
                "value": {"type": "integer"},
                "children": {"type": "array", "items": {"$ref": "#"}}
              },
              "required": ["value"]
            }
            """;
        var schema = schema(tree);
        assertThat(schema.validate(Json.parse("""
            {"value": 1, "children": [{"value": 2, "children": [{"value": 3}]}, {"value": 4}]}
            """)).valid()).isTrue();

        var badLeaf = schema.validate(Json.parse("""
            {"value": 1, "children": [{"value": 2, "children": [{"value": "x"}]}]}
            """));
        assertThat(paths(badLeaf)).containsExactly("children[0].children[0].value");

        var missing = schema.validate(Json.parse("{\"value\": 1, \"children\": [{}]}"));
        assertThat(paths(missing)).containsExactly("children[0]");
        assertThat(violations(missing)).containsExactly(new Violation.RequiredMissing(java.util.List.of("value")));
    }

    @Test
    void sharedTargetIsUsedByEveryReference() {
        String schemaJson = """
            {
              "definitions": {"name": {"type": "string", "minLength": 1}},
              "properties": {
                "first": {"$ref": "#/definitions/name"},
                "last": {"$ref": "#/definitions/name"}
              }
            }
            """;
        var result = validate(schemaJson, "{\"first\": \"\", \"last\": 2}");
        assertThat(paths(result)).containsExactly("first", "last");
        assertThat(violations(result)).containsExactly(
            new Violation.LengthViolation(1, Violation.ItemType.STRING, Violation.Comparison.TOO_SMALL),
            new Violation.UnmatchingType(Json.parse("2"), "string"));
    }

    @Test
    void refSiblingsAreStillEvaluated() {
        var result = validate("""
            {"definitions": {"s": {"type": "string"}}, "$ref": "#/definitions/s", "maxLength": 2}
            """, "\"abc\"");
        assertThat(violations(result)).containsExactly(
            new Violation.LengthViolation(2, Violation.ItemType.STRING, Violation.Comparison.TOO_LARGE));
    }
}
