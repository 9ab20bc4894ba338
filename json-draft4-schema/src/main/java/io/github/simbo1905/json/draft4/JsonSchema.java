/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// JSON Schema draft-4 public API entry point
///
/// A compiled schema owns its document, the format registry and the rule tree
/// built from them. It is immutable and safe to share between threads.
///
/// ## Usage
/// ```java
/// // Compile schema once (thread-safe, reusable)
/// JsonSchema schema = JsonSchema.compile(Json.parse(schemaJson));
///
/// // Validate JSON documents
/// ValidationResult result = schema.validate(Json.parse(jsonDoc));
///
/// if (!result.valid()) {
///     for (var error : result.errors()) {
///         LOG.info(error.path() + ": " + error.message());
///     }
/// }
/// ```
///
/// Problems with the schema itself (bad regexes, unresolvable `$ref`s, unknown
/// formats) are reported as violations when a value reaches them, never thrown.
public final class JsonSchema {

  private final JsonObject document;
  private final JsonSchemaOptions options;
  private final Rule rule;
  private final int maxDepth;

  private JsonSchema(JsonObject document, JsonSchemaOptions options, SchemaCompiler.Compiled compiled) {
    this.document = document;
    this.options = options;
    this.rule = compiled.rule();
    this.maxDepth = compiled.maxDepth();
  }

  /// Factory method to create schema from JSON Schema document
  ///
  /// @param schemaJson JSON Schema document as JsonValue
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if the document is not a JSON object
  public static JsonSchema compile(JsonValue schemaJson) {
    return compile(schemaJson, JsonSchemaOptions.DEFAULT);
  }

  /// Factory method to create schema from JSON Schema document with options
  ///
  /// @param schemaJson JSON Schema document as JsonValue
  /// @param options compilation options
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if the document is not a JSON object
  public static JsonSchema compile(JsonValue schemaJson, JsonSchemaOptions options) {
    Objects.requireNonNull(schemaJson, "schemaJson");
    Objects.requireNonNull(options, "options");
    if (!(schemaJson instanceof JsonObject document)) {
      throw new IllegalArgumentException("Schema document must be a JSON object but was " + schemaJson.typeName());
    }
    LOG.fine(() -> "JsonSchema.compile start options=" + options.summary() + " keys=" + document.members().keySet());
    JsonSchema result = new JsonSchema(document, options, SchemaCompiler.compile(document, options));
    LOG.fine(() -> "JsonSchema.compile done");
    return result;
  }

  /// Validates `value` against `schemaDocument` in one step.
  ///
  /// Compiles on every call; keep a compiled {@link JsonSchema} to validate many values.
  public static ValidationResult validate(JsonValue value, JsonValue schemaDocument) {
    return compile(schemaDocument).validate(value);
  }

  /// Validates JSON document against this schema
  ///
  /// @param json JSON value to validate
  /// @return ValidationResult listing every violation found
  public ValidationResult validate(JsonValue json) {
    Objects.requireNonNull(json, "json");
    ValidationResult result = rule.validateAt("", json, new ValidationContext(maxDepth));
    LOG.fine(() -> "validate: valid=" + result.valid() + " errors=" + result.errors().size());
    return result;
  }

  /// {@return the root `title`, if it is a string}
  public Optional<String> title() {
    return stringMember(Keyword.TITLE);
  }

  /// {@return the root `description`, if it is a string}
  public Optional<String> description() {
    return stringMember(Keyword.DESCRIPTION);
  }

  /// {@return the recognised names of the root `type`, empty when absent}
  public List<Type> type() {
    JsonValue type = document.get(Keyword.TYPE.key());
    List<Type> types = new ArrayList<>();
    if (type instanceof JsonString name) {
      Type.byName(name.value()).ifPresent(types::add);
    } else if (type instanceof JsonArray names) {
      for (JsonValue element : names.values()) {
        if (element instanceof JsonString name) {
          Type.byName(name.value()).ifPresent(types::add);
        }
      }
    }
    return List.copyOf(types);
  }

  /// {@return the root `properties` object, if present}
  public Optional<JsonObject> properties() {
    return document.get(Keyword.PROPERTIES.key()) instanceof JsonObject props ? Optional.of(props) : Optional.empty();
  }

  public JsonObject document() {
    return document;
  }

  /// {@return the options passed to {@link #compile(JsonValue, JsonSchemaOptions)}}
  /// A `jsonschema.max.depth` override is not reflected here.
  public JsonSchemaOptions options() {
    return options;
  }

  private Optional<String> stringMember(Keyword keyword) {
    return document.get(keyword.key()) instanceof JsonString s ? Optional.of(s.value()) : Optional.empty();
  }

  @Override
  public String toString() {
    return "JsonSchema[" + document + "]";
  }
}
