package io.github.simbo1905.json.draft4;

/// Schema keywords understood by the compiler. Other keys are ignored.
enum Keyword {
  TITLE("title"),
  DESCRIPTION("description"),
  REF("$ref"),
  TYPE("type"),
  ALL_OF("allOf"),
  ANY_OF("anyOf"),
  ONE_OF("oneOf"),
  NOT("not"),
  ENUM("enum"),
  MAX_LENGTH("maxLength"),
  MIN_LENGTH("minLength"),
  PATTERN("pattern"),
  MULTIPLE_OF("multipleOf"),
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  EXCLUSIVE_MINIMUM("exclusiveMinimum"),
  EXCLUSIVE_MAXIMUM("exclusiveMaximum"),
  MIN_ITEMS("minItems"),
  MAX_ITEMS("maxItems"),
  UNIQUE_ITEMS("uniqueItems"),
  ITEMS("items"),
  ADDITIONAL_ITEMS("additionalItems"),
  MAX_PROPERTIES("maxProperties"),
  MIN_PROPERTIES("minProperties"),
  REQUIRED("required"),
  PROPERTIES("properties"),
  PATTERN_PROPERTIES("patternProperties"),
  ADDITIONAL_PROPERTIES("additionalProperties"),
  DEPENDENCIES("dependencies"),
  FORMAT("format");

  private final String key;

  Keyword(String key) {
    this.key = key;
  }

  String key() {
    return key;
  }
}
