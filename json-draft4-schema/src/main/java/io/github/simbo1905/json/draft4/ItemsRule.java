package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.List;

/// `items` as a single schema: every element must satisfy `item`.
record ItemsRule(Rule item) implements Rule {

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonArray arr)) {
      return ValidationResult.success();
    }
    List<ValidationResult> results = new ArrayList<>(arr.values().size());
    for (int i = 0; i < arr.values().size(); i++) {
      results.add(ctx.descend(item, path + "[" + i + "]", arr.values().get(i)));
    }
    return ValidationResult.merge(results);
  }
}
