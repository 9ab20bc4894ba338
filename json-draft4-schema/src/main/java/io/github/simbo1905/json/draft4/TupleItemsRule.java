package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// `items` as an array of schemas: element `i` is validated against `items[i]`
/// and elements past the end against `additional` (`additionalItems`).
record TupleItemsRule(List<Rule> items, Rule additional) implements Rule {

  TupleItemsRule {
    items = List.copyOf(items);
    Objects.requireNonNull(additional, "additional");
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonArray arr)) {
      return ValidationResult.success();
    }
    List<ValidationResult> results = new ArrayList<>(arr.values().size());
    for (int i = 0; i < arr.values().size(); i++) {
      Rule rule = i < items.size() ? items.get(i) : additional;
      results.add(ctx.descend(rule, path + "[" + i + "]", arr.values().get(i)));
    }
    return ValidationResult.merge(results);
  }
}
