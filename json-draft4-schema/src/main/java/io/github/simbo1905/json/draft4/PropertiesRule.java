package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// `properties`, `patternProperties` and `additionalProperties` evaluated together.
///
/// Names listed in `properties` count as covered whether or not the value has
/// them. Each pattern covers every member name it finds a match in. Members
/// left uncovered are validated against `additional`.
///
/// Errors come in three runs: `properties` in schema order, then each pattern
/// in schema order, then uncovered members in value order.
record PropertiesRule(Map<String, Rule> properties, List<PatternProperty> patterns, Rule additional) implements Rule {

  PropertiesRule {
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    patterns = List.copyOf(patterns);
    Objects.requireNonNull(additional, "additional");
  }

  /// One `patternProperties` entry. `compiled` is `null` for a malformed regex.
  record PatternProperty(String pattern, Pattern compiled, Rule rule) {}

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    if (!(json instanceof JsonObject obj)) {
      return ValidationResult.success();
    }
    Map<String, JsonValue> members = obj.members();
    Set<String> covered = new HashSet<>(properties.keySet());
    List<ValidationResult> results = new ArrayList<>();

    for (var entry : properties.entrySet()) {
      JsonValue member = members.get(entry.getKey());
      if (member != null) {
        results.add(ctx.descend(entry.getValue(), memberPath(path, entry.getKey()), member));
      }
    }

    for (PatternProperty pp : patterns) {
      if (pp.compiled() == null) {
        LOG.fine(() -> "patternProperties: invalid regex '" + pp.pattern() + "' at path=" + path);
        return ValidationResult.failure(path, new Violation.InvalidRegex(pp.pattern()));
      }
      for (var member : members.entrySet()) {
        if (pp.compiled().matcher(member.getKey()).find()) {
          covered.add(member.getKey());
          results.add(ctx.descend(pp.rule(), memberPath(path, member.getKey()), member.getValue()));
        }
      }
    }

    for (var member : members.entrySet()) {
      if (!covered.contains(member.getKey())) {
        results.add(ctx.descend(additional, memberPath(path, member.getKey()), member.getValue()));
      }
    }
    return ValidationResult.merge(results);
  }

  static String memberPath(String path, String name) {
    return path.isEmpty() ? name : path + "." + name;
  }
}
