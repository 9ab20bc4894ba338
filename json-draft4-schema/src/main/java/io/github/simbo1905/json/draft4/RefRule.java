package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.Objects;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// A resolved local `$ref`. `reference` is the text as written, `key` the
/// decoded pointer it resolved to.
record RefRule(String reference, String key, ResolverContext resolver) implements Rule {

  RefRule {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  public ValidationResult validateAt(String path, JsonValue json, ValidationContext ctx) {
    LOG.finest(() -> "ref.follow reference=" + reference + " path=" + path);
    return ctx.follow(this, resolver.target(key), path, json);
  }
}
