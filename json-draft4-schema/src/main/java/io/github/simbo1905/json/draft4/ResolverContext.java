package io.github.simbo1905.json.draft4;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/// Table of compiled `$ref` targets keyed by decoded JSON pointer (`""` is the root).
///
/// The compiler fills the backing map while it works and never touches it once
/// compilation has finished, so lookups during validation see a frozen table.
/// A class rather than a record: equality and `toString` must not walk a rule
/// graph that can point back at itself.
final class ResolverContext {

  private final Map<String, Rule> targets;

  ResolverContext(Map<String, Rule> targets) {
    this.targets = Collections.unmodifiableMap(Objects.requireNonNull(targets, "targets"));
  }

  /// {@return the compiled rule for `key`}
  /// @throws IllegalStateException if nothing was compiled under `key`
  Rule target(String key) {
    Rule rule = targets.get(key);
    if (rule == null) {
      throw new IllegalStateException("No compiled target for pointer '" + key + "'");
    }
    return rule;
  }

  int size() {
    return targets.size();
  }

  @Override
  public String toString() {
    return "ResolverContext[targets=" + targets.keySet() + "]";
  }
}
