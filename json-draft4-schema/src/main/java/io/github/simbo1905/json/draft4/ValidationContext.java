package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonValue;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// Mutable per-call evaluation state. Never shared between threads or calls.
///
/// Tracks how deep the evaluation has descended and which references are
/// active for which value instance, so that runaway recursion ends in a
/// violation instead of a `StackOverflowError`.
final class ValidationContext {

  private final int maxDepth;
  private final Set<ActiveRef> activeRefs = new HashSet<>();
  private int depth;

  ValidationContext(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /// Validates a child value (array element or object member) one level deeper.
  ValidationResult descend(Rule rule, String path, JsonValue json) {
    if (depth >= maxDepth) {
      LOG.warning(() -> "ERROR: DEPTH: limit " + maxDepth + " reached at path=" + path);
      return ValidationResult.failure(path, new Violation.DepthLimitExceeded(maxDepth));
    }
    depth++;
    try {
      return rule.validateAt(path, json, this);
    } finally {
      depth--;
    }
  }

  /// Follows a `$ref`, refusing to re-enter the same reference for the same value instance.
  ValidationResult follow(RefRule ref, Rule target, String path, JsonValue json) {
    ActiveRef key = new ActiveRef(ref.key(), json);
    if (!activeRefs.add(key)) {
      LOG.fine(() -> "ref.cycle reference=" + ref.reference() + " path=" + path);
      return ValidationResult.failure(path, new Violation.CyclicReference(ref.reference()));
    }
    try {
      return descend(target, path, json);
    } finally {
      activeRefs.remove(key);
    }
  }

  /// Reference key paired with a value compared by identity.
  private record ActiveRef(String key, JsonValue json) {

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof ActiveRef other)) {
        return false;
      }
      return this.json == other.json && Objects.equals(this.key, other.key);
    }

    @Override
    public int hashCode() {
      return 31 * System.identityHashCode(json) + key.hashCode();
    }
  }
}
