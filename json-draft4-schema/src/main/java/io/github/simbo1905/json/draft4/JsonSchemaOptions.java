package io.github.simbo1905.json.draft4;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable compile-time options.
///
/// @param maxDepth ceiling on nesting during compilation and on recursion during
///                 validation; the system property `jsonschema.max.depth`
///                 overrides it when a schema is compiled
/// @param formats  validators for the `format` keyword keyed by format name;
///                 names missing here make `format` report
///                 {@link Violation.FormatUnsupported}
public record JsonSchemaOptions(int maxDepth, Map<String, FormatValidator> formats) {

  public static final int DEFAULT_MAX_DEPTH = 512;

  /// Depth 512 with the `ipv4` and `ipv6` formats.
  public static final JsonSchemaOptions DEFAULT = new JsonSchemaOptions(DEFAULT_MAX_DEPTH,
      Map.of(Format.IPV4.formatName(), Format.IPV4, Format.IPV6.formatName(), Format.IPV6));

  public JsonSchemaOptions {
    if (maxDepth < 1) {
      throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
    }
    Objects.requireNonNull(formats, "formats");
    Map<String, FormatValidator> copy = new LinkedHashMap<>();
    formats.forEach((name, validator) -> copy.put(
        Objects.requireNonNull(name, "format name"),
        Objects.requireNonNull(validator, "validator for format " + name)));
    formats = Collections.unmodifiableMap(copy);
  }

  public JsonSchemaOptions withMaxDepth(int maxDepth) {
    return new JsonSchemaOptions(maxDepth, formats);
  }

  /// {@return options that also validate `format: name` with `validator`}
  /// Replaces any validator already registered under `name`, built-ins included.
  public JsonSchemaOptions withFormat(String name, FormatValidator validator) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(validator, "validator");
    Map<String, FormatValidator> next = new LinkedHashMap<>(formats);
    next.put(name, validator);
    return new JsonSchemaOptions(maxDepth, next);
  }

  /// {@return options with every {@link Format} registered}
  /// Adds `date-time`, `email`, `hostname` and `uri` to the defaults.
  public JsonSchemaOptions withStandardFormats() {
    Map<String, FormatValidator> next = new LinkedHashMap<>(formats);
    for (Format format : Format.values()) {
      next.putIfAbsent(format.formatName(), format);
    }
    return new JsonSchemaOptions(maxDepth, next);
  }

  String summary() {
    return "maxDepth=" + maxDepth + ", formats=" + formats.keySet();
  }
}
