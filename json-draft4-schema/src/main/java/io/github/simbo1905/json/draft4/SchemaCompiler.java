package io.github.simbo1905.json.draft4;

import io.github.simbo1905.json.value.JsonArray;
import io.github.simbo1905.json.value.JsonBoolean;
import io.github.simbo1905.json.value.JsonNumber;
import io.github.simbo1905.json.value.JsonObject;
import io.github.simbo1905.json.value.JsonString;
import io.github.simbo1905.json.value.JsonValue;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;

/// Turns a schema document into a tree of {@link Rule}s.
///
/// One instance per compilation; all state lives in its fields. Every `$ref`
/// is resolved here. Each distinct target is compiled once from a work stack
/// and stored in the table behind {@link ResolverContext}, so a schema that
/// refers to itself compiles in finite time.
final class SchemaCompiler {

  static final String MAX_DEPTH_PROPERTY = "jsonschema.max.depth";

  /// Output of one compilation.
  record Compiled(Rule rule, int maxDepth) {}

  /// A `$ref` target waiting to be compiled.
  private record WorkItem(String key, JsonObject node) {}

  /// Outcome of walking a local pointer: a target or the violation to report.
  private record Resolution(String key, JsonObject target, Violation violation) {
    static Resolution found(String key, JsonObject target) {
      return new Resolution(key, target, null);
    }

    static Resolution failed(Violation violation) {
      return new Resolution(null, null, violation);
    }
  }

  private final JsonObject root;
  private final Map<String, FormatValidator> formats;
  private final int maxDepth;
  private final Map<String, Rule> targets = new LinkedHashMap<>();
  private final ResolverContext resolver = new ResolverContext(targets);
  private final Deque<WorkItem> workStack = new ArrayDeque<>();

  private SchemaCompiler(JsonObject root, JsonSchemaOptions options, int maxDepth) {
    this.root = root;
    this.formats = options.formats();
    this.maxDepth = maxDepth;
  }

  static Compiled compile(JsonObject root, JsonSchemaOptions options) {
    int maxDepth = effectiveMaxDepth(options);
    SchemaCompiler compiler = new SchemaCompiler(root, options, maxDepth);
    Rule rule = compiler.compileSchema(root, 0);
    compiler.targets.put("", rule);
    while (!compiler.workStack.isEmpty()) {
      WorkItem item = compiler.workStack.pop();
      if (compiler.targets.containsKey(item.key())) {
        LOG.finer(() -> "compile: already compiled, skipping pointer '" + item.key() + "'");
        continue;
      }
      LOG.finer(() -> "compile: compiling $ref target '" + item.key() + "'");
      compiler.targets.put(item.key(), compiler.compileSchema(item.node(), 0));
    }
    LOG.fine(() -> "compile: done, targets=" + compiler.resolver.size() + " maxDepth=" + maxDepth);
    return new Compiled(rule, maxDepth);
  }

  /// The system property is read once per compile and wins over the options.
  private static int effectiveMaxDepth(JsonSchemaOptions options) {
    String systemProp = System.getProperty(MAX_DEPTH_PROPERTY);
    if (systemProp == null) {
      return options.maxDepth();
    }
    try {
      int depth = Integer.parseInt(systemProp.trim());
      if (depth > 0) {
        LOG.finest(() -> "compile: maxDepth overridden by system property: " + depth);
        return depth;
      }
    } catch (NumberFormatException e) {
      LOG.warning(() -> "Ignoring non-numeric " + MAX_DEPTH_PROPERTY + "='" + systemProp + "'");
      return options.maxDepth();
    }
    LOG.warning(() -> "Ignoring non-positive " + MAX_DEPTH_PROPERTY + "='" + systemProp + "'");
    return options.maxDepth();
  }

  /// Compiles one schema object into the conjunction of its keyword rules.
  private Rule compileSchema(JsonObject schema, int depth) {
    if (depth >= maxDepth) {
      LOG.warning(() -> "ERROR: DEPTH: schema nesting exceeds " + maxDepth);
      return ConstantRule.failing(new Violation.DepthLimitExceeded(maxDepth));
    }
    trace(schema, depth);
    List<Rule> rules = new ArrayList<>();

    if (schema.get(Keyword.REF.key()) instanceof JsonString ref) {
      rules.add(compileRef(ref.value()));
    }

    JsonValue type = schema.get(Keyword.TYPE.key());
    if (type != null) {
      rules.add(compileType(type));
    }

    schemaList(schema, Keyword.ALL_OF).ifPresent(subs -> {
      for (JsonObject sub : subs) {
        rules.add(compileSchema(sub, depth + 1));
      }
    });
    schemaList(schema, Keyword.ANY_OF).ifPresent(subs -> rules.add(new AnyOfRule(compileAll(subs, depth + 1))));
    schemaList(schema, Keyword.ONE_OF).ifPresent(subs -> rules.add(new OneOfRule(compileAll(subs, depth + 1))));

    if (schema.get(Keyword.NOT.key()) instanceof JsonObject not) {
      rules.add(new NotRule(compileSchema(not, depth + 1)));
    }

    if (schema.get(Keyword.ENUM.key()) instanceof JsonArray values) {
      rules.add(new EnumRule(values));
    }

    length(schema, Keyword.MAX_LENGTH, Violation.ItemType.STRING, Violation.Comparison.TOO_LARGE).ifPresent(rules::add);
    length(schema, Keyword.MIN_LENGTH, Violation.ItemType.STRING, Violation.Comparison.TOO_SMALL).ifPresent(rules::add);

    if (schema.get(Keyword.PATTERN.key()) instanceof JsonString pattern) {
      rules.add(new PatternRule(pattern.value(), compileRegex(pattern.value())));
    }

    if (schema.get(Keyword.MULTIPLE_OF.key()) instanceof JsonNumber divisor) {
      rules.add(new MultipleOfRule(divisor.toBigDecimal()));
    }

    if (schema.get(Keyword.MINIMUM.key()) instanceof JsonNumber min) {
      rules.add(new BoundRule(min.toBigDecimal(), Violation.Comparison.TOO_SMALL,
          flag(schema, Keyword.EXCLUSIVE_MINIMUM)));
    }
    if (schema.get(Keyword.MAXIMUM.key()) instanceof JsonNumber max) {
      rules.add(new BoundRule(max.toBigDecimal(), Violation.Comparison.TOO_LARGE,
          flag(schema, Keyword.EXCLUSIVE_MAXIMUM)));
    }

    length(schema, Keyword.MIN_ITEMS, Violation.ItemType.ARRAY, Violation.Comparison.TOO_SMALL).ifPresent(rules::add);
    length(schema, Keyword.MAX_ITEMS, Violation.ItemType.ARRAY, Violation.Comparison.TOO_LARGE).ifPresent(rules::add);

    if (flag(schema, Keyword.UNIQUE_ITEMS)) {
      rules.add(UniqueItemsRule.INSTANCE);
    }

    compileItems(schema, depth).ifPresent(rules::add);

    length(schema, Keyword.MAX_PROPERTIES, Violation.ItemType.PROPERTIES, Violation.Comparison.TOO_LARGE).ifPresent(rules::add);
    length(schema, Keyword.MIN_PROPERTIES, Violation.ItemType.PROPERTIES, Violation.Comparison.TOO_SMALL).ifPresent(rules::add);

    if (schema.get(Keyword.REQUIRED.key()) instanceof JsonArray required) {
      stringList(required).ifPresentOrElse(
          names -> rules.add(new RequiredRule(names)),
          () -> ignored(Keyword.REQUIRED, required));
    }

    compileProperties(schema, depth).ifPresent(rules::add);

    if (schema.get(Keyword.DEPENDENCIES.key()) instanceof JsonObject dependencies) {
      compileDependencies(dependencies, depth, rules);
    }

    if (schema.get(Keyword.FORMAT.key()) instanceof JsonString format) {
      rules.add(compileFormat(format.value()));
    }

    return rules.size() == 1 ? rules.get(0) : new AllOfRule(rules);
  }

  private List<Rule> compileAll(List<JsonObject> schemas, int depth) {
    List<Rule> compiled = new ArrayList<>(schemas.size());
    for (JsonObject sub : schemas) {
      compiled.add(compileSchema(sub, depth));
    }
    return compiled;
  }

  private static Rule compileType(JsonValue type) {
    if (type instanceof JsonString name) {
      return new TypeRule(name.value());
    }
    if (type instanceof JsonArray names) {
      Optional<List<String>> strings = stringList(names);
      if (strings.isPresent()) {
        List<Rule> branches = new ArrayList<>();
        for (String name : strings.get()) {
          branches.add(new TypeRule(name));
        }
        return new AnyOfRule(branches);
      }
    }
    LOG.warning(() -> "Invalid 'type' keyword value: " + type);
    return ConstantRule.failing(new Violation.InvalidType(type));
  }

  private Rule compileFormat(String name) {
    FormatValidator validator = formats.get(name);
    if (validator == null) {
      LOG.fine(() -> "format: no validator registered for '" + name + "'");
      return ConstantRule.failing(new Violation.FormatUnsupported(name));
    }
    return new FormatRule(name, validator);
  }

  private Optional<Rule> compileItems(JsonObject schema, int depth) {
    JsonValue items = schema.get(Keyword.ITEMS.key());
    if (items instanceof JsonObject single) {
      return Optional.of(new ItemsRule(compileSchema(single, depth + 1)));
    }
    if (items instanceof JsonArray) {
      Optional<List<JsonObject>> positional = schemaList(schema, Keyword.ITEMS);
      if (positional.isPresent()) {
        Rule additional = additional(schema.get(Keyword.ADDITIONAL_ITEMS.key()), Violation.ItemType.ARRAY, depth);
        return Optional.of(new TupleItemsRule(compileAll(positional.get(), depth + 1), additional));
      }
    }
    return Optional.empty();
  }

  private Optional<Rule> compileProperties(JsonObject schema, int depth) {
    JsonValue properties = schema.get(Keyword.PROPERTIES.key());
    JsonValue patternProperties = schema.get(Keyword.PATTERN_PROPERTIES.key());
    JsonValue additionalProperties = schema.get(Keyword.ADDITIONAL_PROPERTIES.key());
    if (properties == null && patternProperties == null && additionalProperties == null) {
      return Optional.empty();
    }

    Map<String, Rule> named = new LinkedHashMap<>();
    if (properties instanceof JsonObject props) {
      props.members().forEach((name, sub) -> {
        if (sub instanceof JsonObject subSchema) {
          named.put(name, compileSchema(subSchema, depth + 1));
        } else {
          ignored(Keyword.PROPERTIES, sub);
        }
      });
    }

    List<PropertiesRule.PatternProperty> patterns = new ArrayList<>();
    if (patternProperties instanceof JsonObject props) {
      props.members().forEach((regex, sub) -> {
        if (sub instanceof JsonObject subSchema) {
          patterns.add(new PropertiesRule.PatternProperty(regex, compileRegex(regex), compileSchema(subSchema, depth + 1)));
        } else {
          ignored(Keyword.PATTERN_PROPERTIES, sub);
        }
      });
    }

    Rule additional = additional(additionalProperties, Violation.ItemType.PROPERTIES, depth);
    return Optional.of(new PropertiesRule(named, patterns, additional));
  }

  /// `additionalItems` / `additionalProperties`: a schema, `false`, or anything else meaning allowed.
  private Rule additional(JsonValue value, Violation.ItemType itemType, int depth) {
    if (value instanceof JsonObject schema) {
      return compileSchema(schema, depth + 1);
    }
    if (value instanceof JsonBoolean allowed && !allowed.value()) {
      return ConstantRule.failing(new Violation.AdditionalItemsOrProperties(itemType));
    }
    return ConstantRule.VALID;
  }

  private void compileDependencies(JsonObject dependencies, int depth, List<Rule> rules) {
    dependencies.members().forEach((key, dependency) -> {
      if (dependency instanceof JsonObject schema) {
        rules.add(DependencyRule.onSchema(key, compileSchema(schema, depth + 1)));
      } else if (dependency instanceof JsonArray names && stringList(names).isPresent()) {
        rules.add(DependencyRule.onProperties(key, stringList(names).get()));
      } else {
        ignored(Keyword.DEPENDENCIES, dependency);
      }
    });
  }

  private Rule compileRef(String reference) {
    Resolution resolution = resolve(reference);
    if (resolution.violation() != null) {
      LOG.fine(() -> "ref.unresolved reference=" + reference + " violation=" + resolution.violation());
      return ConstantRule.failing(resolution.violation());
    }
    if (!targets.containsKey(resolution.key())) {
      LOG.finer(() -> "ref.schedule reference=" + reference + " key='" + resolution.key() + "'");
      workStack.push(new WorkItem(resolution.key(), resolution.target()));
    }
    return new RefRule(reference, resolution.key(), resolver);
  }

  /// Walks a local pointer such as `#/definitions/a` from the document root.
  ///
  /// Object members are entered directly. An array member takes the next
  /// segment as its index. Every step must land on an object.
  private Resolution resolve(String reference) {
    LOG.fine(() -> "pointer.navigate reference=" + reference);
    if (!reference.startsWith("#")) {
      return Resolution.failed(new Violation.RemoteReferenceUnsupported(reference));
    }
    // %2F decodes to a separator, so the whole fragment is decoded before splitting
    String fragment = percentDecode(reference.substring(1));
    if (fragment.isEmpty()) {
      return Resolution.found("", root);
    }
    if (!fragment.startsWith("/")) {
      return Resolution.failed(new Violation.RemoteReferenceUnsupported(reference));
    }

    String[] tokens = fragment.substring(1).split("/", -1);
    List<String> segments = new ArrayList<>(tokens.length);
    for (String token : tokens) {
      segments.add(token.replace("~1", "/").replace("~0", "~"));
    }

    JsonObject current = root;
    StringBuilder key = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      String segment = segments.get(i);
      JsonValue next = current.get(segment);
      key.append('/').append(escape(segment));
      if (next instanceof JsonObject obj) {
        current = obj;
      } else if (next instanceof JsonArray arr) {
        if (i + 1 >= segments.size()) {
          return notFound(reference, segment);
        }
        String indexSegment = segments.get(++i);
        Optional<JsonObject> element = element(arr, indexSegment);
        if (element.isEmpty()) {
          return notFound(reference, indexSegment);
        }
        current = element.get();
        key.append('/').append(Integer.parseInt(indexSegment));
      } else {
        return notFound(reference, segment);
      }
    }
    return Resolution.found(key.toString(), current);
  }

  private static Resolution notFound(String reference, String segment) {
    LOG.finer(() -> "pointer.notFound reference=" + reference + " segment='" + segment + "'");
    return Resolution.failed(new Violation.ReferenceNotFound(reference, segment));
  }

  private static Optional<JsonObject> element(JsonArray arr, String indexSegment) {
    if (indexSegment.isEmpty() || !indexSegment.chars().allMatch(Character::isDigit)) {
      return Optional.empty();
    }
    try {
      int index = Integer.parseInt(indexSegment);
      if (index >= arr.values().size()) {
        return Optional.empty();
      }
      return arr.values().get(index) instanceof JsonObject obj ? Optional.of(obj) : Optional.empty();
    } catch (NumberFormatException e) {
      LOG.finer(() -> "pointer: index out of int range '" + indexSegment + "'");
      return Optional.empty();
    }
  }

  private static String escape(String segment) {
    return segment.replace("~", "~0").replace("/", "~1");
  }

  /// Decodes `%XX` escapes as UTF-8. A `%` not followed by two hex digits stays literal.
  static String percentDecode(String token) {
    if (token.indexOf('%') < 0) {
      return token;
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(token.length());
    int i = 0;
    while (i < token.length()) {
      char ch = token.charAt(i);
      if (ch == '%' && i + 2 < token.length() && hex(token.charAt(i + 1)) >= 0 && hex(token.charAt(i + 2)) >= 0) {
        bytes.write(hex(token.charAt(i + 1)) * 16 + hex(token.charAt(i + 2)));
        i += 3;
      } else {
        int cp = token.codePointAt(i);
        byte[] encoded = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
        bytes.write(encoded, 0, encoded.length);
        i += Character.charCount(cp);
      }
    }
    return bytes.toString(StandardCharsets.UTF_8);
  }

  private static int hex(char ch) {
    return Character.digit(ch, 16);
  }

  private static Pattern compileRegex(String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      LOG.warning(() -> "Invalid regex '" + regex + "': " + e.getDescription());
      return null;
    }
  }

  private static boolean flag(JsonObject schema, Keyword keyword) {
    return schema.get(keyword.key()) instanceof JsonBoolean b && b.value();
  }

  private static Optional<Rule> length(JsonObject schema, Keyword keyword,
                                       Violation.ItemType itemType, Violation.Comparison comparison) {
    JsonValue value = schema.get(keyword.key());
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof JsonNumber n && n.isIntegral()) {
      BigDecimal bound = n.toBigDecimal();
      long clamped = bound.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0 ? Long.MAX_VALUE
          : bound.compareTo(BigDecimal.valueOf(Long.MIN_VALUE)) < 0 ? Long.MIN_VALUE
          : bound.longValueExact();
      return Optional.of(new LengthRule(clamped, itemType, comparison));
    }
    ignored(keyword, value);
    return Optional.empty();
  }

  /// {@return the elements if `keyword` holds an array made only of objects}
  private static Optional<List<JsonObject>> schemaList(JsonObject schema, Keyword keyword) {
    JsonValue value = schema.get(keyword.key());
    if (!(value instanceof JsonArray arr)) {
      if (value != null) {
        ignored(keyword, value);
      }
      return Optional.empty();
    }
    List<JsonObject> schemas = new ArrayList<>(arr.values().size());
    for (JsonValue element : arr.values()) {
      if (!(element instanceof JsonObject obj)) {
        ignored(keyword, value);
        return Optional.empty();
      }
      schemas.add(obj);
    }
    return Optional.of(schemas);
  }

  private static Optional<List<String>> stringList(JsonArray arr) {
    List<String> strings = new ArrayList<>(arr.values().size());
    for (JsonValue element : arr.values()) {
      if (!(element instanceof JsonString s)) {
        return Optional.empty();
      }
      strings.add(s.value());
    }
    return Optional.of(strings);
  }

  private static void ignored(Keyword keyword, JsonValue value) {
    LOG.warning(() -> "Ignoring '" + keyword.key() + "' with unexpected value: " + value);
  }

  private static void trace(JsonObject schema, int depth) {
    if (LOG.isLoggable(Level.FINEST)) {
      LOG.finest(() -> "compileSchema: depth=" + depth + " keys=" + schema.members().keySet());
    }
  }
}
