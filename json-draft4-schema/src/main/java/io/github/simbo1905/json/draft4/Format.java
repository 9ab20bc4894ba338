package io.github.simbo1905.json.draft4;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.regex.Pattern;

/// Built-in format validators.
///
/// Only {@link #IPV4} and {@link #IPV6} are registered by default. The others
/// are added by {@link JsonSchemaOptions#withStandardFormats()}.
public enum Format implements FormatValidator {

  IPV4("ipv4") {
    private final Pattern dottedQuad = Pattern.compile(
        "(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\."
            + "(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)");

    @Override
    public boolean test(String s) {
      return dottedQuad.matcher(s).matches();
    }

    @Override
    public Violation violation(String format, String value) {
      return new Violation.InvalidIp(value, Violation.IpVersion.V4);
    }
  },

  IPV6("ipv6") {
    // Leading hex digit or colon keeps InetAddress on the literal parser, never DNS
    private final Pattern literal = Pattern.compile("[0-9A-Fa-f:][0-9A-Fa-f:.]*");

    @Override
    public boolean test(String s) {
      if (!s.contains(":") || !literal.matcher(s).matches()) {
        return false;
      }
      try {
        InetAddress.getByName(s);
        return true;
      } catch (UnknownHostException e) {
        return false;
      }
    }

    @Override
    public Violation violation(String format, String value) {
      return new Violation.InvalidIp(value, Violation.IpVersion.V6);
    }
  },

  EMAIL("email") {
    @Override
    public boolean test(String s) {
      // RFC-5322-lite: no whitespace, one @, a dot in the domain, no consecutive dots
      return s.matches("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$") && !s.contains("..");
    }
  },

  HOSTNAME("hostname") {
    @Override
    public boolean test(String s) {
      if (s.isEmpty() || s.length() > 255) return false;
      for (String label : s.split("\\.", -1)) {
        if (label.isEmpty() || label.length() > 63) return false;
        if (label.startsWith("-") || label.endsWith("-")) return false;
        if (!label.matches("^[a-zA-Z0-9-]+$")) return false;
      }
      return true;
    }
  },

  URI("uri") {
    @Override
    public boolean test(String s) {
      try {
        java.net.URI uri = new java.net.URI(s);
        return uri.isAbsolute();
      } catch (java.net.URISyntaxException e) {
        return false;
      }
    }
  },

  DATE_TIME("date-time") {
    @Override
    public boolean test(String s) {
      try {
        java.time.OffsetDateTime.parse(s);
        return true;
      } catch (java.time.format.DateTimeParseException e) {
        return false;
      }
    }
  };

  private final String formatName;

  Format(String formatName) {
    this.formatName = formatName;
  }

  /// {@return the name used in schema documents, e.g. `date-time`}
  public String formatName() {
    return formatName;
  }

  /// Get format validator by its schema name
  public static Optional<Format> byName(String name) {
    for (Format format : values()) {
      if (format.formatName.equals(name)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
