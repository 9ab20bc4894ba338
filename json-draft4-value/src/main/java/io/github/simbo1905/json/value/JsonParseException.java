package io.github.simbo1905.json.value;

/// Signals that JSON text handed to {@link Json#parse(String)} is not well formed.
public final class JsonParseException extends RuntimeException {

  private final long line;
  private final long column;

  JsonParseException(String message, long line, long column, Throwable cause) {
    super(message, cause);
    this.line = line;
    this.column = column;
  }

  /// {@return the 1-based line of the failure, or -1 when unknown}
  public long line() {
    return line;
  }

  /// {@return the 1-based column of the failure, or -1 when unknown}
  public long column() {
    return column;
  }
}
