package io.github.simbo1905.json.draft4;

import java.util.logging.Logger;

/// Centralized logger for the draft-4 schema subsystem.
/// All classes must use this logger via:
///   import static io.github.simbo1905.json.draft4.SchemaLogging.LOG;
final class SchemaLogging {
  static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.draft4");
  private SchemaLogging() {}
}
