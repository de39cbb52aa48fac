package com.consullo.errorjournal.dump;

import org.apache.commons.lang3.Validate;
import org.slf4j.event.Level;

/**
 * Logging dump configuration values.
 *
 * @param level level at which dump lines are logged
 * @param indent prefix for the per-error lines below the dump header
 * @since 1.0
 */
public record DumpConfig(
    Level level,
    String indent) {

  public DumpConfig {
    Validate.notNull(level, "level must not be null");
    Validate.notNull(indent, "indent must not be null");
  }

  /**
   * Returns the configuration used by {@code ErrorJournal.dump(from, reverse)}: ERROR level, two-space indent.
   *
   * @return default configuration
   */
  public static DumpConfig defaults() {
    return new DumpConfig(Level.ERROR, "  ");
  }

  /**
   * Returns a copy of this configuration logging at {@code level}.
   *
   * @param level new level
   * @return configuration
   */
  public DumpConfig withLevel(Level level) {
    return new DumpConfig(level, indent);
  }
}
