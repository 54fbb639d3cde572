package cafe.woden.logkeeper.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a log entry.
 *
 * <p>Declaration order is severity order: {@code DEBUG} is the least severe, {@code CRITICAL}
 * the most.
 */
public enum LogLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  public int severity() {
    return ordinal();
  }

  public boolean isAtLeast(LogLevel other) {
    return other == null || severity() >= other.severity();
  }

  /** Case-insensitive lookup by name. Blank or unknown names yield an empty result. */
  public static Optional<LogLevel> parse(String raw) {
    if (raw == null) return Optional.empty();
    String s = raw.trim().toUpperCase(Locale.ROOT);
    if (s.isEmpty()) return Optional.empty();
    for (LogLevel level : values()) {
      if (level.name().equals(s)) return Optional.of(level);
    }
    return Optional.empty();
  }
}
