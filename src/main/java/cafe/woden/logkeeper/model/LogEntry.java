package cafe.woden.logkeeper.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A single log event.
 *
 * <p>The timestamp is kept at microsecond resolution so every backend can store it without
 * loss: what a handler persists is exactly what it reads back.
 */
@ValueObject
public record LogEntry(Instant timestamp, LogLevel level, String message) {

  public LogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(message, "message");
    timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
  }

  public static LogEntry of(LogLevel level, String message) {
    return new LogEntry(Instant.now(), level, message);
  }

  public static LogEntry of(LogLevel level, String message, Instant timestamp) {
    return new LogEntry(timestamp, level, message);
  }

  @Override
  public String toString() {
    return "[" + timestamp + "] " + level + ": " + message;
  }
}
