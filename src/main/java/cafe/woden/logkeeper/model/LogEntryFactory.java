package cafe.woden.logkeeper.model;

import java.time.Clock;
import java.util.Objects;

/** Stamps new {@link LogEntry}s with the current time of a {@link Clock}. */
public final class LogEntryFactory {

  private final Clock clock;

  public LogEntryFactory() {
    this(Clock.systemUTC());
  }

  public LogEntryFactory(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public LogEntry create(LogLevel level, String message) {
    return new LogEntry(clock.instant(), level, message);
  }
}
