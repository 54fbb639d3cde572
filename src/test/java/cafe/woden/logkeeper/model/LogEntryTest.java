package cafe.woden.logkeeper.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LogEntryTest {

  private static final Instant TS = Instant.parse("2023-01-15T10:30:00.123456Z");

  @Test
  void timestampIsTruncatedToMicroseconds() {
    LogEntry entry = new LogEntry(TS.plusNanos(789), LogLevel.INFO, "x");

    assertEquals(TS, entry.timestamp());
  }

  @Test
  void equalityIsByValue() {
    LogEntry a = new LogEntry(TS, LogLevel.WARNING, "same");

    assertEquals(a, new LogEntry(TS, LogLevel.WARNING, "same"));
    assertEquals(a.hashCode(), new LogEntry(TS, LogLevel.WARNING, "same").hashCode());
    assertNotEquals(a, new LogEntry(TS, LogLevel.ERROR, "same"));
    assertNotEquals(a, new LogEntry(TS, LogLevel.WARNING, "other"));
    assertNotEquals(a, new LogEntry(TS.plusNanos(1_000), LogLevel.WARNING, "same"));
  }

  @Test
  void allFieldsAreRequired() {
    assertThrows(NullPointerException.class, () -> new LogEntry(null, LogLevel.INFO, "m"));
    assertThrows(NullPointerException.class, () -> new LogEntry(TS, null, "m"));
    assertThrows(NullPointerException.class, () -> new LogEntry(TS, LogLevel.INFO, null));
  }

  @Test
  void toStringIsHumanReadable() {
    assertEquals(
        "[2023-01-15T10:30:00.123456Z] WARNING: Something happened.",
        new LogEntry(TS, LogLevel.WARNING, "Something happened.").toString());
  }

  @Test
  void factoryStampsEntriesWithItsClock() {
    LogEntryFactory factory = new LogEntryFactory(Clock.fixed(TS, ZoneOffset.UTC));

    assertEquals(new LogEntry(TS, LogLevel.DEBUG, "tick"), factory.create(LogLevel.DEBUG, "tick"));
  }

  @Test
  void ofUsesGivenTimestamp() {
    assertEquals(TS, LogEntry.of(LogLevel.INFO, "m", TS).timestamp());
  }
}
