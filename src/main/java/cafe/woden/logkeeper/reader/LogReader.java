package cafe.woden.logkeeper.reader;

import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only queries over the entries of one {@link LogHandler}.
 *
 * <p>Nothing is cached: every call reads the backend again, so entries written by other loggers
 * in the meantime are visible.
 */
public class LogReader {

  private final LogHandler handler;

  public LogReader(LogHandler handler) {
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  /** Entries with exactly {@code level}, in write order. */
  public List<LogEntry> findByLevel(LogLevel level) {
    Objects.requireNonNull(level, "level");
    return handler.readByLevel(level);
  }

  /** @throws LogConfigurationException if {@code levelName} is not a known level */
  public List<LogEntry> findByLevel(String levelName) {
    LogLevel level =
        LogLevel.parse(levelName)
            .orElseThrow(
                () -> new LogConfigurationException("Unknown log level '" + levelName + "'"));
    return findByLevel(level);
  }

  /** Entries with {@code start <= timestamp <= end}, in write order. */
  public List<LogEntry> findByTimeRange(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) return List.of();
    return handler.readBetween(start, end);
  }

  /** Entries whose message contains {@code text}. */
  public List<LogEntry> findByText(String text, boolean caseSensitive) {
    Objects.requireNonNull(text, "text");
    String needle = caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    List<LogEntry> out = new ArrayList<>();
    for (LogEntry entry : handler.readAll()) {
      String hay = caseSensitive ? entry.message() : entry.message().toLowerCase(Locale.ROOT);
      if (hay.contains(needle)) out.add(entry);
    }
    return Collections.unmodifiableList(out);
  }

  /**
   * Groups all entries by level in one pass.
   *
   * <p>Keys iterate in severity order. Levels without entries are absent.
   */
  public Map<LogLevel, List<LogEntry>> groupByLevel() {
    EnumMap<LogLevel, List<LogEntry>> groups = new EnumMap<>(LogLevel.class);
    for (LogEntry entry : handler.readAll()) {
      groups.computeIfAbsent(entry.level(), k -> new ArrayList<>()).add(entry);
    }
    groups.replaceAll((level, list) -> Collections.unmodifiableList(list));
    return Collections.unmodifiableMap(groups);
  }

  /** All entries ordered by timestamp. Entries with equal timestamps keep their write order. */
  public List<LogEntry> sortByTimestamp(boolean ascending) {
    Comparator<LogEntry> byTs = Comparator.comparing(LogEntry::timestamp);
    List<LogEntry> sorted = new ArrayList<>(handler.readAll());
    sorted.sort(ascending ? byTs : byTs.reversed());
    return Collections.unmodifiableList(sorted);
  }
}
