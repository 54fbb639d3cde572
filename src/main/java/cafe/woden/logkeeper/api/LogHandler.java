package cafe.woden.logkeeper.api;

import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Persists and retrieves {@link LogEntry} records for one storage backend.
 *
 * <p>Every call acquires its file handle or connection, does its work and releases it before
 * returning, on success and on failure. Implementations keep no open resource between calls,
 * so several handlers may point at the same backend.
 */
public interface LogHandler {

  /**
   * Appends one entry. Existing content is never rewritten.
   *
   * @throws LogPersistenceException if the backend cannot be written
   */
  void persist(LogEntry entry);

  /**
   * Returns every stored entry in write order.
   *
   * <p>A backend that has never been written to yields an empty list. Records that cannot be
   * decoded are skipped and reported, not thrown.
   *
   * @throws LogPersistenceException if the backend exists but cannot be read
   */
  List<LogEntry> readAll();

  /** Entries with exactly {@code level}, in write order. Backends may push the filter down. */
  default List<LogEntry> readByLevel(LogLevel level) {
    Objects.requireNonNull(level, "level");
    return readAll().stream().filter(e -> e.level() == level).toList();
  }

  /** Entries with {@code start <= timestamp <= end}, in write order. */
  default List<LogEntry> readBetween(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    return readAll().stream()
        .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
        .toList();
  }

  /** Backend location for diagnostics, e.g. a file path or JDBC URL. */
  String describe();
}
