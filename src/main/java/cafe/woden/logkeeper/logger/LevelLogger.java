package cafe.woden.logkeeper.logger;

import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogEntryFactory;
import cafe.woden.logkeeper.model.LogLevel;
import java.util.List;
import java.util.Objects;

/**
 * Leveled logging facade.
 *
 * <p>Entries below the minimum level are dropped before an entry is created. Accepted entries are
 * stamped once and the same immutable entry goes to every handler.
 */
public class LevelLogger {

  public static final LogLevel DEFAULT_MINIMUM_LEVEL = LogLevel.INFO;

  private final List<LogHandler> handlers;
  private final LogEntryFactory entries;
  private volatile LogLevel minimumLevel = DEFAULT_MINIMUM_LEVEL;

  public LevelLogger(LogHandler handler) {
    this(List.of(Objects.requireNonNull(handler, "handler")), new LogEntryFactory());
  }

  public LevelLogger(List<LogHandler> handlers) {
    this(handlers, new LogEntryFactory());
  }

  public LevelLogger(List<LogHandler> handlers, LogEntryFactory entries) {
    if (handlers == null || handlers.isEmpty()) {
      throw new LogConfigurationException("LevelLogger needs at least one handler");
    }
    this.handlers = List.copyOf(handlers);
    this.entries = Objects.requireNonNull(entries, "entries");
  }

  public LogLevel minimumLevel() {
    return minimumLevel;
  }

  public void setMinimumLevel(LogLevel level) {
    this.minimumLevel = Objects.requireNonNull(level, "level");
  }

  /** @throws LogConfigurationException if {@code levelName} is not a known level */
  public void setMinimumLevel(String levelName) {
    setMinimumLevel(
        LogLevel.parse(levelName)
            .orElseThrow(
                () -> new LogConfigurationException("Unknown log level '" + levelName + "'")));
  }

  public boolean isEnabled(LogLevel level) {
    return level != null && level.isAtLeast(minimumLevel);
  }

  /**
   * Records {@code message} at {@code level}.
   *
   * <p>Every handler is attempted. If any of them fails, the first failure is thrown with the
   * remaining ones attached as suppressed exceptions.
   *
   * @return {@code false} if the level is below the threshold and nothing was written
   * @throws LogPersistenceException if at least one handler could not persist the entry
   */
  public boolean log(LogLevel level, String message) {
    Objects.requireNonNull(level, "level");
    if (!isEnabled(level)) return false;

    LogEntry entry = entries.create(level, Objects.toString(message, ""));
    LogPersistenceException failure = null;
    for (LogHandler handler : handlers) {
      try {
        handler.persist(entry);
      } catch (LogPersistenceException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) throw failure;
    return true;
  }

  public boolean debug(String message) {
    return log(LogLevel.DEBUG, message);
  }

  public boolean info(String message) {
    return log(LogLevel.INFO, message);
  }

  public boolean warning(String message) {
    return log(LogLevel.WARNING, message);
  }

  public boolean error(String message) {
    return log(LogLevel.ERROR, message);
  }

  public boolean critical(String message) {
    return log(LogLevel.CRITICAL, message);
  }
}
