package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogHandler;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.api.MalformedRecordException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Embedded relational backend (HSQLDB by default).
 *
 * <p>Every statement is parameterized. The data source hands out a fresh physical connection per
 * operation and {@link JdbcTemplate} closes it afterwards, so nothing stays open between calls.
 * Level and time-range reads are filtered in the database, using the indices on {@code level}
 * and {@code ts_epoch_us}.
 */
public class JdbcLogHandler implements LogHandler {

  private static final Logger log = LoggerFactory.getLogger(JdbcLogHandler.class);

  static final String MIGRATION_LOCATION = "classpath:db/migration/logkeeper";

  private static final String HSQLDB_DRIVER = "org.hsqldb.jdbc.JDBCDriver";

  private static final String INSERT_SQL =
      """
      INSERT INTO logs(ts_epoch_us, level, message)
      VALUES (?,?,?)
      """;

  private static final String SELECT_ALL_SQL =
      """
      SELECT id, ts_epoch_us, level, message
        FROM logs
    ORDER BY id ASC
      """;

  private static final String SELECT_BY_LEVEL_SQL =
      """
      SELECT id, ts_epoch_us, level, message
        FROM logs
       WHERE level = ?
    ORDER BY id ASC
      """;

  // Bounds are inclusive on both ends.
  private static final String SELECT_BETWEEN_SQL =
      """
      SELECT id, ts_epoch_us, level, message
        FROM logs
       WHERE ts_epoch_us >= ?
         AND ts_epoch_us <= ?
    ORDER BY id ASC
      """;

  private final String url;
  private final JdbcTemplate jdbc;
  private final MalformedRecordListener listener;

  public JdbcLogHandler(HandlerSettings settings) {
    this(settings, MalformedRecordListener.IGNORE);
  }

  public JdbcLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    Objects.requireNonNull(settings, "settings");
    this.url = resolveUrl(settings);
    this.listener = listener != null ? listener : MalformedRecordListener.IGNORE;

    DriverManagerDataSource ds = new DriverManagerDataSource();
    if (url.startsWith("jdbc:hsqldb:")) {
      ds.setDriverClassName(HSQLDB_DRIVER);
      ds.setUsername("SA");
      ds.setPassword("");
    }
    ds.setUrl(url);

    try {
      Flyway.configure().dataSource(ds).locations(MIGRATION_LOCATION).load().migrate();
    } catch (FlywayException ex) {
      throw new LogConfigurationException("Cannot prepare log schema at " + url, ex);
    }
    this.jdbc = new JdbcTemplate(ds);
    log.debug("[logkeeper] JdbcLogHandler ready at {}", url);
  }

  @Override
  public void persist(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (!LogTimestamps.fitsEpochMicros(entry.timestamp())) {
      throw new LogPersistenceException(
          "Timestamp " + entry.timestamp() + " is outside the range stored by " + url);
    }
    try {
      jdbc.update(
          INSERT_SQL,
          LogTimestamps.toEpochMicros(entry.timestamp()),
          entry.level().name(),
          entry.message());
    } catch (DataAccessException ex) {
      throw new LogPersistenceException("Cannot insert log entry into " + url, ex);
    }
  }

  @Override
  public List<LogEntry> readAll() {
    return query(SELECT_ALL_SQL);
  }

  @Override
  public List<LogEntry> readByLevel(LogLevel level) {
    Objects.requireNonNull(level, "level");
    return query(SELECT_BY_LEVEL_SQL, level.name());
  }

  @Override
  public List<LogEntry> readBetween(Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) return List.of();
    if (start.isAfter(LogTimestamps.MAX_EPOCH_MICROS)
        || end.isBefore(LogTimestamps.MIN_EPOCH_MICROS)) {
      return List.of();
    }
    // open-ended bounds clamp to the stored range
    long from =
        start.isBefore(LogTimestamps.MIN_EPOCH_MICROS)
            ? Long.MIN_VALUE
            : LogTimestamps.toEpochMicrosCeil(start);
    long to =
        end.isAfter(LogTimestamps.MAX_EPOCH_MICROS)
            ? Long.MAX_VALUE
            : LogTimestamps.toEpochMicros(end);
    return query(SELECT_BETWEEN_SQL, from, to);
  }

  @Override
  public String describe() {
    return url;
  }

  private List<LogEntry> query(String sql, Object... args) {
    List<LogEntry> out = new ArrayList<>();
    int[] skipped = {0};
    RowCallbackHandler collector =
        rs -> {
          try {
            out.add(mapRow(rs));
          } catch (MalformedRecordException ex) {
            skipped[0]++;
            log.debug("[logkeeper] {}", ex.getMessage());
            listener.skipped(ex);
          }
        };
    try {
      jdbc.query(sql, collector, args);
    } catch (DataAccessException ex) {
      throw new LogPersistenceException("Cannot read log entries from " + url, ex);
    }
    if (skipped[0] > 0) {
      log.warn("[logkeeper] Skipped {} malformed row(s) while reading {}", skipped[0], url);
    }
    return Collections.unmodifiableList(out);
  }

  private LogEntry mapRow(ResultSet rs) throws SQLException {
    long id = rs.getLong("id");
    String rawLevel = rs.getString("level");
    LogLevel level =
        LogLevel.parse(rawLevel)
            .orElseThrow(
                () ->
                    new MalformedRecordException(url, id, "unknown level '" + rawLevel + "'"));
    String message = rs.getString("message");
    if (message == null) {
      throw new MalformedRecordException(url, id, "message is NULL");
    }
    Instant ts = LogTimestamps.fromEpochMicros(rs.getLong("ts_epoch_us"));
    return new LogEntry(ts, level, message);
  }

  private static String resolveUrl(HandlerSettings settings) {
    if (settings.isJdbcUrl()) return settings.target();

    Path base = settings.path();
    if (Files.isDirectory(base)) {
      throw new LogConfigurationException("Database path '" + base + "' is a directory");
    }
    Path parent = base.getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new LogConfigurationException("Cannot create database directory '" + parent + "'", ex);
      }
    }
    return "jdbc:hsqldb:file:" + base + ";hsqldb.tx=mvcc";
  }
}
