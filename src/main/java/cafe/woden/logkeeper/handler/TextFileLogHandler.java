package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import com.google.common.base.Splitter;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Plain text backend.
 *
 * <p>Line format: {@code 2024-05-01T12:00:00.000250Z|ERROR|disk%20full%0Aretrying}. The message
 * is percent-encoded (UTF-8), so it never contains a raw {@code |}, {@code %}, {@code +} or line
 * break. Everything else printable in ASCII stays readable.
 */
public class TextFileLogHandler extends AbstractLineLogHandler {

  static final char DELIMITER = '|';

  // Alphanumerics are always safe. '%', '+' and the delimiter are deliberately absent.
  private static final Escaper MESSAGE_ESCAPER =
      new PercentEscaper(" -_.~!*'(),;:@/?=&$#[]{}<>\"^`\\", false);

  private static final Splitter FIELD_SPLITTER = Splitter.on(DELIMITER).limit(3);

  public TextFileLogHandler(HandlerSettings settings) {
    this(settings, MalformedRecordListener.IGNORE);
  }

  public TextFileLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    super(settings, listener);
  }

  @Override
  protected String encodeLine(LogEntry entry) {
    String message;
    try {
      message = MESSAGE_ESCAPER.escape(entry.message());
    } catch (IllegalArgumentException ex) {
      // unpaired surrogate: there is no UTF-8 form to percent-encode
      throw new LogPersistenceException("Message cannot be encoded for " + describe(), ex);
    }
    return LogTimestamps.format(entry.timestamp())
        + DELIMITER
        + entry.level().name()
        + DELIMITER
        + message;
  }

  @Override
  protected LogEntry decodeLine(String line, long lineNumber) {
    List<String> fields = FIELD_SPLITTER.splitToList(line);
    if (fields.size() != 3) {
      throw malformed(lineNumber, "expected 3 fields but found " + fields.size());
    }

    Instant ts;
    try {
      ts = LogTimestamps.parse(fields.get(0));
    } catch (DateTimeParseException ex) {
      throw malformed(lineNumber, "bad timestamp '" + fields.get(0) + "'", ex);
    }

    LogLevel level =
        LogLevel.parse(fields.get(1))
            .orElseThrow(() -> malformed(lineNumber, "unknown level '" + fields.get(1) + "'"));

    String message;
    try {
      message = URLDecoder.decode(fields.get(2), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      throw malformed(lineNumber, "bad percent-encoding in message", ex);
    }
    return new LogEntry(ts, level, message);
  }
}
