package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON Lines backend: one object per line, keys {@code timestamp}, {@code level} and
 * {@code message}.
 *
 * <p>Appending writes a single line; the existing file is never loaded or rewritten.
 */
public class JsonLinesLogHandler extends AbstractLineLogHandler {

  static final String TIMESTAMP = "timestamp";
  static final String LEVEL = "level";
  static final String MESSAGE = "message";

  private static final ObjectMapper JSON = new ObjectMapper();

  private final ObjectWriter writer;

  public JsonLinesLogHandler(HandlerSettings settings) {
    this(settings, MalformedRecordListener.IGNORE);
  }

  public JsonLinesLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    super(settings, listener);
    // narrow charsets get non-ASCII characters escaped so any message stays encodable
    this.writer =
        charsetCoversUnicode()
            ? JSON.writer()
            : JSON.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
  }

  @Override
  protected String encodeLine(LogEntry entry) {
    ObjectNode node = JSON.createObjectNode();
    node.put(TIMESTAMP, LogTimestamps.format(entry.timestamp()));
    node.put(LEVEL, entry.level().name());
    node.put(MESSAGE, entry.message());
    try {
      // compact output: string escaping keeps embedded line breaks off the physical line
      return writer.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new LogPersistenceException("Cannot serialize log entry for " + describe(), ex);
    }
  }

  @Override
  protected LogEntry decodeLine(String line, long lineNumber) {
    JsonNode node;
    try {
      node = JSON.readTree(line);
    } catch (JsonProcessingException ex) {
      throw malformed(lineNumber, "invalid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw malformed(lineNumber, "expected a JSON object");
    }

    String rawTs = textField(node, TIMESTAMP, lineNumber);
    String rawLevel = textField(node, LEVEL, lineNumber);
    String message = textField(node, MESSAGE, lineNumber);

    Instant ts;
    try {
      ts = LogTimestamps.parse(rawTs);
    } catch (DateTimeParseException ex) {
      throw malformed(lineNumber, "bad timestamp '" + rawTs + "'", ex);
    }
    LogLevel level =
        LogLevel.parse(rawLevel)
            .orElseThrow(() -> malformed(lineNumber, "unknown level '" + rawLevel + "'"));
    return new LogEntry(ts, level, message);
  }

  private String textField(JsonNode node, String name, long lineNumber) {
    JsonNode value = node.get(name);
    if (value == null || !value.isTextual()) {
      throw malformed(lineNumber, "missing or non-string '" + name + "'");
    }
    return value.asText();
  }
}
