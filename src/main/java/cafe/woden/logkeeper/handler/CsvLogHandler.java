package cafe.woden.logkeeper.handler;

import cafe.woden.logkeeper.api.HandlerSettings;
import cafe.woden.logkeeper.api.LogConfigurationException;
import cafe.woden.logkeeper.api.LogPersistenceException;
import cafe.woden.logkeeper.api.MalformedRecordException;
import cafe.woden.logkeeper.api.MalformedRecordListener;
import cafe.woden.logkeeper.model.LogEntry;
import cafe.woden.logkeeper.model.LogLevel;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.BufferedReader;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * CSV backend with a {@code timestamp,level,message} header row.
 *
 * <p>Every field is quoted and embedded quotes are doubled, so commas, quotes and line breaks
 * in a message survive. Rows are read back with Jackson's quote-aware parser.
 */
public class CsvLogHandler extends AbstractFileLogHandler {

  static final String HEADER_LINE = "timestamp,level,message\n";

  private static final String[] HEADER = {"timestamp", "level", "message"};

  private static final CsvMapper CSV =
      CsvMapper.builder()
          .enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
          .enable(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS)
          .enable(CsvParser.Feature.WRAP_AS_ARRAY)
          .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
          .build();

  private static final CsvSchema ROW_SCHEMA =
      CsvSchema.builder()
          .addColumn(HEADER[0])
          .addColumn(HEADER[1])
          .addColumn(HEADER[2])
          .build()
          .withoutHeader();

  private static final ObjectWriter ROW_WRITER = CSV.writer(ROW_SCHEMA);

  private static final ObjectReader ROW_READER =
      CSV.readerFor(String[].class).with(CsvSchema.emptySchema());

  public CsvLogHandler(HandlerSettings settings) {
    this(settings, MalformedRecordListener.IGNORE);
  }

  public CsvLogHandler(HandlerSettings settings, MalformedRecordListener listener) {
    super(settings, listener);
    // CSV has no escape for characters the file encoding cannot represent
    if (!charsetCoversUnicode()) {
      throw new LogConfigurationException(
          "CSV log '" + describe() + "' needs a Unicode encoding, not " + charset.name());
    }
  }

  @Override
  protected String header() {
    return HEADER_LINE;
  }

  @Override
  protected String encode(LogEntry entry) {
    CsvRow row =
        new CsvRow(
            LogTimestamps.format(entry.timestamp()), entry.level().name(), entry.message());
    try {
      return ROW_WRITER.writeValueAsString(row);
    } catch (JsonProcessingException ex) {
      throw new LogPersistenceException("Cannot serialize log entry for " + describe(), ex);
    }
  }

  @Override
  protected void decodeAll(
      BufferedReader in, Consumer<LogEntry> out, Consumer<MalformedRecordException> skipped)
      throws IOException {
    long rowNumber = 0;
    try (MappingIterator<String[]> rows = ROW_READER.readValues(in)) {
      while (true) {
        String[] fields;
        try {
          if (!rows.hasNextValue()) return;
          fields = rows.nextValue();
        } catch (JsonProcessingException ex) {
          // The parser cannot resynchronise after a structural error; keep what was decoded.
          skipped.accept(
              new MalformedRecordException(
                  describe(), rowNumber + 1, "unreadable CSV from here on", ex));
          return;
        }
        rowNumber++;
        if (rowNumber == 1 && Arrays.equals(fields, HEADER)) continue;
        try {
          out.accept(decodeRow(fields, rowNumber));
        } catch (MalformedRecordException ex) {
          skipped.accept(ex);
        }
      }
    }
  }

  private LogEntry decodeRow(String[] fields, long rowNumber) {
    if (fields == null || fields.length != 3) {
      int n = fields == null ? 0 : fields.length;
      throw new MalformedRecordException(
          describe(), rowNumber, "expected 3 columns but found " + n);
    }
    Instant ts;
    try {
      ts = LogTimestamps.parse(fields[0]);
    } catch (DateTimeParseException ex) {
      throw new MalformedRecordException(
          describe(), rowNumber, "bad timestamp '" + fields[0] + "'", ex);
    }
    LogLevel level =
        LogLevel.parse(fields[1])
            .orElseThrow(
                () ->
                    new MalformedRecordException(
                        describe(), rowNumber, "unknown level '" + fields[1] + "'"));
    return new LogEntry(ts, level, fields[2]);
  }

  @JsonPropertyOrder({"timestamp", "level", "message"})
  record CsvRow(String timestamp, String level, String message) {}
}
