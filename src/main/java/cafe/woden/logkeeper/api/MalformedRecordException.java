package cafe.woden.logkeeper.api;

/**
 * One stored record could not be decoded.
 *
 * <p>Handlers catch this per record, skip the record and report it through their
 * {@link MalformedRecordListener}; it does not escape a read.
 */
public class MalformedRecordException extends LogStoreException {

  private final String source;
  private final long recordNumber;

  public MalformedRecordException(String source, long recordNumber, String reason) {
    super(format(source, recordNumber, reason));
    this.source = source;
    this.recordNumber = recordNumber;
  }

  public MalformedRecordException(String source, long recordNumber, String reason, Throwable cause) {
    super(format(source, recordNumber, reason), cause);
    this.source = source;
    this.recordNumber = recordNumber;
  }

  /** Backend location the record came from, as given by {@link LogHandler#describe()}. */
  public String source() {
    return source;
  }

  /** 1-based line, row or record number within the source. */
  public long recordNumber() {
    return recordNumber;
  }

  private static String format(String source, long recordNumber, String reason) {
    return "Malformed record #" + recordNumber + " in " + source + ": " + reason;
  }
}
