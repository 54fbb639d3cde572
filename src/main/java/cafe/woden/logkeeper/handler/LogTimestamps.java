package cafe.woden.logkeeper.handler;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/** Timestamp codecs shared by the backends. All values are UTC, microsecond resolution. */
final class LogTimestamps {

  // Proleptic years, signed outside 0000-9999, so every Instant survives a round trip.
  private static final DateTimeFormatter ISO_MICROS =
      new DateTimeFormatterBuilder().appendInstant(6).toFormatter();

  private static final long MICROS_PER_SECOND = 1_000_000L;

  /** Earliest and latest instants whose epoch-microsecond value fits in a {@code long}. */
  static final Instant MIN_EPOCH_MICROS = fromEpochMicros(Long.MIN_VALUE);

  static final Instant MAX_EPOCH_MICROS = fromEpochMicros(Long.MAX_VALUE);

  private LogTimestamps() {}

  /** Fixed-width ISO-8601 form, e.g. {@code 2024-05-01T12:00:00.000250Z}. */
  static String format(Instant ts) {
    return ISO_MICROS.format(ts);
  }

  /** @throws DateTimeParseException if {@code raw} is not an ISO-8601 instant */
  static Instant parse(String raw) {
    if (raw == null) throw new DateTimeParseException("timestamp is missing", "", 0);
    return Instant.parse(raw.trim()).truncatedTo(ChronoUnit.MICROS);
  }

  static boolean fitsEpochMicros(Instant ts) {
    return !ts.isBefore(MIN_EPOCH_MICROS)
        && !ts.truncatedTo(ChronoUnit.MICROS).isAfter(MAX_EPOCH_MICROS);
  }

  /**
   * Microseconds since the epoch, rounding down any sub-microsecond part.
   *
   * @throws ArithmeticException if the value does not fit in a {@code long}
   */
  static long toEpochMicros(Instant ts) {
    long seconds = Math.multiplyExact(ts.getEpochSecond(), MICROS_PER_SECOND);
    return Math.addExact(seconds, ts.getNano() / 1_000);
  }

  /**
   * Smallest microsecond value that is not before {@code ts}.
   *
   * @throws ArithmeticException if the value does not fit in a {@code long}
   */
  static long toEpochMicrosCeil(Instant ts) {
    long floor = toEpochMicros(ts);
    return ts.getNano() % 1_000 == 0 ? floor : Math.addExact(floor, 1L);
  }

  static Instant fromEpochMicros(long micros) {
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }
}
