package se.alipsa.groupcore.values;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Time helpers for timestamps expressed as nanoseconds since the Unix epoch (UTC).
 */
public final class Timestamps {

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private Timestamps() {
  }

  /**
   * Convert an epoch nanosecond timestamp to a UTC date time.
   *
   * @param nanos
   *          nanoseconds since the epoch
   * @return the UTC date time
   */
  public static LocalDateTime toDateTime(long nanos) {
    long seconds = Math.floorDiv(nanos, NANOS_PER_SECOND);
    int nano = (int) Math.floorMod(nanos, NANOS_PER_SECOND);
    return LocalDateTime.ofEpochSecond(seconds, nano, ZoneOffset.UTC);
  }

  /**
   * Convert a UTC date time to epoch nanoseconds.
   *
   * @param dateTime
   *          the date time, interpreted as UTC
   * @return nanoseconds since the epoch
   */
  public static long fromDateTime(LocalDateTime dateTime) {
    long seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
    return seconds * NANOS_PER_SECOND + dateTime.getNano();
  }

  /**
   * @param instant
   *          the instant to convert
   * @return nanoseconds since the epoch
   */
  public static long fromInstant(Instant instant) {
    return instant.getEpochSecond() * NANOS_PER_SECOND + instant.getNano();
  }

  /**
   * @param nanos
   *          nanoseconds since the epoch
   * @return the corresponding instant
   */
  public static Instant toInstant(long nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
  }

  /**
   * Number of whole calendar months between January 1970 and the month that contains the timestamp.
   *
   * @param nanos
   *          nanoseconds since the epoch
   * @return year * 12 + month - 1, relative to year zero
   */
  public static long monthsSince(long nanos) {
    LocalDateTime dt = toDateTime(nanos);
    return (long) dt.getYear() * 12 + dt.getMonthValue() - 1;
  }

  /**
   * Parse an RFC 3339 timestamp such as {@code 2021-02-28T00:00:00Z}.
   *
   * @param text
   *          the timestamp text
   * @return nanoseconds since the epoch
   */
  public static long parse(String text) {
    try {
      return fromInstant(Instant.parse(text.trim()));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp: " + text, e);
    }
  }

  /**
   * Format a timestamp as RFC 3339 in UTC.
   *
   * @param nanos
   *          nanoseconds since the epoch
   * @return the formatted timestamp
   */
  public static String format(long nanos) {
    return DateTimeFormatter.ISO_INSTANT.format(toInstant(nanos));
  }
}
