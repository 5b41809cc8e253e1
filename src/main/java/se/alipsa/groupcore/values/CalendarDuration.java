package se.alipsa.groupcore.values;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A signed duration with a calendar (months) part and a fixed (nanoseconds) part.
 *
 * <p>
 * Both magnitudes share one sign. The month part is applied with calendar arithmetic, so adding one month to
 * January 31st lands on the last day of February. Instances are immutable.
 * </p>
 */
public final class CalendarDuration {

  public static final CalendarDuration ZERO = new CalendarDuration(0, 0, false);

  private static final long NANOS_PER_MICRO = 1_000L;
  private static final long NANOS_PER_MILLI = 1_000_000L;
  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
  private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;
  private static final long NANOS_PER_DAY = 24 * NANOS_PER_HOUR;
  private static final long NANOS_PER_WEEK = 7 * NANOS_PER_DAY;

  private static final Pattern COMPONENT = Pattern.compile("(\\d+)(mo|ms|m|us|µs|ns|y|w|d|h|s)");

  private final long months;
  private final long nanos;
  private final boolean negative;

  private CalendarDuration(long months, long nanos, boolean negative) {
    this.months = months;
    this.nanos = nanos;
    this.negative = negative && (months != 0 || nanos != 0);
  }

  /**
   * Create a duration from non-negative magnitudes and a sign.
   *
   * @param months
   *          the month magnitude, not negative
   * @param nanos
   *          the nanosecond magnitude, not negative
   * @param negative
   *          whether the duration points backwards in time
   * @return the duration
   */
  public static CalendarDuration of(long months, long nanos, boolean negative) {
    if (months < 0 || nanos < 0) {
      throw new IllegalArgumentException("Duration magnitudes must not be negative: months=" + months
          + ", nanos=" + nanos);
    }
    return new CalendarDuration(months, nanos, negative);
  }

  /**
   * @param nanos
   *          signed number of nanoseconds
   * @return a fixed duration
   */
  public static CalendarDuration ofNanos(long nanos) {
    return new CalendarDuration(0, Math.abs(nanos), nanos < 0);
  }

  /**
   * @param months
   *          signed number of calendar months
   * @return a calendar duration
   */
  public static CalendarDuration ofMonths(long months) {
    return new CalendarDuration(Math.abs(months), 0, months < 0);
  }

  /**
   * Parse a duration literal such as {@code 5m}, {@code 1mo2d}, {@code -30s} or {@code 1y6mo}.
   *
   * <p>
   * Supported units are {@code y} (12 months), {@code mo}, {@code w}, {@code d}, {@code h}, {@code m}, {@code s},
   * {@code ms}, {@code us} (or {@code µs}) and {@code ns}. A single leading minus sign negates the whole literal.
   * </p>
   *
   * @param literal
   *          the literal text
   * @return the parsed duration
   * @throws IllegalArgumentException
   *           if the literal is empty or malformed
   */
  public static CalendarDuration parse(String literal) {
    if (literal == null || literal.isBlank()) {
      throw new IllegalArgumentException("Empty duration literal");
    }
    String value = literal.trim();
    boolean negative = false;
    if (value.startsWith("-")) {
      negative = true;
      value = value.substring(1);
    }
    if (value.isEmpty()) {
      throw new IllegalArgumentException("Duration literal has no components: " + literal);
    }

    long months = 0;
    long nanos = 0;
    Matcher matcher = COMPONENT.matcher(value);
    int pos = 0;
    while (pos < value.length()) {
      matcher.region(pos, value.length());
      if (!matcher.lookingAt()) {
        throw new IllegalArgumentException("Invalid duration literal: " + literal);
      }
      long amount;
      try {
        amount = Long.parseLong(matcher.group(1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Duration amount out of range: " + literal, e);
      }
      switch (matcher.group(2)) {
        case "y" -> months = Math.addExact(months, Math.multiplyExact(amount, 12));
        case "mo" -> months = Math.addExact(months, amount);
        case "w" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_WEEK));
        case "d" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_DAY));
        case "h" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_HOUR));
        case "m" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_MINUTE));
        case "s" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_SECOND));
        case "ms" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_MILLI));
        case "us", "µs" -> nanos = Math.addExact(nanos, Math.multiplyExact(amount, NANOS_PER_MICRO));
        case "ns" -> nanos = Math.addExact(nanos, amount);
        default -> throw new IllegalArgumentException("Unsupported duration unit in " + literal);
      }
      pos = matcher.end();
    }
    return new CalendarDuration(months, nanos, negative);
  }

  /**
   * @return the signed number of months.
   */
  public long months() {
    return negative ? -months : months;
  }

  /**
   * @return the signed number of nanoseconds.
   */
  public long nanoseconds() {
    return negative ? -nanos : nanos;
  }

  public boolean isZero() {
    return months == 0 && nanos == 0;
  }

  public boolean isPositive() {
    return !negative && !isZero();
  }

  public boolean isNegative() {
    return negative;
  }

  /**
   * @return {@code true} when both a month and a nanosecond part are present
   */
  public boolean isMixed() {
    return months != 0 && nanos != 0;
  }

  /**
   * @return {@code true} when only a month part is present
   */
  public boolean isMonthsOnly() {
    return months != 0 && nanos == 0;
  }

  /**
   * Multiply both components by a scalar. A negative scale flips the sign.
   *
   * @param scale
   *          the multiplier
   * @return the scaled duration
   */
  public CalendarDuration multiply(long scale) {
    if (isZero() || scale == 1) {
      return this;
    }
    long magnitude = Math.abs(scale);
    boolean flipped = scale < 0 ? !negative : negative;
    return new CalendarDuration(Math.multiplyExact(months, magnitude), Math.multiplyExact(nanos, magnitude),
        flipped);
  }

  /**
   * @return a duration of the same magnitude pointing the other way
   */
  public CalendarDuration negate() {
    return new CalendarDuration(months, nanos, !negative);
  }

  /**
   * Add this duration to a timestamp. The month part is applied first, clamping the day of month to the length of
   * the target month, then the nanosecond part.
   *
   * @param time
   *          nanoseconds since the epoch
   * @return the shifted timestamp
   */
  public long addTo(long time) {
    long result = time;
    if (months != 0) {
      LocalDateTime shifted = Timestamps.toDateTime(time).plusMonths(months());
      result = Timestamps.fromDateTime(shifted);
    }
    return result + nanoseconds();
  }

  /**
   * Smallest length in nanoseconds this duration can span, counting a month as 28 days.
   *
   * @return the unsigned lower estimate
   */
  public long minNanos() {
    return months * 28 * NANOS_PER_DAY + nanos;
  }

  /**
   * Largest length in nanoseconds this duration can span, counting a month as 31 days.
   *
   * @return the unsigned upper estimate
   */
  public long maxNanos() {
    return months * 31 * NANOS_PER_DAY + nanos;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CalendarDuration other)) {
      return false;
    }
    return months == other.months && nanos == other.nanos && negative == other.negative;
  }

  @Override
  public int hashCode() {
    return Objects.hash(months, nanos, negative);
  }

  @Override
  public String toString() {
    if (isZero()) {
      return "0s";
    }
    StringBuilder sb = new StringBuilder();
    if (negative) {
      sb.append('-');
    }
    appendUnit(sb, months / 12, "y");
    appendUnit(sb, months % 12, "mo");
    long rest = nanos;
    appendUnit(sb, rest / NANOS_PER_DAY, "d");
    rest %= NANOS_PER_DAY;
    appendUnit(sb, rest / NANOS_PER_HOUR, "h");
    rest %= NANOS_PER_HOUR;
    appendUnit(sb, rest / NANOS_PER_MINUTE, "m");
    rest %= NANOS_PER_MINUTE;
    appendUnit(sb, rest / NANOS_PER_SECOND, "s");
    rest %= NANOS_PER_SECOND;
    appendUnit(sb, rest / NANOS_PER_MILLI, "ms");
    rest %= NANOS_PER_MILLI;
    appendUnit(sb, rest / NANOS_PER_MICRO, "us");
    appendUnit(sb, rest % NANOS_PER_MICRO, "ns");
    return sb.toString();
  }

  private static void appendUnit(StringBuilder sb, long amount, String unit) {
    if (amount != 0) {
      sb.append(amount).append(unit);
    }
  }
}
