package se.alipsa.groupcore.window;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.groupcore.values.CalendarDuration;
import se.alipsa.groupcore.values.Timestamps;

/**
 * An infinite, periodic sequence of time bounds.
 *
 * <p>
 * The sequence is anchored at the Unix epoch shifted by {@code offset}. The i-th bounds start at
 * {@code anchor + every * i} and stop {@code period} later; a negative period makes the bounds extend backwards from
 * their nominal start. A period shorter than {@code every} leaves gaps between windows (underlapping), a longer one
 * makes them overlap.
 * </p>
 *
 * <p>
 * {@code every} must be positive and must be either a number of calendar months or a fixed duration, never both, so
 * that the index of the bounds containing a time can be computed with a single division. {@code period} and
 * {@code offset} may mix both units. Windows are immutable and safe to share.
 * </p>
 */
public final class Window {

  private static final Logger log = LoggerFactory.getLogger(Window.class);

  private static final long EPOCH = 0L;

  private final CalendarDuration every;
  private final CalendarDuration period;
  private final CalendarDuration offset;
  private final long zero;
  private final long zeroMonths;
  private final long maxScanSteps;

  private Window(CalendarDuration every, CalendarDuration period, CalendarDuration offset) {
    this.every = every;
    this.period = period;
    this.offset = offset;
    this.zero = offset.addTo(EPOCH);
    this.zeroMonths = Timestamps.monthsSince(zero);
    // No more bounds than a period can span can contain the same instant.
    this.maxScanSteps = ceilDiv(period.maxNanos(), every.minNanos()) + 2;
  }

  /**
   * Create a window.
   *
   * @param every
   *          the distance between the starts of successive bounds
   * @param period
   *          the width of each bounds, may be negative
   * @param offset
   *          the shift of the whole sequence relative to the epoch
   * @return the window
   * @throws IllegalArgumentException
   *           if {@code every} is zero, negative or mixes months and nanoseconds
   */
  public static Window of(CalendarDuration every, CalendarDuration period, CalendarDuration offset) {
    Objects.requireNonNull(every, "every");
    Objects.requireNonNull(period, "period");
    Objects.requireNonNull(offset, "offset");
    if (every.isZero()) {
      throw new IllegalArgumentException("duration used as an interval cannot be zero");
    }
    if (every.isMixed()) {
      throw new IllegalArgumentException("duration used as an interval cannot mix month and nanosecond units");
    }
    if (every.isNegative()) {
      throw new IllegalArgumentException("duration used as an interval cannot be negative");
    }
    Window window = new Window(every, period, offset);
    if (log.isDebugEnabled()) {
      log.debug("Created window every={} period={} offset={} anchored at {}", every, period, offset,
          Timestamps.format(window.zero));
    }
    return window;
  }

  /**
   * Create a window from parsed window parameters.
   *
   * @param spec
   *          the window parameters
   * @return the window
   */
  public static Window of(WindowSpec spec) {
    return of(spec.every(), spec.period(), spec.offset());
  }

  public CalendarDuration every() {
    return every;
  }

  public CalendarDuration period() {
    return period;
  }

  public CalendarDuration offset() {
    return offset;
  }

  /**
   * Find the latest bounds containing {@code t}. For underlapping windows where no bounds contain {@code t}, the
   * nearest bounds before {@code t} are returned.
   *
   * @param t
   *          epoch nanoseconds
   * @return the bounds
   */
  public Bounds getLatestBounds(long t) {
    Bounds b = boundsAt(lastIndex(t));
    if (period.isNegative()) {
      // Bounds reaching backwards from later starts may still cover t.
      Bounds next = nextBounds(b);
      long steps = 0;
      while (next.contains(t)) {
        checkScan(++steps, t);
        b = next;
        next = nextBounds(next);
      }
    }
    return b;
  }

  /**
   * Find the earliest bounds containing {@code t}. For underlapping windows where no bounds contain {@code t}, the
   * nearest bounds before {@code t} are returned.
   *
   * @param t
   *          epoch nanoseconds
   * @return the bounds
   */
  public Bounds getEarliestBounds(long t) {
    Bounds b = getLatestBounds(t);
    if (!b.contains(t)) {
      return b;
    }
    Bounds prev = prevBounds(b);
    long steps = 0;
    while (prev.contains(t)) {
      checkScan(++steps, t);
      b = prev;
      prev = prevBounds(prev);
    }
    return b;
  }

  /**
   * Collect every bounds that overlaps {@code [start, stop)}.
   *
   * @param start
   *          inclusive start, epoch nanoseconds
   * @param stop
   *          exclusive stop, epoch nanoseconds
   * @return the overlapping bounds in descending time order, empty when the range is empty
   */
  public List<Bounds> getOverlappingBounds(long start, long stop) {
    Bounds range = Bounds.of(start, stop);
    if (range.isEmpty()) {
      return List.of();
    }
    List<Bounds> result = new ArrayList<>();
    Bounds b = getLatestBounds(stop);
    while (b.stop() > start) {
      if (b.overlaps(range)) {
        result.add(b);
      }
      b = prevBounds(b);
    }
    return result;
  }

  /**
   * @param b
   *          bounds produced by this window
   * @return the bounds following {@code b}
   */
  public Bounds nextBounds(Bounds b) {
    return boundsAt(b.index() + 1);
  }

  /**
   * @param b
   *          bounds produced by this window
   * @return the bounds preceding {@code b}
   */
  public Bounds prevBounds(Bounds b) {
    return boundsAt(b.index() - 1);
  }

  /**
   * Compute bounds from the anchor rather than from neighbouring bounds, so month lengths never accumulate drift.
   */
  private Bounds boundsAt(long index) {
    long start = startOf(index);
    long stop = period.addTo(start);
    if (period.isNegative()) {
      return new Bounds(stop, start, index);
    }
    return new Bounds(start, stop, index);
  }

  private long startOf(long index) {
    return every.multiply(index).addTo(zero);
  }

  /**
   * The greatest index whose start is not after {@code t}.
   */
  long lastIndex(long t) {
    if (every.isMonthsOnly()) {
      long delta = Timestamps.monthsSince(t) - zeroMonths;
      if (beforeAnchorWithinMonth(t)) {
        delta--;
      }
      long index = floorDiv(delta, every.months());
      // Day-of-month clamping can move a start across t, e.g. an anchor on the 31st in a 30 day month.
      while (startOf(index + 1) <= t) {
        index++;
      }
      while (startOf(index) > t) {
        index--;
      }
      return index;
    }
    return floorDiv(t - zero, every.nanoseconds());
  }

  private boolean beforeAnchorWithinMonth(long t) {
    LocalDateTime time = Timestamps.toDateTime(t);
    LocalDateTime anchor = Timestamps.toDateTime(zero);
    if (time.getDayOfMonth() != anchor.getDayOfMonth()) {
      return time.getDayOfMonth() < anchor.getDayOfMonth();
    }
    return time.toLocalTime().isBefore(anchor.toLocalTime());
  }

  private static long floorDiv(long delta, long every) {
    long index = delta / every;
    // Integer division truncates toward zero; step down for negative deltas between boundaries.
    if (delta % every != 0 && delta < 0) {
      index--;
    }
    return index;
  }

  private static long ceilDiv(long a, long b) {
    return (a + b - 1) / b;
  }

  private void checkScan(long steps, long t) {
    if (steps > maxScanSteps) {
      throw new IllegalStateException("Window every=" + every + " period=" + period + " did not settle on bounds for "
          + Timestamps.format(t) + " within " + maxScanSteps + " steps");
    }
  }

  @Override
  public String toString() {
    return "Window[every=" + every + ", period=" + period + ", offset=" + offset + "]";
  }
}
