package se.alipsa.groupcore.window;

import se.alipsa.groupcore.values.CalendarDuration;
import se.alipsa.groupcore.values.Timestamps;

/**
 * A half-open time interval {@code [start, stop)} in epoch nanoseconds.
 *
 * <p>
 * Bounds produced by a {@link Window} remember the position of the window instance they came from, which lets the
 * window step to neighbouring bounds without accumulating calendar drift. The index takes no part in equality.
 * </p>
 */
public final class Bounds {

  private final long start;
  private final long stop;
  private final long index;

  Bounds(long start, long stop, long index) {
    this.start = start;
    this.stop = stop;
    this.index = index;
  }

  /**
   * Create bounds that are not tied to a window.
   *
   * @param start
   *          inclusive start, epoch nanoseconds
   * @param stop
   *          exclusive stop, epoch nanoseconds
   * @return the bounds
   */
  public static Bounds of(long start, long stop) {
    return new Bounds(start, stop, 0);
  }

  public long start() {
    return start;
  }

  public long stop() {
    return stop;
  }

  /**
   * @return the position of these bounds within the window that produced them
   */
  public long index() {
    return index;
  }

  /**
   * @return {@code true} when the interval contains no instant
   */
  public boolean isEmpty() {
    return start >= stop;
  }

  /**
   * @param t
   *          epoch nanoseconds
   * @return {@code true} if {@code start <= t < stop}
   */
  public boolean contains(long t) {
    return t >= start && t < stop;
  }

  /**
   * Half-open overlap test; intervals that only touch do not overlap.
   *
   * @param other
   *          the other bounds
   * @return {@code true} if the intervals share at least one instant
   */
  public boolean overlaps(Bounds other) {
    return start < other.stop && other.start < stop;
  }

  /**
   * @return the length of the interval in nanoseconds
   */
  public long length() {
    if (isEmpty()) {
      return 0;
    }
    return stop - start;
  }

  /**
   * @param other
   *          the other bounds
   * @return the shared interval, empty when the bounds do not overlap
   */
  public Bounds intersect(Bounds other) {
    long s = Math.max(start, other.start);
    long e = Math.min(stop, other.stop);
    if (s >= e) {
      return new Bounds(s, s, index);
    }
    return new Bounds(s, e, index);
  }

  /**
   * @param other
   *          the other bounds
   * @return the smallest bounds covering both intervals
   */
  public Bounds union(Bounds other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return new Bounds(Math.min(start, other.start), Math.max(stop, other.stop), index);
  }

  /**
   * @param d
   *          the shift, calendar months are applied to each end separately
   * @return the bounds moved by {@code d}
   */
  public Bounds shift(CalendarDuration d) {
    return new Bounds(d.addTo(start), d.addTo(stop), index);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Bounds other)) {
      return false;
    }
    return start == other.start && stop == other.stop;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(start) + Long.hashCode(stop);
  }

  @Override
  public String toString() {
    return "[" + Timestamps.format(start) + ", " + Timestamps.format(stop) + ")";
  }
}
