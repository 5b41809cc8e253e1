package se.alipsa.groupcore.window;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import se.alipsa.groupcore.values.CalendarDuration;
import se.alipsa.groupcore.values.Timestamps;

/** Index arithmetic of {@link Window}. */
class WindowIndexTest {

  private static final long SECOND = 1_000_000_000L;

  @Test
  void floorsNegativeDeltas() {
    Window w = Window.of(CalendarDuration.ofNanos(5 * SECOND), CalendarDuration.ofNanos(5 * SECOND),
        CalendarDuration.ZERO);
    assertEquals(0, w.lastIndex(0));
    assertEquals(0, w.lastIndex(5 * SECOND - 1));
    assertEquals(-1, w.lastIndex(-1));
    assertEquals(-1, w.lastIndex(-5 * SECOND));
    assertEquals(-2, w.lastIndex(-5 * SECOND - 1));
  }

  @Test
  void monthIndexBeforeTheEpoch() {
    Window w = Window.of(CalendarDuration.ofMonths(1), CalendarDuration.ofMonths(1), CalendarDuration.ZERO);
    assertEquals(-1, w.lastIndex(-1));
    assertEquals(-12, w.lastIndex(Timestamps.parse("1969-01-01T00:00:00Z")));
    assertEquals(-13, w.lastIndex(Timestamps.parse("1969-01-01T00:00:00Z") - 1));
  }

  @Test
  void monthIndexCorrectsForClampedStarts() {
    Window w = Window.of(CalendarDuration.ofMonths(1), CalendarDuration.ofMonths(1), CalendarDuration.parse("30d"));
    long t = Timestamps.parse("1970-02-28T12:00:00Z");
    assertEquals(1, w.lastIndex(t));
    Bounds b = w.getLatestBounds(t);
    assertEquals(Timestamps.parse("1970-02-28T00:00:00Z"), b.start());
    assertEquals(Timestamps.parse("1970-03-28T00:00:00Z"), b.stop());
    assertEquals(Timestamps.parse("1970-03-31T00:00:00Z"), w.nextBounds(b).start());
  }
}
