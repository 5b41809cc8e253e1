package groupcore.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import se.alipsa.groupcore.values.CalendarDuration;
import se.alipsa.groupcore.values.Timestamps;
import se.alipsa.groupcore.window.Bounds;
import se.alipsa.groupcore.window.Window;

/** Tests for {@link Bounds}. */
class BoundsTest {

  @Test
  void touchingEdgesDoNotOverlap() {
    assertFalse(Bounds.of(0, 10).overlaps(Bounds.of(10, 20)));
    assertFalse(Bounds.of(10, 20).overlaps(Bounds.of(0, 10)));
    assertTrue(Bounds.of(0, 10).overlaps(Bounds.of(5, 15)));
    assertTrue(Bounds.of(0, 10).overlaps(Bounds.of(2, 3)));
  }

  @Test
  void containsIsHalfOpen() {
    Bounds b = Bounds.of(0, 10);
    assertTrue(b.contains(0));
    assertTrue(b.contains(9));
    assertFalse(b.contains(10));
    assertFalse(b.contains(-1));
  }

  @Test
  void emptyAndLength() {
    assertTrue(Bounds.of(5, 5).isEmpty());
    assertTrue(Bounds.of(6, 5).isEmpty());
    assertEquals(0, Bounds.of(6, 5).length());
    assertEquals(10, Bounds.of(0, 10).length());
  }

  @Test
  void intersectAndUnion() {
    assertEquals(Bounds.of(5, 10), Bounds.of(0, 10).intersect(Bounds.of(5, 15)));
    assertTrue(Bounds.of(0, 10).intersect(Bounds.of(20, 30)).isEmpty());
    assertEquals(Bounds.of(0, 30), Bounds.of(0, 10).union(Bounds.of(20, 30)));
    assertEquals(Bounds.of(0, 10), Bounds.of(0, 10).union(Bounds.of(3, 3)));
  }

  @Test
  void shiftAppliesCalendarMonthsToEachEnd() {
    Bounds jan = Bounds.of(Timestamps.parse("2021-01-31T00:00:00Z"), Timestamps.parse("2021-03-31T00:00:00Z"));
    Bounds shifted = jan.shift(CalendarDuration.ofMonths(1));
    assertEquals(Timestamps.parse("2021-02-28T00:00:00Z"), shifted.start());
    assertEquals(Timestamps.parse("2021-04-30T00:00:00Z"), shifted.stop());
  }

  @Test
  void equalityIgnoresWindowPosition() {
    Window w = Window.of(CalendarDuration.ofNanos(10), CalendarDuration.ofNanos(10), CalendarDuration.ZERO);
    Bounds fromWindow = w.getLatestBounds(25);
    assertEquals(2, fromWindow.index());
    assertEquals(Bounds.of(20, 30), fromWindow);
    assertEquals(Bounds.of(20, 30).hashCode(), fromWindow.hashCode());
  }

  @Test
  void formatsAsRfc3339() {
    assertEquals("[1970-01-01T00:00:00Z, 1970-01-01T00:00:01Z)", Bounds.of(0, 1_000_000_000L).toString());
  }
}
