package groupcore.window;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.groupcore.values.CalendarDuration;
import se.alipsa.groupcore.values.Timestamps;
import se.alipsa.groupcore.window.Bounds;
import se.alipsa.groupcore.window.Window;

/** Tests for {@link Window}. */
class WindowTest {

  private static final long SECOND = 1_000_000_000L;
  private static final long MINUTE = 60 * SECOND;

  private static Window window(String every, String period, String offset) {
    return Window.of(CalendarDuration.parse(every), CalendarDuration.parse(period), CalendarDuration.parse(offset));
  }

  private static long t(String rfc3339) {
    return Timestamps.parse(rfc3339);
  }

  private static Bounds bounds(String start, String stop) {
    return Bounds.of(t(start), t(stop));
  }

  @Test
  void rejectsInvalidEvery() {
    IllegalArgumentException zero = assertThrows(IllegalArgumentException.class, () -> window("0s", "1m", "0s"));
    assertEquals("duration used as an interval cannot be zero", zero.getMessage());
    assertThrows(IllegalArgumentException.class, () -> window("1mo1d", "1m", "0s"));
    assertThrows(IllegalArgumentException.class, () -> window("-1m", "1m", "0s"));
  }

  @Test
  void tumblingWindowContainsTime() {
    Window w = window("5m", "5m", "0s");
    assertEquals(Bounds.of(5 * MINUTE, 10 * MINUTE), w.getLatestBounds(6 * MINUTE));
    assertEquals(Bounds.of(5 * MINUTE, 10 * MINUTE), w.getLatestBounds(5 * MINUTE));
  }

  @Test
  void negativePeriodExtendsBackwards() {
    Window w = window("5m", "-5m", "30s");
    assertEquals(Bounds.of(30 * SECOND, 5 * MINUTE + 30 * SECOND), w.getLatestBounds(5 * MINUTE));
  }

  @Test
  void overlappingNegativePeriodPicksLatestStart() {
    Window w = window("5m", "-15m", "0s");
    assertEquals(Bounds.of(5 * MINUTE, 20 * MINUTE), w.getLatestBounds(6 * MINUTE));
  }

  @Test
  void truncatesBeforeOffset() {
    Window w = window("5s", "5s", "2s");
    assertEquals(Bounds.of(-3 * SECOND, 2 * SECOND), w.getLatestBounds(SECOND));
  }

  @Test
  void underlappingReturnsNearestPreceding() {
    Window w = window("2m", "1m", "30s");
    assertEquals(Bounds.of(2 * MINUTE + 30 * SECOND, 3 * MINUTE + 30 * SECOND), w.getLatestBounds(3 * MINUTE));
    Bounds gap = w.getLatestBounds(2 * MINUTE + 15 * SECOND);
    assertEquals(Bounds.of(30 * SECOND, MINUTE + 30 * SECOND), gap);
    assertFalse(gap.contains(2 * MINUTE + 15 * SECOND));
  }

  @Test
  void partiallyOverlapping() {
    Window w = window("1m", "3m30s", "30s");
    assertEquals(Bounds.of(5 * MINUTE + 30 * SECOND, 9 * MINUTE), w.getLatestBounds(5 * MINUTE + 45 * SECOND));
    assertEquals(Bounds.of(4 * MINUTE + 30 * SECOND, 8 * MINUTE), w.getLatestBounds(5 * MINUTE));
  }

  @Test
  void calendarMonths() {
    Window w = window("5mo", "5mo", "0s");
    assertEquals(bounds("1970-01-01T00:00:00Z", "1970-06-01T00:00:00Z"), w.getLatestBounds(0));
  }

  @Test
  void calendarMonthsWithMonthOffset() {
    Window w = window("3mo", "3mo", "1mo");
    assertEquals(bounds("1969-11-01T00:00:00Z", "1970-02-01T00:00:00Z"), w.getLatestBounds(0));
  }

  @Test
  void calendarNegativePeriod() {
    Window w = window("4mo", "-10mo", "0s");
    assertEquals(bounds("1970-03-01T00:00:00Z", "1971-01-01T00:00:00Z"),
        w.getLatestBounds(t("1970-03-01T00:00:00Z")));
  }

  @Test
  void mixedPeriod() {
    Window w = window("2mo", "1mo10h", "0s");
    assertEquals(bounds("1970-07-01T00:00:00Z", "1970-08-01T10:00:00Z"),
        w.getLatestBounds(t("1970-07-10T00:00:00Z")));
  }

  @Test
  void mixedNegativePeriod() {
    Window w = window("1mo", "-1mo24h", "0s");
    assertEquals(bounds("1970-06-30T00:00:00Z", "1970-08-01T00:00:00Z"),
        w.getLatestBounds(t("1970-07-10T00:00:00Z")));
  }

  @Test
  void mixedOffset() {
    Window w = window("2mo", "2mo", "1mo10h");
    assertEquals(bounds("1970-06-01T10:00:00Z", "1970-08-01T10:00:00Z"),
        w.getLatestBounds(t("1970-07-10T00:00:00Z")));
  }

  @Test
  void negativeMixedOffset() {
    Window w = window("2mo", "2mo", "-1mo24h");
    assertEquals(bounds("1970-05-30T00:00:00Z", "1970-07-30T00:00:00Z"),
        w.getLatestBounds(t("1970-07-10T00:00:00Z")));
  }

  @Test
  void monthlyWindowWithSmallNegativeOffsets() {
    for (String offset : List.of("-2h", "-2m", "-2s", "-2ns")) {
      Window w = window("1mo", "1mo", offset);
      CalendarDuration shift = CalendarDuration.parse(offset);
      long before = shift.addTo(t("1970-07-31T00:00:00Z")) - 1;
      long after = shift.addTo(t("1970-08-01T00:00:00Z")) + 1;
      assertEquals(Bounds.of(shift.addTo(t("1970-07-01T00:00:00Z")), shift.addTo(t("1970-07-31T00:00:00Z"))),
          w.getLatestBounds(before), offset);
      assertEquals(Bounds.of(shift.addTo(t("1970-08-01T00:00:00Z")), shift.addTo(t("1970-09-01T00:00:00Z"))),
          w.getLatestBounds(after), offset);
    }
  }

  @Test
  void monthEndClampWithNegativeHourOffset() {
    Window w = window("1mo", "1mo", "-2h");
    assertEquals(bounds("1970-06-30T22:00:00Z", "1970-07-30T22:00:00Z"),
        w.getLatestBounds(t("1970-07-31T21:00:00Z")));
    assertEquals(bounds("1970-07-31T22:00:00Z", "1970-08-31T22:00:00Z"),
        w.getLatestBounds(t("1970-07-31T23:00:00Z")));
  }

  @Test
  void nextBoundsDoesNotDriftAcrossMonthEnds() {
    Window w = window("1mo", "1mo", "-24h");
    Bounds b = w.getLatestBounds(t("2020-10-01T00:00:00Z"));
    assertEquals(bounds("2020-09-30T00:00:00Z", "2020-10-30T00:00:00Z"), b);
    Bounds february = null;
    for (int i = 0; i < 12 && february == null; i++) {
      b = w.nextBounds(b);
      if (b.start() == t("2021-02-28T00:00:00Z")) {
        february = b;
      }
    }
    assertEquals(bounds("2021-02-28T00:00:00Z", "2021-03-28T00:00:00Z"), february);
    assertEquals(bounds("2021-03-31T00:00:00Z", "2021-04-30T00:00:00Z"), w.nextBounds(february));
    assertEquals(february, w.prevBounds(w.nextBounds(february)));
  }

  @Test
  void nextAndPrevStepByEvery() {
    Window w = window("5m", "5m", "0s");
    Bounds b = w.getLatestBounds(6 * MINUTE);
    assertEquals(Bounds.of(10 * MINUTE, 15 * MINUTE), w.nextBounds(b));
    assertEquals(Bounds.of(0, 5 * MINUTE), w.prevBounds(b));
    assertEquals(Bounds.of(-5 * MINUTE, 0), w.prevBounds(w.prevBounds(b)));
  }

  @Test
  void earliestBoundsOfOverlappingWindows() {
    Window w = window("1m", "3m30s", "30s");
    assertEquals(Bounds.of(2 * MINUTE + 30 * SECOND, 6 * MINUTE), w.getEarliestBounds(5 * MINUTE));
    Window gaps = window("2m", "1m", "30s");
    assertEquals(Bounds.of(30 * SECOND, MINUTE + 30 * SECOND), gaps.getEarliestBounds(2 * MINUTE + 15 * SECOND));
  }

  @Test
  void overlappingBoundsAreDescending() {
    Window w = window("1m", "3m30s", "30s");
    List<Bounds> found = w.getOverlappingBounds(5 * MINUTE, 6 * MINUTE);
    assertEquals(List.of(
        Bounds.of(5 * MINUTE + 30 * SECOND, 9 * MINUTE),
        Bounds.of(4 * MINUTE + 30 * SECOND, 8 * MINUTE),
        Bounds.of(3 * MINUTE + 30 * SECOND, 7 * MINUTE),
        Bounds.of(2 * MINUTE + 30 * SECOND, 6 * MINUTE)), found);
  }

  @Test
  void overlappingBoundsWithNegativePeriod() {
    Window w = window("5m", "-15m", "0s");
    List<Bounds> found = w.getOverlappingBounds(6 * MINUTE, 6 * MINUTE + 1);
    assertEquals(List.of(
        Bounds.of(5 * MINUTE, 20 * MINUTE),
        Bounds.of(0, 15 * MINUTE),
        Bounds.of(-5 * MINUTE, 10 * MINUTE)), found);
  }

  @Test
  void overlappingBoundsHoldAcrossManyRanges() {
    List<Window> windows = List.of(
        window("1m", "3m30s", "30s"),
        window("2m", "1m", "30s"),
        window("5m", "-15m", "0s"),
        window("1mo", "-1mo24h", "0s"),
        window("2mo", "1mo10h", "-2h"));
    for (Window w : windows) {
      for (long start = -40 * MINUTE; start < 40 * MINUTE; start += 7 * MINUTE + 13 * SECOND) {
        Bounds range = Bounds.of(start, start + 11 * MINUTE);
        List<Bounds> found = w.getOverlappingBounds(range.start(), range.stop());
        for (int i = 0; i < found.size(); i++) {
          assertTrue(found.get(i).overlaps(range), w + " " + range);
          if (i > 0) {
            assertTrue(found.get(i).start() < found.get(i - 1).start(), w + " " + range);
          }
        }
        Bounds before = w.prevBounds(found.isEmpty() ? w.getLatestBounds(range.stop()) : found.get(found.size() - 1));
        assertFalse(before.overlaps(range), w + " " + range);
      }
    }
  }

  @Test
  void emptyRangeHasNoOverlap() {
    Window w = window("1m", "1m", "0s");
    assertTrue(w.getOverlappingBounds(5 * MINUTE, 5 * MINUTE).isEmpty());
    assertTrue(w.getOverlappingBounds(6 * MINUTE, 5 * MINUTE).isEmpty());
    Window gaps = window("2m", "1m", "30s");
    assertTrue(gaps.getOverlappingBounds(MINUTE + 40 * SECOND, 2 * MINUTE + 20 * SECOND).isEmpty());
  }

  @Test
  void exposesDefinition() {
    Window w = window("1h", "2h", "-15m");
    assertEquals(CalendarDuration.parse("1h"), w.every());
    assertEquals(CalendarDuration.parse("2h"), w.period());
    assertEquals(CalendarDuration.parse("-15m"), w.offset());
    assertEquals("Window[every=1h, period=2h, offset=-15m]", w.toString());
  }
}
