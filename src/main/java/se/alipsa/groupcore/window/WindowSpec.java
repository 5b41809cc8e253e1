package se.alipsa.groupcore.window;

import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import se.alipsa.groupcore.config.ConfigUtil;
import se.alipsa.groupcore.values.CalendarDuration;

/**
 * The query level description of a window: {@code every}, {@code period} and {@code offset}.
 *
 * @param every
 *          distance between the starts of successive windows
 * @param period
 *          width of each window
 * @param offset
 *          shift of the window sequence relative to the epoch
 */
public record WindowSpec(CalendarDuration every, CalendarDuration period, CalendarDuration offset) {

  private static final Set<String> KEYS = Set.of("every", "period", "offset");

  public WindowSpec {
    Objects.requireNonNull(every, "every");
    Objects.requireNonNull(period, "period");
    Objects.requireNonNull(offset, "offset");
  }

  /**
   * A tumbling window: the period equals {@code every} and there is no offset.
   *
   * @param every
   *          the window width and spacing
   * @return the window parameters
   */
  public static WindowSpec every(CalendarDuration every) {
    return new WindowSpec(every, every, CalendarDuration.ZERO);
  }

  /**
   * Parse a spec such as {@code every=1mo&period=1mo&offset=-1d}. The period defaults to {@code every} and the
   * offset to zero.
   *
   * @param query
   *          the parameters in URL query form
   * @return the window parameters
   * @throws IllegalArgumentException
   *           if {@code every} is missing, a key is unknown or a duration is malformed
   */
  public static WindowSpec parse(String query) {
    Properties props = ConfigUtil.parseQuery(query);
    for (String key : props.stringPropertyNames()) {
      if (!KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown window parameter '" + key + "' in " + query);
      }
    }
    String every = ConfigUtil.optional(props, "every");
    if (every == null) {
      throw new IllegalArgumentException("Window spec requires 'every': " + query);
    }
    CalendarDuration everyDuration = CalendarDuration.parse(every);
    String period = ConfigUtil.optional(props, "period");
    String offset = ConfigUtil.optional(props, "offset");
    return new WindowSpec(everyDuration,
        period == null ? everyDuration : CalendarDuration.parse(period),
        offset == null ? CalendarDuration.ZERO : CalendarDuration.parse(offset));
  }

  /**
   * @return a validated window for this spec
   */
  public Window toWindow() {
    return Window.of(this);
  }

  @Override
  public String toString() {
    return "every=" + every + "&period=" + period + "&offset=" + offset;
  }
}
