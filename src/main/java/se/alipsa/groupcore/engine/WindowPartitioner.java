package se.alipsa.groupcore.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import se.alipsa.groupcore.key.GroupKey;
import se.alipsa.groupcore.key.GroupKeyBuilder;
import se.alipsa.groupcore.values.ColumnType;
import se.alipsa.groupcore.window.Bounds;
import se.alipsa.groupcore.window.Window;

/**
 * Assigns rows to windowed partitions by adding the window bounds to the row's group key.
 */
public final class WindowPartitioner {

  public static final String START_LABEL = "_start";
  public static final String STOP_LABEL = "_stop";

  private final Window window;

  public WindowPartitioner(Window window) {
    this.window = Objects.requireNonNull(window, "window");
  }

  public Window window() {
    return window;
  }

  /**
   * Compute the partition keys of a row.
   *
   * @param key
   *          the group key of the row
   * @param time
   *          the row timestamp, epoch nanoseconds
   * @return one key per window containing {@code time}, ascending by window start; empty when the time falls in a
   *         gap between windows
   */
  public List<GroupKey> assign(GroupKey key, long time) {
    List<Bounds> bounds = window.getOverlappingBounds(time, time + 1);
    List<GroupKey> keys = new ArrayList<>(bounds.size());
    for (int i = bounds.size() - 1; i >= 0; i--) {
      keys.add(withBounds(key, bounds.get(i)));
    }
    return keys;
  }

  /**
   * Add or replace the {@value #START_LABEL} and {@value #STOP_LABEL} columns of a key.
   *
   * @param key
   *          the key
   * @param bounds
   *          the window bounds
   * @return the windowed key
   */
  public static GroupKey withBounds(GroupKey key, Bounds bounds) {
    GroupKeyBuilder builder = GroupKey.builder().addAll(key);
    builder.set(START_LABEL, ColumnType.TIME, bounds.start());
    builder.set(STOP_LABEL, ColumnType.TIME, bounds.stop());
    return builder.build();
  }
}
