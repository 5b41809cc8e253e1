package se.alipsa.groupcore.key;

import java.util.ArrayList;
import java.util.List;
import se.alipsa.groupcore.values.ColumnMeta;
import se.alipsa.groupcore.values.ColumnType;

/**
 * Mutable builder for {@link GroupKey} instances.
 *
 * <p>
 * Columns keep the order in which they were added. Duplicate labels are reported by {@link #build()} so that a
 * builder can be filled from several sources before validation.
 * </p>
 */
public final class GroupKeyBuilder {

  private final List<ColumnMeta> cols = new ArrayList<>();
  private final List<Object> values = new ArrayList<>();

  GroupKeyBuilder() {
    // Use GroupKey.builder()
  }

  /**
   * Append a column.
   *
   * @param label
   *          the column label
   * @param type
   *          the column type
   * @param value
   *          the value, may be {@code null}
   * @return this builder for chaining
   */
  public GroupKeyBuilder add(String label, ColumnType type, Object value) {
    cols.add(ColumnMeta.of(label, type));
    values.add(value);
    return this;
  }

  /**
   * Append every column of an existing key.
   *
   * @param key
   *          the key to copy columns from
   * @return this builder for chaining
   */
  public GroupKeyBuilder addAll(GroupKey key) {
    cols.addAll(key.cols());
    values.addAll(key.values());
    return this;
  }

  /**
   * Replace the column with the given label, or append it when absent.
   *
   * @param label
   *          the column label
   * @param type
   *          the column type
   * @param value
   *          the value, may be {@code null}
   * @return this builder for chaining
   */
  public GroupKeyBuilder set(String label, ColumnType type, Object value) {
    for (int j = 0; j < cols.size(); j++) {
      if (cols.get(j).label().equals(label)) {
        cols.set(j, ColumnMeta.of(label, type));
        values.set(j, value);
        return this;
      }
    }
    return add(label, type, value);
  }

  public int size() {
    return cols.size();
  }

  /**
   * @return the key holding the columns added so far
   * @throws IllegalArgumentException
   *           if a label was added twice or a value does not match its column type
   */
  public GroupKey build() {
    if (cols.isEmpty()) {
      return GroupKey.empty();
    }
    return GroupKey.of(cols, values);
  }
}
