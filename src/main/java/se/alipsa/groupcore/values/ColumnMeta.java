package se.alipsa.groupcore.values;

import java.util.Objects;

/**
 * Label and type of a single group key column.
 *
 * @param label
 *          the column label
 * @param type
 *          the column type
 */
public record ColumnMeta(String label, ColumnType type) {

  public ColumnMeta {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(type, "type");
  }

  /**
   * Shorthand factory.
   *
   * @param label
   *          the column label
   * @param type
   *          the column type
   * @return the column metadata
   */
  public static ColumnMeta of(String label, ColumnType type) {
    return new ColumnMeta(label, type);
  }
}
