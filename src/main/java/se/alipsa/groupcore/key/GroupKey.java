package se.alipsa.groupcore.key;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import org.apache.avro.SchemaNormalization;
import se.alipsa.groupcore.values.ColumnMeta;
import se.alipsa.groupcore.values.ColumnType;
import se.alipsa.groupcore.values.Timestamps;

/**
 * Immutable identity of a table partition: a set of labeled, typed and nullable column values.
 *
 * <p>
 * Comparison, equality and hashing walk the columns in label order, so the order in which the columns were supplied
 * does not matter. A {@code null} value is a state of its column: two keys that are both null in the same column are
 * equal in that column, which coalesces rows with missing grouping values into a single partition.
 * </p>
 *
 * <p>
 * Keys are safe to share between threads. The 64-bit hash is computed on first use and published through a volatile
 * field; concurrent first callers may compute it more than once but always observe the same value.
 * </p>
 */
public final class GroupKey implements Comparable<GroupKey> {

  private static final GroupKey EMPTY = new GroupKey(List.of(), List.of());

  private static final byte SEPARATOR = 0;
  private static final byte NULL_MARKER = (byte) 0xFF;

  private final List<ColumnMeta> cols;
  private final List<Object> values;
  private final int[] sorted;
  private volatile Long hash;

  private GroupKey(List<ColumnMeta> cols, List<Object> values) {
    this.cols = cols;
    this.values = values;
    this.sorted = IntStream.range(0, cols.size()).boxed()
        .sorted(Comparator.comparing((Integer i) -> cols.get(i).label()))
        .mapToInt(Integer::intValue)
        .toArray();
  }

  /**
   * Create a group key from parallel column and value lists.
   *
   * @param cols
   *          the column metadata, labels must be unique
   * @param values
   *          the column values, {@code null} entries denote null columns
   * @return the group key
   * @throws IllegalArgumentException
   *           if the lists differ in length, a label repeats or a value does not match its column type
   */
  public static GroupKey of(List<ColumnMeta> cols, List<?> values) {
    Objects.requireNonNull(cols, "cols");
    Objects.requireNonNull(values, "values");
    if (cols.size() != values.size()) {
      throw new IllegalArgumentException(
          "Group key has " + cols.size() + " columns but " + values.size() + " values");
    }
    Set<String> labels = new HashSet<>();
    List<Object> coerced = new ArrayList<>(values.size());
    for (int i = 0; i < cols.size(); i++) {
      ColumnMeta col = Objects.requireNonNull(cols.get(i), "column " + i);
      if (!labels.add(col.label())) {
        throw new IllegalArgumentException("Duplicate group key column: " + col.label());
      }
      coerced.add(col.type().coerce(values.get(i)));
    }
    return new GroupKey(List.copyOf(cols), Collections.unmodifiableList(coerced));
  }

  /**
   * @return the shared key without columns.
   */
  public static GroupKey empty() {
    return EMPTY;
  }

  /**
   * @return a builder for assembling keys column by column
   */
  public static GroupKeyBuilder builder() {
    return new GroupKeyBuilder();
  }

  public List<ColumnMeta> cols() {
    return cols;
  }

  public List<Object> values() {
    return values;
  }

  public int size() {
    return cols.size();
  }

  public Object value(int j) {
    return values.get(j);
  }

  public boolean isNull(int j) {
    return values.get(j) == null;
  }

  public boolean valueBool(int j) {
    return (Boolean) typed(j, ColumnType.BOOL);
  }

  public long valueInt(int j) {
    return (Long) typed(j, ColumnType.INT);
  }

  /**
   * @param j
   *          the column index
   * @return the raw bits of an unsigned integer column, compare with {@link Long#compareUnsigned(long, long)}
   */
  public long valueUInt(int j) {
    return (Long) typed(j, ColumnType.UINT);
  }

  public double valueFloat(int j) {
    return (Double) typed(j, ColumnType.FLOAT);
  }

  public String valueString(int j) {
    return (String) typed(j, ColumnType.STRING);
  }

  /**
   * @param j
   *          the column index
   * @return nanoseconds since the epoch
   */
  public long valueTime(int j) {
    return (Long) typed(j, ColumnType.TIME);
  }

  private Object typed(int j, ColumnType expected) {
    ColumnMeta col = cols.get(j);
    if (col.type() != expected) {
      throw new IllegalStateException("Column " + col.label() + " is " + col.type() + ", not " + expected);
    }
    Object value = values.get(j);
    if (value == null) {
      throw new IllegalStateException("Column " + col.label() + " is null");
    }
    return value;
  }

  public boolean hasCol(String label) {
    return indexOf(label) >= 0;
  }

  /**
   * @param label
   *          the column label
   * @return the position of the column in {@link #cols()}, or -1 if absent
   */
  public int indexOf(String label) {
    for (int j = 0; j < cols.size(); j++) {
      if (cols.get(j).label().equals(label)) {
        return j;
      }
    }
    return -1;
  }

  /**
   * @param label
   *          the column label
   * @return the value of the column, empty if the column is absent or null
   */
  public Optional<Object> labelValue(String label) {
    int j = indexOf(label);
    return j < 0 ? Optional.empty() : Optional.ofNullable(values.get(j));
  }

  /**
   * Determine whether both keys identify the same partition.
   *
   * @param other
   *          the key to compare with
   * @return {@code true} if the keys have the same columns and equal values in each
   */
  public boolean equal(GroupKey other) {
    if (this == other) {
      return true;
    }
    if (other == null || cols.size() != other.cols.size()) {
      return false;
    }
    for (int i = 0; i < sorted.length; i++) {
      int idx = sorted[i];
      int jdx = other.sorted[i];
      if (!cols.get(idx).equals(other.cols.get(jdx))) {
        return false;
      }
      Object a = values.get(idx);
      Object b = other.values.get(jdx);
      if (a == null && b == null) {
        continue;
      } else if (a == null || b == null) {
        return false;
      }
      if (compareValues(cols.get(idx).type(), a, b) != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Strict weak ordering over keys, used to keep ordered lookups sorted.
   *
   * @param other
   *          the key to compare with
   * @return {@code true} if this key orders before {@code other}
   */
  public boolean less(GroupKey other) {
    int min = Math.min(sorted.length, other.sorted.length);
    for (int i = 0; i < min; i++) {
      ColumnMeta a = cols.get(sorted[i]);
      ColumnMeta b = other.cols.get(other.sorted[i]);
      if (!a.label().equals(b.label())) {
        // The key with the later label is missing the other's column at this position, and missing sorts first.
        return a.label().compareTo(b.label()) > 0;
      }
      if (a.type() != b.type()) {
        return a.type().ordinal() < b.type().ordinal();
      }
      Object av = values.get(sorted[i]);
      Object bv = other.values.get(other.sorted[i]);
      if (av == null && bv == null) {
        continue;
      } else if (av == null) {
        return true;
      } else if (bv == null) {
        return false;
      }
      int cmp = compareValues(a.type(), av, bv);
      if (cmp != 0) {
        return cmp < 0;
      }
    }
    return sorted.length < other.sorted.length;
  }

  private static int compareValues(ColumnType type, Object a, Object b) {
    return switch (type) {
      case BOOL -> Boolean.compare((Boolean) a, (Boolean) b);
      case INT, TIME -> Long.compare((Long) a, (Long) b);
      case UINT -> Long.compareUnsigned((Long) a, (Long) b);
      case FLOAT -> Double.compare((Double) a, (Double) b);
      case STRING -> ((String) a).compareTo((String) b);
    };
  }

  /**
   * The 64-bit hash of this key, computed once.
   *
   * @return the hash value
   */
  public long hash64() {
    Long h = hash;
    if (h == null) {
      h = SchemaNormalization.fingerprint64(hashBytes());
      hash = h;
    }
    return h;
  }

  private byte[] hashBytes() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteBuffer number = ByteBuffer.allocate(Long.BYTES);
    for (int idx : sorted) {
      ColumnMeta col = cols.get(idx);
      out.writeBytes(col.label().getBytes(StandardCharsets.UTF_8));
      out.write(SEPARATOR);
      out.write(col.type().tag());
      Object v = values.get(idx);
      if (v == null) {
        // Keeps a null string distinct from an empty one.
        out.write(NULL_MARKER);
      } else {
        switch (col.type()) {
          case BOOL -> out.write((Boolean) v ? 1 : 0);
          case INT, UINT, TIME -> out.writeBytes(number.putLong(0, (Long) v).array());
          // Canonical NaN bits, matching Double.compare equality.
          case FLOAT -> out.writeBytes(number.putLong(0, Double.doubleToLongBits((Double) v)).array());
          case STRING -> out.writeBytes(((String) v).getBytes(StandardCharsets.UTF_8));
          default -> throw new IllegalStateException("Unhandled column type " + col.type());
        }
      }
      out.write(SEPARATOR);
    }
    return out.toByteArray();
  }

  @Override
  public int compareTo(GroupKey other) {
    if (less(other)) {
      return -1;
    }
    return other.less(this) ? 1 : 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof GroupKey other && equal(other);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(hash64());
  }

  @Override
  public String toString() {
    StringBuilder b = new StringBuilder("{");
    for (int j = 0; j < cols.size(); j++) {
      if (j != 0) {
        b.append(',');
      }
      b.append(cols.get(j).label()).append('=');
      Object v = values.get(j);
      if (v == null) {
        b.append("null");
      } else if (cols.get(j).type() == ColumnType.TIME) {
        b.append(Timestamps.format((Long) v));
      } else if (cols.get(j).type() == ColumnType.UINT) {
        b.append(Long.toUnsignedString((Long) v));
      } else {
        b.append(v);
      }
    }
    return b.append('}').toString();
  }
}
