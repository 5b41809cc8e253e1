package se.alipsa.groupcore.values;

import java.time.Instant;

/**
 * The value types a group key column can hold.
 *
 * <p>
 * The declaration order is significant: {@link #ordinal()} decides the order of two columns that share a label
 * but differ in type, and {@link #tag()} is folded into the key hash.
 * </p>
 */
public enum ColumnType {
  BOOL,
  INT,
  UINT,
  FLOAT,
  STRING,
  /** Nanoseconds since the Unix epoch, UTC. */
  TIME;

  /**
   * @return the type tag byte used when hashing a column of this type.
   */
  public byte tag() {
    return (byte) (ordinal() + 1);
  }

  /**
   * Convert a value to the Java carrier of this type.
   *
   * @param value
   *          the value to convert, may be {@code null}
   * @return the converted value or {@code null} when {@code value} is {@code null}
   * @throws IllegalArgumentException
   *           if the value cannot represent this type
   */
  public Object coerce(Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
      case BOOL:
        if (value instanceof Boolean) {
          return value;
        }
        break;
      case INT, UINT:
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
          return ((Number) value).longValue();
        }
        break;
      case FLOAT:
        if (value instanceof Double || value instanceof Float) {
          return ((Number) value).doubleValue();
        }
        break;
      case STRING:
        if (value instanceof CharSequence cs) {
          return cs.toString();
        }
        break;
      case TIME:
        if (value instanceof Instant instant) {
          return Timestamps.fromInstant(instant);
        }
        if (value instanceof Long || value instanceof Integer) {
          return ((Number) value).longValue();
        }
        break;
      default:
        break;
    }
    throw new IllegalArgumentException(
        "Value " + value + " of type " + value.getClass().getName() + " is not a valid " + this);
  }
}
