package se.alipsa.groupcore.key;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import se.alipsa.groupcore.values.ColumnType;

/**
 * Builds group keys from decoded Avro records.
 */
public final class AvroGroupKeys {

  private AvroGroupKeys() {
  }

  /**
   * Build a group key from the named fields of a record.
   *
   * @param record
   *          the decoded record
   * @param labels
   *          the fields that make up the key, in key column order
   * @return the group key
   * @throws IllegalArgumentException
   *           if a field is missing or has a type that cannot be a key column
   */
  public static GroupKey fromRecord(GenericRecord record, List<String> labels) {
    Objects.requireNonNull(record, "record");
    GroupKeyBuilder builder = GroupKey.builder();
    Schema schema = record.getSchema();
    for (String label : labels) {
      Schema.Field field = schema.getField(label);
      if (field == null) {
        throw new IllegalArgumentException("Record " + schema.getFullName() + " has no field " + label);
      }
      Schema effective = nonNullBranch(field.schema());
      ColumnType type = columnType(effective);
      builder.add(label, type, convert(record.get(field.pos()), effective, type));
    }
    return builder.build();
  }

  /**
   * A key column may come from an optional field; its values are then typed by the non-null branch of the union.
   *
   * @param s
   *          the field schema
   * @return the first non-null union branch, or {@code s} itself when it is not a union
   */
  static Schema nonNullBranch(Schema s) {
    if (s.getType() == Schema.Type.UNION) {
      for (Schema t : s.getTypes()) {
        if (t.getType() != Schema.Type.NULL) {
          return t;
        }
      }
    }
    return s;
  }

  /**
   * Map an Avro schema to the key column type that carries its values.
   *
   * @param s
   *          a non-union schema
   * @return the column type
   */
  static ColumnType columnType(Schema s) {
    LogicalType logical = s.getLogicalType();
    switch (s.getType()) {
      case BOOLEAN:
        return ColumnType.BOOL;
      case INT:
        return ColumnType.INT;
      case LONG:
        if (logical instanceof LogicalTypes.TimestampMillis || logical instanceof LogicalTypes.TimestampMicros) {
          return ColumnType.TIME;
        }
        return ColumnType.INT;
      case FLOAT, DOUBLE:
        return ColumnType.FLOAT;
      case STRING, ENUM:
        return ColumnType.STRING;
      default:
        throw new IllegalArgumentException("Unsupported group key field type: " + s);
    }
  }

  private static Object convert(Object raw, Schema s, ColumnType type) {
    if (raw == null) {
      return null;
    }
    if (type == ColumnType.STRING) {
      // Utf8 and GenericEnumSymbol both render their text
      return raw.toString();
    }
    if (type == ColumnType.TIME && raw instanceof Long l) {
      LogicalType logical = s.getLogicalType();
      if (logical instanceof LogicalTypes.TimestampMillis) {
        return TimeUnit.MILLISECONDS.toNanos(l);
      }
      return TimeUnit.MICROSECONDS.toNanos(l);
    }
    return raw;
  }
}
