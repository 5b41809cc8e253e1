package se.alipsa.groupcore.lookup;

import java.util.Locale;

/**
 * The available {@link KeyLookup} implementations.
 */
public enum LookupType {
  /** Keys kept in sorted order, fastest when keys mostly arrive ascending. */
  ORDERED,
  /** Hash indexed, for keys that arrive in no particular order. */
  RANDOM_ACCESS;

  /**
   * @param <V>
   *          the value type
   * @return a new, empty lookup of this type
   */
  public <V> KeyLookup<V> newLookup() {
    return switch (this) {
      case ORDERED -> new GroupLookup<>();
      case RANDOM_ACCESS -> new RandomAccessGroupLookup<>();
    };
  }

  /**
   * Resolve a configuration name such as {@code ordered} or {@code random}.
   *
   * @param name
   *          the configured name
   * @return the lookup type
   * @throws IllegalArgumentException
   *           if the name is unknown
   */
  public static LookupType fromName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    switch (normalized) {
      case "ordered", "sorted":
        return ORDERED;
      case "random", "random_access", "hash":
        return RANDOM_ACCESS;
      default:
        throw new IllegalArgumentException("Unknown lookup type: " + name);
    }
  }
}
