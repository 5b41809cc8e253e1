package se.alipsa.groupcore.lookup;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import se.alipsa.groupcore.key.GroupKey;

/**
 * Container mapping group keys to per-partition values.
 *
 * <p>
 * Implementations are not thread safe; one processing pass owns an instance exclusively. Values are opaque to the
 * container, which only stores and returns them.
 * </p>
 *
 * @param <V>
 *          the value type, values must not be {@code null}
 */
public interface KeyLookup<V> {

  /**
   * Retrieve the value associated with the key.
   *
   * @param key
   *          the key, a {@code null} key is never found
   * @return the value, or empty if the key is absent or deleted
   */
  Optional<V> lookup(GroupKey key);

  /**
   * Retrieve the value for the key, creating and storing one when the key is absent.
   *
   * @param key
   *          the key
   * @param factory
   *          creates the value for a new key
   * @return the existing or newly created value
   */
  default V lookupOrCreate(GroupKey key, Supplier<? extends V> factory) {
    Optional<V> existing = lookup(key);
    if (existing.isPresent()) {
      return existing.get();
    }
    V created = factory.get();
    set(key, created);
    return created;
  }

  /**
   * Associate a value with the key, overwriting any existing value.
   *
   * @param key
   *          the key
   * @param value
   *          the value
   */
  void set(GroupKey key, V value);

  /**
   * Remove the key.
   *
   * @param key
   *          the key, a {@code null} key is never found
   * @return the value that was removed, or empty if the key was absent
   */
  Optional<V> delete(GroupKey key);

  /**
   * Visit every live entry. Calling {@link #set} or {@link #delete} from the callback is allowed; calling
   * {@code range} from the callback is not.
   *
   * @param fn
   *          the callback receiving each key and value
   */
  void range(BiConsumer<? super GroupKey, ? super V> fn);

  /**
   * Remove every entry.
   */
  void clear();
}
