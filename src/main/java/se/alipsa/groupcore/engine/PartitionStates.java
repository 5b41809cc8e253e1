package se.alipsa.groupcore.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import se.alipsa.groupcore.key.GroupKey;
import se.alipsa.groupcore.lookup.KeyLookup;
import se.alipsa.groupcore.lookup.LookupType;

/**
 * Per-partition state of one processing pass, keyed by {@link GroupKey}.
 *
 * <p>
 * The states are opaque; typically they hold handles to buffers that the caller retains and releases. Not thread
 * safe.
 * </p>
 *
 * @param <S>
 *          the state type
 */
public final class PartitionStates<S> {

  private final KeyLookup<S> lookup;
  private int size;

  /**
   * @param type
   *          the lookup implementation to keep the states in
   */
  public PartitionStates(LookupType type) {
    this.lookup = Objects.requireNonNull(type, "type").newLookup();
  }

  /**
   * Return the state of a partition, creating it on first use.
   *
   * @param key
   *          the partition key
   * @param factory
   *          creates the state of a new partition
   * @return the state
   */
  public S stateFor(GroupKey key, Supplier<? extends S> factory) {
    return lookup.lookupOrCreate(key, () -> {
      size++;
      return factory.get();
    });
  }

  /**
   * @param key
   *          the partition key
   * @return the state, empty if the partition has none
   */
  public Optional<S> find(GroupKey key) {
    return lookup.lookup(key);
  }

  /**
   * Drop the state of a partition.
   *
   * @param key
   *          the partition key
   * @return the dropped state, empty if the partition had none
   */
  public Optional<S> release(GroupKey key) {
    Optional<S> removed = lookup.delete(key);
    if (removed.isPresent()) {
      size--;
    }
    return removed;
  }

  /**
   * Visit each partition; the callback may release partitions.
   *
   * @param fn
   *          the callback
   */
  public void forEach(BiConsumer<? super GroupKey, ? super S> fn) {
    lookup.range(fn);
  }

  /**
   * @return the number of live partitions
   */
  public int size() {
    return size;
  }

  public void clear() {
    lookup.clear();
    size = 0;
  }
}
