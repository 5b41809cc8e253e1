package se.alipsa.groupcore.lookup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.ToLongFunction;
import se.alipsa.groupcore.key.GroupKey;

/**
 * Hash indexed {@link KeyLookup} for keys that arrive in no particular order.
 *
 * <p>
 * Entries live in an append-only list of slots. A table maps each key hash to the first slot with that hash, and
 * slots sharing a hash are chained through their {@code next} index. Deleting a key only flags its slot so that the
 * chain stays intact for keys that collide with it. {@link #range} visits slots in insertion order.
 * </p>
 *
 * @param <V>
 *          the value type
 */
public final class RandomAccessGroupLookup<V> implements KeyLookup<V> {

  private static final int END_OF_CHAIN = -1;

  private final ToLongFunction<GroupKey> hasher;
  private final List<Slot<V>> slots = new ArrayList<>();
  private final Map<Long, Integer> buckets = new HashMap<>();

  public RandomAccessGroupLookup() {
    this(GroupKey::hash64);
  }

  RandomAccessGroupLookup(ToLongFunction<GroupKey> hasher) {
    this.hasher = Objects.requireNonNull(hasher, "hasher");
  }

  @Override
  public Optional<V> lookup(GroupKey key) {
    if (key == null) {
      return Optional.empty();
    }
    int i = find(key, hasher.applyAsLong(key));
    if (i == END_OF_CHAIN || slots.get(i).deleted) {
      return Optional.empty();
    }
    return Optional.of(slots.get(i).value);
  }

  @Override
  public void set(GroupKey key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long hash = hasher.applyAsLong(key);
    int i = find(key, hash);
    if (i != END_OF_CHAIN) {
      Slot<V> slot = slots.get(i);
      slot.value = value;
      slot.deleted = false;
      return;
    }

    int added = slots.size();
    slots.add(new Slot<>(key, value));
    Integer head = buckets.get(hash);
    if (head == null) {
      buckets.put(hash, added);
      return;
    }
    Slot<V> tail = slots.get(head);
    while (tail.next != END_OF_CHAIN) {
      tail = slots.get(tail.next);
    }
    tail.next = added;
  }

  @Override
  public Optional<V> delete(GroupKey key) {
    if (key == null) {
      return Optional.empty();
    }
    int i = find(key, hasher.applyAsLong(key));
    if (i == END_OF_CHAIN || slots.get(i).deleted) {
      return Optional.empty();
    }
    Slot<V> slot = slots.get(i);
    V value = slot.value;
    slot.deleted = true;
    slot.value = null;
    return Optional.of(value);
  }

  @Override
  public void range(BiConsumer<? super GroupKey, ? super V> fn) {
    // Slots appended by the callback are visited in this pass as well.
    for (int i = 0; i < slots.size(); i++) {
      Slot<V> slot = slots.get(i);
      if (slot.deleted) {
        continue;
      }
      fn.accept(slot.key, slot.value);
    }
  }

  @Override
  public void clear() {
    slots.clear();
    buckets.clear();
  }

  private int find(GroupKey key, long hash) {
    Integer head = buckets.get(hash);
    int i = head == null ? END_OF_CHAIN : head;
    while (i != END_OF_CHAIN) {
      Slot<V> slot = slots.get(i);
      if (slot.key.equal(key)) {
        return i;
      }
      i = slot.next;
    }
    return END_OF_CHAIN;
  }

  private static final class Slot<V> {
    private final GroupKey key;
    private V value;
    private boolean deleted;
    private int next = END_OF_CHAIN;

    Slot(GroupKey key, V value) {
      this.key = key;
      this.value = value;
    }
  }
}
