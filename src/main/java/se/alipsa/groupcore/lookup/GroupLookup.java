package se.alipsa.groupcore.lookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.groupcore.key.GroupKey;

/**
 * Ordered {@link KeyLookup} optimized for keys that arrive mostly in ascending order.
 *
 * <p>
 * Entries are kept in a list of key groups. Groups are ordered by their first key and each group holds a sorted run
 * of keys. A new key is always appended to the end of some group: when it belongs in the middle of a group, the
 * group is split at the insertion point and the tail moves into a new group placed right after it. The index of the
 * last group touched is cached so that ascending inserts and repeated lookups skip the binary search.
 * </p>
 *
 * <p>
 * Deleted entries are tombstoned in place. A group whose entries are all tombstoned is removed.
 * </p>
 *
 * @param <V>
 *          the value type
 */
public final class GroupLookup<V> implements KeyLookup<V> {

  private static final Logger log = LoggerFactory.getLogger(GroupLookup.class);

  private static final int BEFORE_ALL_GROUPS = -1;

  private final List<KeyGroup<V>> groups = new ArrayList<>();

  /** Index of the group an entry was last found in or appended to, -1 when unknown. */
  private int lastIndex = BEFORE_ALL_GROUPS;

  /** Generation tag for the next group; never reused so range can detect a replaced slot. */
  private long nextId = 1;

  @Override
  public Optional<V> lookup(GroupKey key) {
    if (key == null || groups.isEmpty()) {
      return Optional.empty();
    }
    int group = lookupGroup(key);
    if (group == BEFORE_ALL_GROUPS) {
      return Optional.empty();
    }
    KeyGroup<V> kg = groups.get(group);
    int i = kg.index(key);
    return i == -1 ? Optional.empty() : Optional.of(kg.at(i));
  }

  @Override
  public void set(GroupKey key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    createOrSetInGroup(lookupGroup(key), key, value);
  }

  @Override
  public Optional<V> delete(GroupKey key) {
    if (key == null || groups.isEmpty()) {
      return Optional.empty();
    }
    int group = lookupGroup(key);
    if (group == BEFORE_ALL_GROUPS) {
      return Optional.empty();
    }
    KeyGroup<V> kg = groups.get(group);
    int i = kg.index(key);
    if (i == -1) {
      return Optional.empty();
    }
    V value = kg.at(i);
    kg.delete(i);
    if (kg.deleted == kg.elements.size()) {
      groups.remove(group);
      lastIndex = BEFORE_ALL_GROUPS;
      if (log.isTraceEnabled()) {
        log.trace("Removed emptied key group {} at position {}, {} groups remain", kg.id, group, groups.size());
      }
    }
    return Optional.of(value);
  }

  @Override
  public void range(BiConsumer<? super GroupKey, ? super V> fn) {
    int i = 0;
    while (i < groups.size()) {
      KeyGroup<V> kg = groups.get(i);
      for (int j = 0; j < kg.elements.size(); j++) {
        Element<V> entry = kg.elements.get(j);
        if (entry.deleted) {
          continue;
        }
        fn.accept(entry.key, entry.value);
      }
      // A different group in this slot means the callback inserted or removed a group; look at the slot again.
      if (i < groups.size() && groups.get(i).id == kg.id) {
        i++;
      }
    }
  }

  @Override
  public void clear() {
    groups.clear();
    lastIndex = BEFORE_ALL_GROUPS;
  }

  /**
   * Find the group where the key is located or would be inserted.
   *
   * @param key
   *          the key
   * @return the index of the last group whose first key is not greater than the key, or -1 if the key orders before
   *         every group
   */
  private int lookupGroup(GroupKey key) {
    if (lastIndex >= 0) {
      KeyGroup<V> kg = groups.get(lastIndex);
      if (!key.less(kg.first())
          && (lastIndex == groups.size() - 1 || key.less(groups.get(lastIndex + 1).first()))) {
        return lastIndex;
      }
    }

    // Binary search for the first group whose first key is greater than the key; the one before it is the target.
    int lo = 0;
    int hi = groups.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (key.less(groups.get(mid).first())) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    int index = lo - 1;
    if (index >= 0) {
      lastIndex = index;
    }
    return index;
  }

  private void createOrSetInGroup(int index, GroupKey key, V value) {
    if (index == BEFORE_ALL_GROUPS) {
      KeyGroup<V> kg = newKeyGroup(new ArrayList<>());
      kg.elements.add(new Element<>(key, value));
      groups.add(0, kg);
      lastIndex = 0;
      return;
    }

    KeyGroup<V> kg = groups.get(index);
    int i = kg.insertAt(key);

    if (i == kg.elements.size()) {
      kg.elements.add(new Element<>(key, value));
      return;
    }
    if (kg.elements.get(i).key.equal(key)) {
      kg.set(i, value);
      return;
    }

    // Split: the tail from the insertion point moves into a new group right after this one,
    // then the key is appended to the shortened group.
    List<Element<V>> tail = kg.elements.subList(i, kg.elements.size());
    KeyGroup<V> split = newKeyGroup(new ArrayList<>(tail));
    for (Element<V> moved : split.elements) {
      if (moved.deleted) {
        kg.deleted--;
        split.deleted++;
      }
    }
    tail.clear();
    kg.elements.add(new Element<>(key, value));
    if (split.deleted == split.elements.size()) {
      // Only tombstones were carved off.
      return;
    }
    groups.add(index + 1, split);
    if (log.isTraceEnabled()) {
      log.trace("Split key group {} at element {} into new group {}, {} groups total", kg.id, i, split.id,
          groups.size());
    }
  }

  private KeyGroup<V> newKeyGroup(List<Element<V>> elements) {
    return new KeyGroup<>(nextId++, elements);
  }

  /** A sorted run of keys. */
  private static final class KeyGroup<V> {
    private final long id;
    private final List<Element<V>> elements;
    private int deleted;

    KeyGroup(long id, List<Element<V>> elements) {
      this.id = id;
      this.elements = elements;
    }

    GroupKey first() {
      return elements.get(0).key;
    }

    GroupKey last() {
      return elements.get(elements.size() - 1).key;
    }

    V at(int i) {
      return elements.get(i).value;
    }

    void set(int i, V value) {
      Element<V> element = elements.get(i);
      if (element.deleted) {
        element.deleted = false;
        deleted--;
      }
      element.value = value;
    }

    void delete(int i) {
      Element<V> element = elements.get(i);
      element.value = null;
      element.deleted = true;
      deleted++;
    }

    /**
     * @return the position of a live entry for the key, or -1
     */
    int index(GroupKey key) {
      int i = insertAt(key);
      if (i >= elements.size()) {
        return -1;
      }
      Element<V> element = elements.get(i);
      if (element.deleted || !element.key.equal(key)) {
        return -1;
      }
      return i;
    }

    /**
     * @return the position of the key if present, otherwise the position it would be inserted at
     */
    int insertAt(GroupKey key) {
      if (last().less(key)) {
        return elements.size();
      }
      int lo = 0;
      int hi = elements.size();
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (elements.get(mid).key.less(key)) {
          lo = mid + 1;
        } else {
          hi = mid;
        }
      }
      return lo;
    }
  }

  private static final class Element<V> {
    private final GroupKey key;
    private V value;
    private boolean deleted;

    Element(GroupKey key, V value) {
      this.key = key;
      this.value = value;
    }
  }
}
