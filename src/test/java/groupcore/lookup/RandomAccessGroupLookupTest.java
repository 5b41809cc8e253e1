package groupcore.lookup;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import se.alipsa.groupcore.lookup.KeyLookup;
import se.alipsa.groupcore.lookup.RandomAccessGroupLookup;

/** Tests for {@link RandomAccessGroupLookup}. */
class RandomAccessGroupLookupTest extends KeyLookupContract {

  @Override
  KeyLookup<Integer> newLookup() {
    return new RandomAccessGroupLookup<>();
  }

  @Override
  boolean sorted() {
    return false;
  }

  @Test
  void rangeFollowsInsertionOrder() {
    KeyLookup<Integer> lookup = newLookup();
    lookup.set(KEY2, 2);
    lookup.set(KEY0, 0);
    lookup.set(KEY3, 3);
    lookup.set(KEY1, 1);
    assertEquals(List.of(KEY2, KEY0, KEY3, KEY1), keys(lookup));
  }

  @Test
  void resurrectedKeyKeepsItsSlot() {
    KeyLookup<Integer> lookup = newLookup();
    lookup.set(KEY0, 0);
    lookup.set(KEY1, 1);
    lookup.delete(KEY0);
    lookup.set(KEY0, 10);
    assertEquals(List.of(KEY0, KEY1), keys(lookup));
  }
}
