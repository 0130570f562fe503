package org.waabox.mixtape.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;

/**
 * Tests for the eviction order of {@link PlaylistWriter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PlaylistWriterTest {

  @Test
  void whenEvicting_givenRepeatedKey_shouldPickTheLaterCopyFirst() {
    final List<Integer> evicted = PlaylistWriter.evictionOrder(
        tracks("A", "B", "A", "C"), keys("A", "B", "C"), 1);

    assertEquals(List.of(2), evicted);
  }

  @Test
  void whenEvicting_givenStaleEntries_shouldPickThemFromTheTail() {
    final List<Integer> evicted = PlaylistWriter.evictionOrder(
        tracks("S1", "A", "S2", "B"), keys("A", "B"), 1);

    assertEquals(List.of(2), evicted);
  }

  @Test
  void whenEvicting_givenOnlyWantedEntries_shouldDropTheTail() {
    final List<Integer> evicted = PlaylistWriter.evictionOrder(
        tracks("A", "B", "C"), keys("A", "B", "C"), 2);

    assertEquals(List.of(2, 1), evicted);
  }

  @Test
  void whenEvicting_givenMixedEntries_shouldFollowThePassOrder() {
    final List<Integer> evicted = PlaylistWriter.evictionOrder(
        tracks("A", "S1", "B", "A", "C"), keys("A", "B", "C"), 3);

    assertEquals(List.of(3, 1, 4), evicted);
  }

  private static List<Item> tracks(final String... keys) {
    final List<Item> items = new ArrayList<>();
    for (final String key : keys) {
      items.add(Item.of(key, key, "Artist"));
    }
    return items;
  }

  private static Set<ItemKey> keys(final String... keys) {
    final List<ItemKey> result = new ArrayList<>();
    for (final String key : keys) {
      result.add(ItemKey.of(key));
    }
    return Set.copyOf(result);
  }
}
