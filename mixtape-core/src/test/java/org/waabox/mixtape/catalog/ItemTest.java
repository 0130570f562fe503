package org.waabox.mixtape.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Item} and {@link ItemKey}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ItemTest {

  @Test
  void whenCreatingKey_givenBlankValue_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () -> ItemKey.of("  "));
    assertThrows(NullPointerException.class, () -> ItemKey.of(null));
  }

  @Test
  void whenComparingKeys_givenSameValue_shouldBeEqual() {
    assertEquals(ItemKey.of("/library/metadata/42"),
        ItemKey.of("/library/metadata/42"));
    assertEquals("/library/metadata/42",
        ItemKey.of("/library/metadata/42").toString());
  }

  @Test
  void whenCreatingItem_givenBlankArtist_shouldFallBackToUnknown() {
    assertEquals(Item.UNKNOWN_ARTIST, Item.of("k1", "Song", null).artist());
    assertEquals(Item.UNKNOWN_ARTIST, Item.of("k1", "Song", "").artist());
  }

  @Test
  void whenCreatingItem_givenNoTimestamp_shouldReportNoActivity() {
    final Item item = Item.of("k1", "Song", "Band");

    assertFalse(item.activity().isPresent());
  }

  @Test
  void whenAttachingTimestamp_givenItem_shouldKeepIdentity() {
    final Instant at = Instant.parse("2026-03-01T10:00:00Z");
    final Item item = Item.of("k1", "Song", "Band");

    final Item rated = item.withActivityAt(at);

    assertEquals(item.key(), rated.key());
    assertTrue(rated.activity().isPresent());
    assertEquals(at, rated.activityAt());
    assertNotEquals(item, rated);
  }
}
