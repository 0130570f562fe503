package org.waabox.mixtape.catalog;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A playable item as seen from one replica of the catalog.
 *
 * <p>The activity timestamp depends on where the item was read from: for
 * rating searches it is the moment the replica's user last rated the item,
 * for playlist members it is the moment the item was added. Catalogs that
 * do not report it leave it empty.
 *
 * <p>Two items are the same recording if and only if their {@link #key()}
 * values are equal; the remaining fields are display data.
 *
 * @param key        the canonical key, never null
 * @param title      the display title, never null
 * @param artist     the primary attribution, never null
 * @param activityAt the activity timestamp, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Item(ItemKey key, String title, String artist,
    Instant activityAt) {

  /** The attribution used when the catalog reports none. */
  public static final String UNKNOWN_ARTIST = "Unknown";

  /**
   * Creates a new item.
   *
   * @param key        the canonical key, never null
   * @param title      the display title, never null
   * @param artist     the primary attribution, null means
   *                   {@link #UNKNOWN_ARTIST}
   * @param activityAt the activity timestamp, may be null
   */
  public Item {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(title, "title must not be null");
    if (artist == null || artist.isBlank()) {
      artist = UNKNOWN_ARTIST;
    }
  }

  /**
   * Creates an item without an activity timestamp.
   *
   * @param key    the catalog identifier, never null
   * @param title  the display title, never null
   * @param artist the primary attribution, may be null
   *
   * @return the item, never null
   */
  public static Item of(final String key, final String title,
      final String artist) {
    return new Item(ItemKey.of(key), title, artist, null);
  }

  /**
   * Returns the activity timestamp, if the catalog reported one.
   *
   * @return the timestamp, never null
   */
  public Optional<Instant> activity() {
    return Optional.ofNullable(activityAt);
  }

  /**
   * Returns a copy of this item carrying the given activity timestamp.
   *
   * @param timestamp the new timestamp, may be null
   *
   * @return a new item, never null
   */
  public Item withActivityAt(final Instant timestamp) {
    return new Item(key, title, artist, timestamp);
  }
}
