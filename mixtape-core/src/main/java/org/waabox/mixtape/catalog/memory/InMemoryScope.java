package org.waabox.mixtape.catalog.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.waabox.mixtape.PlaylistReadException;
import org.waabox.mixtape.PlaylistWriteException;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;
import org.waabox.mixtape.catalog.PlaylistHandle;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.catalog.SectionType;

/**
 * One replica of an {@link InMemoryCatalogClient}.
 *
 * <p>Holds the replica's playlists and its ratings. Only music is rated;
 * searching any other section returns nothing. Reads and writes can be made
 * to fail to simulate a misbehaving replica.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryScope implements ScopedCatalog {

  /** The replica id. */
  private final String replicaId;

  /** The playlists by name, in creation order. */
  private final Map<String, InMemoryPlaylist> playlists =
      new LinkedHashMap<>();

  /** The rated items by key, in rating order. */
  private final Map<ItemKey, Rating> ratings = new LinkedHashMap<>();

  /** Whether reads throw. */
  private volatile boolean failReads;

  /** Whether writes throw. */
  private volatile boolean failWrites;

  InMemoryScope(final String theReplicaId) {
    replicaId = theReplicaId;
  }

  @Override
  public String replicaId() {
    return replicaId;
  }

  /**
   * Rates an item, replacing any earlier rating of the same key.
   *
   * @param item    the item, never null
   * @param rating  the rating, on a zero to ten scale
   * @param ratedAt when the rating was given, null if unknown
   *
   * @return this scope for chaining, never null
   */
  public synchronized InMemoryScope rate(final Item item, final double rating,
      final Instant ratedAt) {
    Objects.requireNonNull(item, "item must not be null");
    ratings.remove(item.key());
    ratings.put(item.key(), new Rating(item.withActivityAt(ratedAt), rating));
    return this;
  }

  /**
   * Creates or overwrites a playlist without going through the write
   * failure switch.
   *
   * @param name  the playlist name, never null
   * @param items the items, never null
   *
   * @return this scope for chaining, never null
   */
  public synchronized InMemoryScope seed(final String name,
      final List<Item> items) {
    Objects.requireNonNull(name, "name must not be null");
    playlists.put(name, new InMemoryPlaylist(this, name, items));
    return this;
  }

  /**
   * Returns the current items of a playlist.
   *
   * @param name the playlist name, never null
   *
   * @return the items, empty if the playlist does not exist
   */
  public synchronized List<Item> itemsOf(final String name) {
    final InMemoryPlaylist playlist = playlists.get(name);
    return playlist == null ? List.of() : playlist.snapshot();
  }

  /**
   * Whether the replica has a playlist with the given name.
   *
   * @param name the playlist name, never null
   *
   * @return true if the playlist exists
   */
  public synchronized boolean hasPlaylist(final String name) {
    return playlists.containsKey(name);
  }

  /**
   * Makes every later read of this replica fail.
   *
   * @param fail true to fail reads
   */
  public void failReads(final boolean fail) {
    failReads = fail;
  }

  /**
   * Makes every later write to this replica fail.
   *
   * @param fail true to fail writes
   */
  public void failWrites(final boolean fail) {
    failWrites = fail;
  }

  @Override
  public synchronized Optional<PlaylistHandle> findPlaylist(
      final String name) {
    checkReadable();
    return Optional.ofNullable(playlists.get(name));
  }

  @Override
  public synchronized PlaylistHandle createPlaylist(final String name,
      final List<Item> items) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(items, "items must not be null");
    checkWritable();
    if (playlists.containsKey(name)) {
      throw new PlaylistWriteException("Playlist '" + name
          + "' already exists for " + replicaId);
    }
    final InMemoryPlaylist playlist = new InMemoryPlaylist(this, name, items);
    playlists.put(name, playlist);
    return playlist;
  }

  @Override
  public synchronized List<Item> searchByRating(final SectionType sectionType,
      final double minRating) {
    Objects.requireNonNull(sectionType, "sectionType must not be null");
    checkReadable();
    if (sectionType != SectionType.MUSIC) {
      return List.of();
    }
    final List<Item> found = new ArrayList<>();
    for (final Rating rating : ratings.values()) {
      if (rating.value() >= minRating) {
        found.add(rating.item());
      }
    }
    return found;
  }

  void checkReadable() {
    if (failReads) {
      throw new PlaylistReadException("Read failed for " + replicaId);
    }
  }

  void checkWritable() {
    if (failWrites) {
      throw new PlaylistWriteException("Write failed for " + replicaId);
    }
  }

  /** A rated item. */
  private record Rating(Item item, double value) {
  }
}
