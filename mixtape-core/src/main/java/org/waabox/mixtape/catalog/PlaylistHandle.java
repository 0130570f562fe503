package org.waabox.mixtape.catalog;

import java.util.List;

/**
 * A named, ordered playlist living inside exactly one replica scope.
 *
 * <p>Handles reflect remote state owned by the catalog. Order matters:
 * capped playlists evict by position through {@link #removeAt(List)}.
 *
 * <p>No partial-success contract is assumed for the mutating operations:
 * if a batch fails midway the playlist may hold any subset of it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PlaylistHandle {

  /**
   * Returns the playlist name.
   *
   * @return the name, never null
   */
  String name();

  /**
   * Reads the current members in playlist order.
   *
   * @return the items, never null
   *
   * @throws org.waabox.mixtape.PlaylistReadException if the playlist cannot
   *                                                  be read
   */
  List<Item> items();

  /**
   * Appends the given items at the end of the playlist.
   *
   * @param items the items to append, never null
   *
   * @throws org.waabox.mixtape.PlaylistWriteException if the write fails
   */
  void addItems(List<Item> items);

  /**
   * Removes the given items from the playlist, matched by key.
   *
   * @param items the items to remove, never null
   *
   * @throws org.waabox.mixtape.PlaylistWriteException if the write fails
   */
  void removeItems(List<Item> items);

  /**
   * Removes the entries at the given positions.
   *
   * <p>Positions are 0-based indexes into the order {@link #items()}
   * returns. Only those entries go: another entry holding the same key
   * stays. Positions past the end of the playlist are ignored.
   *
   * @param positions the positions to remove, never null
   *
   * @throws org.waabox.mixtape.PlaylistWriteException if the write fails
   */
  void removeAt(List<Integer> positions);
}
