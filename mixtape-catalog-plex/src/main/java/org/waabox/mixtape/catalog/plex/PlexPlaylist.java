package org.waabox.mixtape.catalog.plex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;
import org.waabox.mixtape.catalog.PlaylistHandle;

/**
 * A user's Plex playlist.
 *
 * <p>Members are removed through their {@code playlistItemID}, which is
 * looked up again right before removing. Removal by position addresses a
 * single entry even when the same track appears more than once.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PlexPlaylist implements PlaylistHandle {

  /** The owning scope. */
  private final PlexScope scope;

  /** The playlist's rating key. */
  private final String ratingKey;

  /** The playlist title. */
  private final String name;

  PlexPlaylist(final PlexScope theScope, final String theRatingKey,
      final String theName) {
    scope = theScope;
    ratingKey = theRatingKey;
    name = theName;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<Item> items() {
    final List<Item> items = new ArrayList<>();
    for (final PlexResponses.PlaylistEntry entry : entries()) {
      items.add(entry.item());
    }
    return items;
  }

  @Override
  public void addItems(final List<Item> toAdd) {
    Objects.requireNonNull(toAdd, "items must not be null");
    if (toAdd.isEmpty()) {
      return;
    }
    scope.http().write("PUT", scope.token(), itemsPath() + "?uri="
        + PlexHttp.encode(scope.itemsUri(toAdd)));
  }

  @Override
  public void removeItems(final List<Item> toRemove) {
    Objects.requireNonNull(toRemove, "items must not be null");
    final Set<ItemKey> keys = new HashSet<>();
    for (final Item item : toRemove) {
      keys.add(item.key());
    }
    for (final PlexResponses.PlaylistEntry entry : entries()) {
      if (keys.contains(entry.item().key())) {
        scope.http().write("DELETE", scope.token(),
            itemsPath() + "/" + entry.playlistItemId());
      }
    }
  }

  @Override
  public void removeAt(final List<Integer> positions) {
    Objects.requireNonNull(positions, "positions must not be null");
    if (positions.isEmpty()) {
      return;
    }
    final Set<Integer> wanted = new HashSet<>(positions);
    final List<PlexResponses.PlaylistEntry> entries = entries();
    for (int i = 0; i < entries.size(); i++) {
      if (wanted.contains(i)) {
        scope.http().write("DELETE", scope.token(),
            itemsPath() + "/" + entries.get(i).playlistItemId());
      }
    }
  }

  private List<PlexResponses.PlaylistEntry> entries() {
    return PlexResponses.playlistEntries(
        scope.http().get(scope.token(), itemsPath()));
  }

  private String itemsPath() {
    return "/playlists/" + ratingKey + "/items";
  }
}
