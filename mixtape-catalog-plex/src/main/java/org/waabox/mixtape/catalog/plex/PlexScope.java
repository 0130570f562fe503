package org.waabox.mixtape.catalog.plex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.PlaylistWriteException;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.PlaylistHandle;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.catalog.SectionType;

/**
 * The view of a Plex server as seen by one user.
 *
 * <p>Every request carries the user's own token, so playlists and ratings
 * are the user's.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PlexScope implements ScopedCatalog {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(PlexScope.class);

  /** The playlist type used for music playlists. */
  private static final String AUDIO = "audio";

  /** The replica id. */
  private final String replicaId;

  /** The user's access token. */
  private final String token;

  /** The server's machine identifier, used to build item URIs. */
  private final String machineId;

  /** The transport. */
  private final PlexHttp http;

  PlexScope(final String theReplicaId, final String theToken,
      final String theMachineId, final PlexHttp theHttp) {
    replicaId = theReplicaId;
    token = theToken;
    machineId = theMachineId;
    http = theHttp;
  }

  @Override
  public String replicaId() {
    return replicaId;
  }

  @Override
  public Optional<PlaylistHandle> findPlaylist(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    for (final PlexResponses.PlaylistRef ref : PlexResponses.playlists(
        http.get(token, "/playlists?playlistType=" + AUDIO))) {
      if (name.equals(ref.title())) {
        return Optional.of(new PlexPlaylist(this, ref.ratingKey(),
            ref.title()));
      }
    }
    return Optional.empty();
  }

  @Override
  public PlaylistHandle createPlaylist(final String name,
      final List<Item> items) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(items, "items must not be null");
    if (items.isEmpty()) {
      throw new PlaylistWriteException("Plex cannot create the empty "
          + "playlist '" + name + "' for " + replicaId);
    }

    final String path = "/playlists?type=" + AUDIO
        + "&title=" + PlexHttp.encode(name)
        + "&smart=0&uri=" + PlexHttp.encode(itemsUri(items));
    final String ratingKey = PlexResponses.firstRatingKey(
        http.write("POST", token, path))
        .orElseThrow(() -> new PlaylistWriteException("Plex did not return "
            + "the new playlist '" + name + "' for " + replicaId));

    log.debug("Created Plex playlist {} '{}' for {}", ratingKey, name,
        replicaId);
    return new PlexPlaylist(this, ratingKey, name);
  }

  @Override
  public List<Item> searchByRating(final SectionType sectionType,
      final double minRating) {
    Objects.requireNonNull(sectionType, "sectionType must not be null");

    final List<Item> found = new ArrayList<>();
    for (final PlexResponses.Section section : PlexResponses.sections(
        http.get(token, "/library/sections"))) {
      if (!sectionType.serverType().equals(section.type())) {
        continue;
      }
      // The server filter is exclusive, so ask slightly lower and filter
      // the exact threshold here.
      final String path = "/library/sections/" + section.key()
          + "/all?type=" + sectionType.itemType()
          + "&" + PlexHttp.encode("userRating>>") + "="
          + (minRating - 0.1);
      for (final PlexResponses.RatedItem rated : PlexResponses.ratedItems(
          http.get(token, path))) {
        if (rated.rating() >= minRating) {
          found.add(rated.item());
        }
      }
    }
    return found;
  }

  /**
   * Builds the server URI naming the given items.
   *
   * @param items the items, never null or empty
   *
   * @return the URI, never null
   */
  String itemsUri(final List<Item> items) {
    final StringBuilder keys = new StringBuilder();
    for (final Item item : items) {
      if (keys.length() > 0) {
        keys.append(',');
      }
      keys.append(item.key().value());
    }
    return "server://" + machineId
        + "/com.plexapp.plugins.library/library/metadata/" + keys;
  }

  String token() {
    return token;
  }

  PlexHttp http() {
    return http;
  }
}
