package org.waabox.mixtape.catalog.plex;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;

/**
 * Static utility class reading Plex {@code MediaContainer} responses.
 *
 * <p>Every Plex JSON response wraps its payload in a {@code MediaContainer}
 * object; media entries live under {@code Metadata} and library sections
 * under {@code Directory}. Missing arrays are read as empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PlexResponses {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PlexResponses.class);

  /** The timestamp of a rating search result. */
  static final String LAST_RATED_AT = "lastRatedAt";

  /** The timestamp of a playlist member. */
  static final String ADDED_AT = "addedAt";

  /** Private constructor to prevent instantiation. */
  private PlexResponses() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** A playlist as listed by the server. */
  record PlaylistRef(String ratingKey, String title) {}

  /** A playlist member together with its position id inside the playlist. */
  record PlaylistEntry(Item item, String playlistItemId) {}

  /** A library section. */
  record Section(String key, String type) {}

  /** A rating search result. */
  record RatedItem(Item item, double rating) {}

  /**
   * Reads the server's machine identifier from an identity response.
   *
   * @param response the response, never null
   *
   * @return the identifier, empty if absent
   */
  static Optional<String> machineIdentifier(final JsonNode response) {
    final String id = container(response).path("machineIdentifier")
        .asText("");
    return id.isEmpty() ? Optional.empty() : Optional.of(id);
  }

  /**
   * Reads the playlists of a playlist listing.
   *
   * @param response the response, never null
   *
   * @return the playlists, never null
   */
  static List<PlaylistRef> playlists(final JsonNode response) {
    final List<PlaylistRef> playlists = new ArrayList<>();
    for (final JsonNode node : container(response).path("Metadata")) {
      playlists.add(new PlaylistRef(node.path("ratingKey").asText(),
          node.path("title").asText()));
    }
    return playlists;
  }

  /**
   * Reads the members of a playlist, timestamped by {@code addedAt}.
   *
   * @param response the response, never null
   *
   * @return the entries in playlist order, never null
   */
  static List<PlaylistEntry> playlistEntries(final JsonNode response) {
    final List<PlaylistEntry> entries = new ArrayList<>();
    for (final JsonNode node : container(response).path("Metadata")) {
      item(node, ADDED_AT).ifPresent(item -> entries.add(
          new PlaylistEntry(item, node.path("playlistItemID").asText())));
    }
    return entries;
  }

  /**
   * Reads the library sections.
   *
   * @param response the response, never null
   *
   * @return the sections, never null
   */
  static List<Section> sections(final JsonNode response) {
    final List<Section> sections = new ArrayList<>();
    for (final JsonNode node : container(response).path("Directory")) {
      sections.add(new Section(node.path("key").asText(),
          node.path("type").asText()));
    }
    return sections;
  }

  /**
   * Reads rating search results, timestamped by {@code lastRatedAt}.
   *
   * @param response the response, never null
   *
   * @return the rated items, never null
   */
  static List<RatedItem> ratedItems(final JsonNode response) {
    final List<RatedItem> items = new ArrayList<>();
    for (final JsonNode node : container(response).path("Metadata")) {
      item(node, LAST_RATED_AT).ifPresent(item -> items.add(
          new RatedItem(item, node.path("userRating").asDouble(0))));
    }
    return items;
  }

  /**
   * Reads the rating key of the first entry, as returned when a playlist
   * is created.
   *
   * @param response the response, never null
   *
   * @return the rating key, empty if the response holds no entry
   */
  static Optional<String> firstRatingKey(final JsonNode response) {
    final JsonNode first = container(response).path("Metadata").path(0);
    final String key = first.path("ratingKey").asText("");
    return key.isEmpty() ? Optional.empty() : Optional.of(key);
  }

  /**
   * Builds an item from a metadata entry.
   *
   * <p>The artist is the track's {@code grandparentTitle}, falling back to
   * {@code originalTitle}. A zero or missing timestamp is read as absent.
   * Entries without a {@code ratingKey} cannot be matched across replicas
   * and are skipped.
   *
   * @param node           the metadata entry, never null
   * @param timestampField the epoch-seconds field to read, never null
   *
   * @return the item, empty if the entry has no rating key
   */
  static Optional<Item> item(final JsonNode node,
      final String timestampField) {
    final String key = node.path("ratingKey").asText("");
    if (key.isBlank()) {
      log.debug("Skipping Plex entry without ratingKey: '{}'",
          node.path("title").asText(""));
      return Optional.empty();
    }
    String artist = node.path("grandparentTitle").asText("");
    if (artist.isBlank()) {
      artist = node.path("originalTitle").asText("");
    }
    final long seconds = node.path(timestampField).asLong(0);
    return Optional.of(new Item(ItemKey.of(key),
        node.path("title").asText(""), artist,
        seconds > 0 ? Instant.ofEpochSecond(seconds) : null));
  }

  private static JsonNode container(final JsonNode response) {
    return response.path("MediaContainer");
  }
}
