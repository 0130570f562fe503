package org.waabox.mixtape.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.PlaylistHandle;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.catalog.SectionType;

/**
 * Decides which items of a replica become merge candidates.
 *
 * <p>Rules only read from the scope they are given.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface InclusionRule {

  /**
   * Selects the candidate items of one replica.
   *
   * @param scope the replica scope, never null
   *
   * @return the selected items in catalog order, never null
   */
  List<Item> select(ScopedCatalog scope);

  /**
   * Includes music items rated at or above the threshold that carry a
   * last-rated timestamp. Items without one are dropped since they cannot
   * be ordered.
   *
   * @param minRating the inclusive rating threshold on a 0-10 scale
   *
   * @return the rule, never null
   */
  static InclusionRule ratedAtLeast(final double minRating) {
    return scope -> {
      final List<Item> selected = new ArrayList<>();
      for (final Item item
          : scope.searchByRating(SectionType.MUSIC, minRating)) {
        if (item.activity().isPresent()) {
          selected.add(item);
        }
      }
      return selected;
    };
  }

  /**
   * Includes every music item rated at or above the threshold, whether or
   * not the catalog knows when it was rated.
   *
   * @param minRating the inclusive rating threshold on a 0-10 scale
   *
   * @return the rule, never null
   */
  static InclusionRule anyRatedAtLeast(final double minRating) {
    return scope -> scope.searchByRating(SectionType.MUSIC, minRating);
  }

  /**
   * Includes the members of the replica's playlist with the given name. A
   * replica without such a playlist contributes nothing.
   *
   * @param playlistName the playlist name, never null
   *
   * @return the rule, never null
   */
  static InclusionRule memberOf(final String playlistName) {
    Objects.requireNonNull(playlistName, "playlistName must not be null");
    return scope -> {
      final Optional<PlaylistHandle> playlist =
          scope.findPlaylist(playlistName);
      if (playlist.isEmpty()) {
        LoggerFactory.getLogger(InclusionRule.class).info(
            "No '{}' playlist found for {}", playlistName,
            scope.replicaId());
        return List.of();
      }
      return playlist.get().items();
    };
  }
}
