package org.waabox.mixtape.catalog;

import java.util.List;
import java.util.Optional;

/**
 * The catalog as seen by one replica.
 *
 * <p>Every read and write through a scoped catalog applies to its replica
 * alone. Scopes are obtained from {@link CatalogClient} and passed
 * explicitly; there is no ambient "current user".
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ScopedCatalog {

  /**
   * Returns the identifier of the replica this scope is bound to.
   *
   * @return the replica id, never null
   */
  String replicaId();

  /**
   * Looks up a playlist by its exact name.
   *
   * @param name the playlist name, never null
   *
   * @return the playlist, or empty if the replica has none with that name
   *
   * @throws org.waabox.mixtape.PlaylistReadException if the lookup fails
   */
  Optional<PlaylistHandle> findPlaylist(String name);

  /**
   * Creates a playlist seeded with the given items.
   *
   * @param name  the playlist name, never null
   * @param items the initial items in order, never null or empty
   *
   * @return the new playlist, never null
   *
   * @throws org.waabox.mixtape.PlaylistWriteException if creation fails
   */
  PlaylistHandle createPlaylist(String name, List<Item> items);

  /**
   * Searches every library section of the given type for items this
   * replica rated at or above the threshold.
   *
   * <p>Each returned item carries its last-rated timestamp when the
   * catalog knows it.
   *
   * @param sectionType the section type to search, never null
   * @param minRating   the inclusive rating threshold on a 0-10 scale
   *
   * @return the matching items, never null
   *
   * @throws org.waabox.mixtape.PlaylistReadException if the search fails
   */
  List<Item> searchByRating(SectionType sectionType, double minRating);
}
