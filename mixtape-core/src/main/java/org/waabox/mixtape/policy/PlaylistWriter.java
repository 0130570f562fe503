package org.waabox.mixtape.policy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;
import org.waabox.mixtape.catalog.PlaylistHandle;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.reconcile.MergedItem;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.ReplicaOutcome;
import org.waabox.mixtape.report.SyncReport;
import org.waabox.mixtape.report.TrackSummary;

/**
 * Writes a merged set into replica playlists.
 *
 * <p>Each replica write is isolated: a failure to enter or write one
 * replica is logged, recorded as a failed WRITE and does not stop the
 * caller from moving on to the next replica. A failed write may leave the
 * replica's playlist partially modified.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PlaylistWriter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PlaylistWriter.class);

  /** A write against one scope, returning the number of items added. */
  @FunctionalInterface
  interface ScopeWrite {

    /**
     * Writes to the given scope.
     *
     * @param scope the replica scope, never null
     *
     * @return the number of items added
     */
    int write(ScopedCatalog scope);
  }

  /**
   * Enters the replica's scope and applies the write.
   *
   * @param context   the run context, never null
   * @param report    the report receiving the WRITE outcome, never null
   * @param replicaId the target replica, never null
   * @param write     the write to apply, never null
   */
  void writeToReplica(final ReconciliationContext context,
      final SyncReport report, final String replicaId,
      final ScopeWrite write) {
    try {
      final ScopedCatalog scope = context.openScope(replicaId);
      apply(context, report, scope, write);
    } catch (final RuntimeException e) {
      failed(context, report, replicaId, e);
    }
  }

  /**
   * Applies the write to an already opened scope.
   *
   * @param context the run context, never null
   * @param report  the report receiving the WRITE outcome, never null
   * @param scope   the target scope, never null
   * @param write   the write to apply, never null
   */
  void writeToScope(final ReconciliationContext context,
      final SyncReport report, final ScopedCatalog scope,
      final ScopeWrite write) {
    try {
      apply(context, report, scope, write);
    } catch (final RuntimeException e) {
      failed(context, report, scope.replicaId(), e);
    }
  }

  /**
   * Makes the playlist hold exactly the given items, in order.
   *
   * <p>An existing playlist is emptied and refilled; a missing one is
   * created.
   *
   * @param scope the replica scope, never null
   * @param name  the playlist name, never null
   * @param items the items, never null or empty
   *
   * @return the number of items written
   */
  int replace(final ScopedCatalog scope, final String name,
      final List<Item> items) {
    final Optional<PlaylistHandle> existing = scope.findPlaylist(name);
    if (existing.isEmpty()) {
      scope.createPlaylist(name, items);
      log.info("Created '{}' for {} with {} tracks", name,
          scope.replicaId(), items.size());
      return items.size();
    }

    final PlaylistHandle playlist = existing.get();
    final List<Item> current = playlist.items();
    if (!current.isEmpty()) {
      playlist.removeItems(current);
    }
    playlist.addItems(items);
    log.info("Updated '{}' for {} with {} tracks", name, scope.replicaId(),
        items.size());
    return items.size();
  }

  /**
   * Appends the items the playlist does not hold yet, then evicts entries
   * by position until it fits the cap.
   *
   * <p>Eviction walks the playlist from the tail towards the head, first
   * dropping repeated entries of a key already held at an earlier
   * position, then entries whose key is not in {@code items}, and only
   * then plain tail entries. Since {@code items} never exceeds the cap,
   * every merged item is held after the write and a second run with the
   * same items appends nothing.
   *
   * <p>A missing playlist is created with all the items.
   *
   * @param scope the replica scope, never null
   * @param name  the playlist name, never null
   * @param items the merged items, never null or empty
   * @param cap   the maximum playlist length, greater than zero
   *
   * @return the number of items appended
   */
  int appendMissing(final ScopedCatalog scope, final String name,
      final List<Item> items, final int cap) {
    final Optional<PlaylistHandle> existing = scope.findPlaylist(name);
    if (existing.isEmpty()) {
      final List<Item> seed = items.size() > cap
          ? items.subList(0, cap) : items;
      scope.createPlaylist(name, seed);
      log.info("Created '{}' for {} with {} tracks", name,
          scope.replicaId(), seed.size());
      return seed.size();
    }

    final PlaylistHandle playlist = existing.get();
    final Set<ItemKey> present = keysOf(playlist.items());
    final List<Item> missing = new ArrayList<>();
    for (final Item item : items) {
      if (present.add(item.key())) {
        missing.add(item);
      }
    }

    if (missing.isEmpty()) {
      log.info("No new tracks to add to '{}' for {}", name,
          scope.replicaId());
    } else {
      log.info("Adding {} new tracks to '{}' for {}", missing.size(), name,
          scope.replicaId());
      playlist.addItems(missing);
    }

    final List<Item> current = playlist.items();
    if (current.size() > cap) {
      final List<Integer> evicted = evictionOrder(current, keysOf(items),
          current.size() - cap);
      playlist.removeAt(evicted);
      log.info("Evicted {} tracks from '{}' for {} to fit {} tracks",
          evicted.size(), name, scope.replicaId(), cap);
    }
    return missing.size();
  }

  /**
   * Picks the positions to evict from a playlist over its cap.
   *
   * @param current  the playlist entries in order, never null
   * @param wanted   the keys of the merged items, never null
   * @param overflow how many entries must go, greater than zero
   *
   * @return the positions to evict, tail first, never null
   */
  static List<Integer> evictionOrder(final List<Item> current,
      final Set<ItemKey> wanted, final int overflow) {
    final Set<ItemKey> seen = new HashSet<>();
    final boolean[] repeated = new boolean[current.size()];
    for (int i = 0; i < current.size(); i++) {
      repeated[i] = !seen.add(current.get(i).key());
    }

    final List<Integer> evicted = new ArrayList<>(overflow);
    final boolean[] taken = new boolean[current.size()];
    for (int pass = 0; pass < 3; pass++) {
      for (int i = current.size() - 1; i >= 0; i--) {
        if (evicted.size() == overflow) {
          return evicted;
        }
        if (taken[i]) {
          continue;
        }
        final boolean stale = !wanted.contains(current.get(i).key());
        final boolean evict = pass == 2
            || (pass == 1 && stale)
            || (pass == 0 && repeated[i]);
        if (evict) {
          taken[i] = true;
          evicted.add(i);
        }
      }
    }
    return evicted;
  }

  /**
   * Extracts the items of merged entries, keeping their order.
   *
   * @param merged the merged entries, never null
   *
   * @return the items, never null
   */
  static List<Item> itemsOf(final List<MergedItem> merged) {
    final List<Item> items = new ArrayList<>(merged.size());
    for (final MergedItem entry : merged) {
      items.add(entry.item());
    }
    return items;
  }

  /**
   * Records the merged track list in the report.
   *
   * @param report the report, never null
   * @param merged the merged entries, never null
   */
  static void recordMerge(final SyncReport report,
      final List<MergedItem> merged) {
    final List<TrackSummary> tracks = new ArrayList<>(merged.size());
    for (final MergedItem entry : merged) {
      tracks.add(entry.toSummary());
    }
    report.merged(tracks);
  }

  private void apply(final ReconciliationContext context,
      final SyncReport report, final ScopedCatalog scope,
      final ScopeWrite write) {
    final int added = write.write(scope);
    report.record(ReplicaOutcome.written(scope.replicaId(), added));
    context.itemsAdded(scope.replicaId(), added);
  }

  private void failed(final ReconciliationContext context,
      final SyncReport report, final String replicaId,
      final RuntimeException e) {
    log.error("Playlist '{}': failed to update replica '{}': {}",
        context.playlistName(), replicaId, e.getMessage(), e);
    report.record(ReplicaOutcome.writeFailed(replicaId, e));
    context.replicaFailed(replicaId, e);
  }

  private static Set<ItemKey> keysOf(final List<Item> items) {
    final Set<ItemKey> keys = new HashSet<>(items.size() * 2);
    for (final Item item : items) {
      keys.add(item.key());
    }
    return keys;
  }
}
