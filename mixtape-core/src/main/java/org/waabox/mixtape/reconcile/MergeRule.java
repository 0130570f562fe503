package org.waabox.mixtape.reconcile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.waabox.mixtape.catalog.ItemKey;

/**
 * How candidates sharing a key are folded into one entry.
 *
 * <p>The two rules are not symmetric. Each is tied to the policies that
 * use it; swapping them changes which replica gets credited for a track.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MergeRule {

  /**
   * First to add wins: the entry keeps the earliest timestamp seen for the
   * key and is attributed to the replica holding it. Used by full-replace,
   * broadcast and top-rated playlists.
   */
  EARLIEST_ADDED {
    @Override
    List<MergedItem> fold(final List<Candidate> candidates) {
      final Map<ItemKey, MergeRecord> records = new LinkedHashMap<>();
      for (final Candidate candidate : candidates) {
        final MergeRecord existing = records.get(candidate.item().key());
        if (existing == null) {
          records.put(candidate.item().key(), new MergeRecord(candidate));
        } else {
          existing.offer(candidate);
        }
      }
      final List<MergedItem> merged = new ArrayList<>(records.size());
      for (final MergeRecord record : records.values()) {
        merged.add(record.toMergedItem());
      }
      return merged;
    }
  },

  /**
   * Latest rating wins: all candidates are ordered newest first and the
   * first occurrence of each key is kept, so the entry is attributed to
   * whichever replica rated it most recently. Used by capped incremental
   * playlists.
   */
  LATEST_RATED {
    @Override
    List<MergedItem> fold(final List<Candidate> candidates) {
      final List<MergedItem> ordered = new ArrayList<>(candidates.size());
      for (final Candidate candidate : candidates) {
        ordered.add(new MergedItem(candidate.item(), candidate.replicaId(),
            candidate.item().activityAt()));
      }
      ordered.sort(MergedItem.NEWEST_FIRST);

      final Map<ItemKey, MergedItem> firstSeen = new LinkedHashMap<>();
      for (final MergedItem entry : ordered) {
        firstSeen.putIfAbsent(entry.item().key(), entry);
      }
      return new ArrayList<>(firstSeen.values());
    }
  };

  /**
   * Folds the candidates into one entry per key.
   *
   * @param candidates the candidates in collection order, never null
   *
   * @return the entries, in no particular order, never null
   */
  abstract List<MergedItem> fold(List<Candidate> candidates);
}
