package org.waabox.mixtape.reconcile;

import java.time.Instant;
import java.util.Objects;

import org.waabox.mixtape.catalog.Item;

/**
 * The per-key accumulator used while folding candidates under
 * {@link MergeRule#EARLIEST_ADDED}.
 *
 * <p>A record only ever moves its timestamp backwards: an offer replaces
 * the timestamp and attribution when it carries a timestamp and the record
 * has none, or when it is strictly earlier. Records live for one merge.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MergeRecord {

  /** The first item seen for the key. */
  private final Item item;

  /** The earliest timestamp seen so far, null while none was seen. */
  private Instant timestamp;

  /** The replica that holds the earliest timestamp. */
  private String replicaId;

  /**
   * Starts a record from the first candidate seen for a key.
   *
   * @param first the candidate, never null
   */
  MergeRecord(final Candidate first) {
    Objects.requireNonNull(first, "first must not be null");
    item = first.item();
    timestamp = first.item().activityAt();
    replicaId = first.replicaId();
  }

  /**
   * Folds another candidate with the same key into this record.
   *
   * @param candidate the candidate, never null
   *
   * @return true if the candidate took over timestamp and attribution
   */
  boolean offer(final Candidate candidate) {
    final Instant offered = candidate.item().activityAt();
    if (offered == null) {
      return false;
    }
    if (timestamp == null || offered.isBefore(timestamp)) {
      timestamp = offered;
      replicaId = candidate.replicaId();
      return true;
    }
    return false;
  }

  /**
   * Freezes the record into a merged entry.
   *
   * @return the entry, never null
   */
  MergedItem toMergedItem() {
    return new MergedItem(item, replicaId, timestamp);
  }
}
