package org.waabox.mixtape.reconcile;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.report.TrackSummary;

/**
 * One entry of a merged playlist: the item, the replica it is attributed
 * to and the timestamp that won the merge.
 *
 * @param item              the item, never null
 * @param attributedReplica the replica credited with the item, never null
 * @param timestamp         the winning timestamp, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MergedItem(Item item, String attributedReplica,
    Instant timestamp) {

  /** Newest first, untimestamped entries last. */
  static final Comparator<MergedItem> NEWEST_FIRST = Comparator.comparing(
      MergedItem::timestamp, Comparator.nullsLast(Comparator.reverseOrder()));

  public MergedItem {
    Objects.requireNonNull(item, "item must not be null");
    Objects.requireNonNull(attributedReplica,
        "attributedReplica must not be null");
  }

  /**
   * Creates the display summary of this entry.
   *
   * @return the summary, never null
   */
  public TrackSummary toSummary() {
    return new TrackSummary(item.title(), item.artist(), attributedReplica,
        timestamp);
  }
}
