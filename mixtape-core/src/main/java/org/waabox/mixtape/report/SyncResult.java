package org.waabox.mixtape.report;

import java.util.List;
import java.util.Objects;

/**
 * The summary of one reconciliation run, returned to the calling layer.
 *
 * <p>A zero-valued result means there was nothing to reconcile; it is not
 * an error.
 *
 * @param total           the number of items in the merged set
 * @param added           the number of items added across all replicas
 *                        that were written successfully
 * @param replicasUpdated the number of replicas written successfully
 * @param tracks          the merged track list in display order, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncResult(int total, int added, int replicasUpdated,
    List<TrackSummary> tracks) {

  /** The result of a run that found nothing to reconcile. */
  private static final SyncResult EMPTY = new SyncResult(0, 0, 0, List.of());

  public SyncResult {
    Objects.requireNonNull(tracks, "tracks must not be null");
    tracks = List.copyOf(tracks);
  }

  /**
   * Returns the zero-valued result.
   *
   * @return the empty result, never null
   */
  public static SyncResult empty() {
    return EMPTY;
  }

  /**
   * Whether the merged set was empty.
   *
   * @return true if there was nothing to reconcile
   */
  public boolean isEmpty() {
    return total == 0;
  }
}
