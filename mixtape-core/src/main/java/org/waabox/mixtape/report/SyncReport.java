package org.waabox.mixtape.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Accumulates what happened to every replica during one reconciliation
 * run and turns it into a {@link SyncResult}.
 *
 * <p>A report is filled by a single run on a single thread and is not
 * thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncReport {

  /** The name of the reconciled playlist. */
  private final String playlistName;

  /** The per-replica outcomes in the order they happened. */
  private final List<ReplicaOutcome> outcomes = new ArrayList<>();

  /** The merged track list, empty until the merge completes. */
  private List<TrackSummary> tracks = List.of();

  /**
   * Creates an empty report.
   *
   * @param thePlaylistName the playlist being reconciled, never null
   */
  public SyncReport(final String thePlaylistName) {
    playlistName = Objects.requireNonNull(thePlaylistName,
        "playlistName must not be null");
  }

  /**
   * Returns the name of the reconciled playlist.
   *
   * @return the playlist name, never null
   */
  public String playlistName() {
    return playlistName;
  }

  /**
   * Records the outcome of one replica read or write.
   *
   * @param outcome the outcome, never null
   */
  public void record(final ReplicaOutcome outcome) {
    outcomes.add(Objects.requireNonNull(outcome, "outcome must not be null"));
  }

  /**
   * Records the merged track list.
   *
   * @param theTracks the tracks in display order, never null
   */
  public void merged(final List<TrackSummary> theTracks) {
    tracks = List.copyOf(Objects.requireNonNull(theTracks,
        "tracks must not be null"));
  }

  /**
   * Returns every recorded outcome.
   *
   * @return the outcomes in order, never null
   */
  public List<ReplicaOutcome> outcomes() {
    return Collections.unmodifiableList(outcomes);
  }

  /**
   * Returns the failed outcomes only.
   *
   * @return the failures in order, never null
   */
  public List<ReplicaOutcome> failures() {
    return outcomes.stream()
        .filter(outcome -> !outcome.success())
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Returns the number of items added across successful writes.
   *
   * @return the number of added items
   */
  public int added() {
    return outcomes.stream()
        .filter(SyncReport::isSuccessfulWrite)
        .mapToInt(ReplicaOutcome::added)
        .sum();
  }

  /**
   * Returns the number of replicas written successfully.
   *
   * @return the number of updated replicas
   */
  public int replicasUpdated() {
    return (int) outcomes.stream()
        .filter(SyncReport::isSuccessfulWrite)
        .count();
  }

  private static boolean isSuccessfulWrite(final ReplicaOutcome outcome) {
    return outcome.operation() == ReplicaOutcome.Operation.WRITE
        && outcome.success();
  }

  /**
   * Builds the summary handed back to the caller.
   *
   * @return the result, never null
   */
  public SyncResult result() {
    if (tracks.isEmpty()) {
      return SyncResult.empty();
    }
    return new SyncResult(tracks.size(), added(), replicasUpdated(), tracks);
  }
}
