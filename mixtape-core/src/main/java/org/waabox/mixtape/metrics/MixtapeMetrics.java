package org.waabox.mixtape.metrics;

/**
 * An abstraction for recording operational metrics of playlist
 * reconciliation.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopMixtapeMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MixtapeMetrics {

  /**
   * Records a completed reconciliation run.
   *
   * @param playlistName the name of the reconciled playlist, never null
   * @param durationMs   the wall-clock duration of the run in milliseconds
   * @param mergedItems  the number of items in the merged set
   */
  void reconciled(String playlistName, long durationMs, int mergedItems);

  /**
   * Records a replica that was skipped because a read or write failed.
   *
   * @param playlistName the name of the playlist being reconciled,
   *                     never null
   * @param replicaId    the failing replica, never null
   * @param cause        the throwable that caused the failure, never null
   */
  void replicaFailed(String playlistName, String replicaId, Throwable cause);

  /**
   * Records items added to one replica's playlist.
   *
   * @param playlistName the name of the playlist, never null
   * @param replicaId    the replica that received the items, never null
   * @param count        the number of items added
   */
  void itemsAdded(String playlistName, String replicaId, int count);
}
