package org.waabox.mixtape.reconcile;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.MixtapeException;
import org.waabox.mixtape.RetryPolicy;
import org.waabox.mixtape.ScopeUnavailableException;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.metrics.MixtapeMetrics;

/**
 * Everything a single reconciliation run needs to reach the catalog.
 *
 * <p>A context is created at the start of a run and dropped at its end. It
 * hands out replica scopes (retrying unreachable ones per the
 * {@link RetryPolicy}), resolves the root scope and the membership list,
 * and forwards per-replica events to {@link MixtapeMetrics}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReconciliationContext {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ReconciliationContext.class);

  /** The name of the playlist being reconciled. */
  private final String playlistName;

  /** The catalog client. */
  private final CatalogClient client;

  /** The retry policy for entering replica scopes. */
  private final RetryPolicy retryPolicy;

  /** The metrics reporter. */
  private final MixtapeMetrics metrics;

  /** Whether the run only merges and must not write. */
  private final boolean preview;

  /**
   * Creates a new context.
   *
   * @param thePlaylistName the playlist being reconciled, never null
   * @param theClient       the catalog client, never null
   * @param theRetryPolicy  the retry policy, never null
   * @param theMetrics      the metrics reporter, never null
   * @param isPreview       true if the run must not write to any replica
   */
  public ReconciliationContext(final String thePlaylistName,
      final CatalogClient theClient, final RetryPolicy theRetryPolicy,
      final MixtapeMetrics theMetrics, final boolean isPreview) {
    playlistName = Objects.requireNonNull(thePlaylistName,
        "playlistName must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    preview = isPreview;
  }

  /**
   * Returns the name of the playlist being reconciled.
   *
   * @return the playlist name, never null
   */
  public String playlistName() {
    return playlistName;
  }

  /**
   * Whether this run only computes the merge, leaving replicas untouched.
   *
   * @return true for a preview run
   */
  public boolean isPreview() {
    return preview;
  }

  /**
   * Enters the scope of the given replica.
   *
   * <p>Unreachable replicas are retried per the retry policy. Any failure
   * other than {@link ScopeUnavailableException} raised by the client is
   * treated as the replica being unreachable.
   *
   * @param replicaId the replica identifier, never null
   *
   * @return the scope, never null
   *
   * @throws ScopeUnavailableException if every attempt failed or the
   *                                   thread was interrupted while backing
   *                                   off
   */
  public ScopedCatalog openScope(final String replicaId) {
    Objects.requireNonNull(replicaId, "replicaId must not be null");

    final int maxAttempts = retryPolicy.maxAttempts();
    ScopeUnavailableException lastFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return client.switchScope(replicaId);
      } catch (final ScopeUnavailableException e) {
        lastFailure = e;
      } catch (final RuntimeException e) {
        lastFailure = new ScopeUnavailableException(replicaId, e);
      }

      if (attempt < maxAttempts) {
        log.debug("Playlist '{}': scope '{}' attempt {}/{} failed: {}",
            playlistName, replicaId, attempt, maxAttempts,
            lastFailure.getMessage());
        backOff(replicaId, retryPolicy.backoff());
      }
    }
    throw lastFailure;
  }

  /**
   * Resolves the root scope.
   *
   * @return the root scope, never null
   *
   * @throws MixtapeException if the catalog root cannot be reached; this
   *                          aborts the run
   */
  public ScopedCatalog rootScope() {
    try {
      return client.root();
    } catch (final RuntimeException e) {
      throw new MixtapeException("Catalog root not reachable while "
          + "reconciling '" + playlistName + "'", e);
    }
  }

  /**
   * Lists every replica known to the catalog, excluding the root.
   *
   * @return the replica identifiers, never null
   *
   * @throws MixtapeException if the membership cannot be listed; this
   *                          aborts the run
   */
  public List<String> members() {
    try {
      return List.copyOf(client.members());
    } catch (final RuntimeException e) {
      throw new MixtapeException("Replica membership not available while "
          + "reconciling '" + playlistName + "'", e);
    }
  }

  /**
   * Reports a replica that was skipped.
   *
   * @param replicaId the replica, never null
   * @param cause     the failure, never null
   */
  public void replicaFailed(final String replicaId, final Throwable cause) {
    metrics.replicaFailed(playlistName, replicaId, cause);
  }

  /**
   * Reports items added to a replica.
   *
   * @param replicaId the replica, never null
   * @param count     the number of items added
   */
  public void itemsAdded(final String replicaId, final int count) {
    metrics.itemsAdded(playlistName, replicaId, count);
  }

  /**
   * Whether the calling thread asked the run to stop.
   *
   * <p>Policies check this between replicas; a run never stops in the
   * middle of one replica's write.
   *
   * @return true if the thread is interrupted
   */
  public boolean stopRequested() {
    if (Thread.currentThread().isInterrupted()) {
      log.warn("Playlist '{}': interrupted, stopping before next replica",
          playlistName);
      return true;
    }
    return false;
  }

  private void backOff(final String replicaId, final Duration backoff) {
    if (backoff.isZero()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ScopeUnavailableException(replicaId, ie);
    }
  }
}
