package org.waabox.mixtape.metrics;

/**
 * A no-operation implementation of {@link MixtapeMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopMixtapeMetrics implements MixtapeMetrics {

  /** {@inheritDoc} */
  @Override
  public void reconciled(final String playlistName, final long durationMs,
      final int mergedItems) {
  }

  /** {@inheritDoc} */
  @Override
  public void replicaFailed(final String playlistName,
      final String replicaId, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void itemsAdded(final String playlistName, final String replicaId,
      final int count) {
  }
}
