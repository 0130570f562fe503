package org.waabox.mixtape.policy;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.reconcile.Collector;
import org.waabox.mixtape.reconcile.InclusionRule;
import org.waabox.mixtape.reconcile.MergeRule;
import org.waabox.mixtape.reconcile.MergedItem;
import org.waabox.mixtape.reconcile.Merger;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.SyncReport;

/**
 * Rebuilds the catalog owner's playlist of everything rated at or above a
 * threshold.
 *
 * <p>Only the root scope is read and written. Items are included whether
 * or not the catalog knows when they were rated.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TopRatedPolicy implements ReconciliationPolicy {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(TopRatedPolicy.class);

  /** The inclusive rating threshold on a 0-10 scale. */
  private final double minRating;

  /** The candidate collector. */
  private final Collector collector = new Collector();

  /** The merger. */
  private final Merger merger = new Merger();

  /** The playlist writer. */
  private final PlaylistWriter writer = new PlaylistWriter();

  /**
   * Creates a new policy.
   *
   * @param theMinRating the inclusive rating threshold on a 0-10 scale
   */
  public TopRatedPolicy(final double theMinRating) {
    minRating = theMinRating;
  }

  /** {@inheritDoc} */
  @Override
  public void reconcile(final ReconciliationContext context,
      final SyncReport report) {
    final String name = context.playlistName();
    final ScopedCatalog root = context.rootScope();

    log.info("Syncing playlist '{}' with tracks rated >= {}", name,
        minRating);

    final List<MergedItem> merged = merger.merge(
        collector.collect(context, root,
            InclusionRule.anyRatedAtLeast(minRating), report),
        MergeRule.EARLIEST_ADDED);
    PlaylistWriter.recordMerge(report, merged);

    if (merged.isEmpty() || context.isPreview()) {
      return;
    }
    log.info("Found {} tracks with rating >= {}", merged.size(), minRating);

    writer.writeToScope(context, report, root,
        scope -> writer.replace(scope, name, PlaylistWriter.itemsOf(merged)));
  }

  /** {@inheritDoc} */
  @Override
  public MergeRule mergeRule() {
    return MergeRule.EARLIEST_ADDED;
  }

  /**
   * Returns the rating threshold.
   *
   * @return the inclusive threshold on a 0-10 scale
   */
  public double minRating() {
    return minRating;
  }
}
