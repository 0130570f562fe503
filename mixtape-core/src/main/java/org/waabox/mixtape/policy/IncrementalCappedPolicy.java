package org.waabox.mixtape.policy;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.reconcile.Collector;
import org.waabox.mixtape.reconcile.InclusionRule;
import org.waabox.mixtape.reconcile.MergeRule;
import org.waabox.mixtape.reconcile.MergedItem;
import org.waabox.mixtape.reconcile.Merger;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.SyncReport;

/**
 * Keeps a capped playlist of the contributors' most recent top ratings.
 *
 * <p>Reads every contributor's items rated at or above the threshold,
 * merges them with {@link MergeRule#LATEST_RATED} and keeps the newest
 * {@code cap} entries. Each contributor's playlist then receives only the
 * entries it does not hold yet; existing entries are never removed except
 * by the cap, which drops everything past position {@code cap}.
 *
 * <p>Running twice over unchanged ratings adds nothing the second time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IncrementalCappedPolicy implements ReconciliationPolicy {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(IncrementalCappedPolicy.class);

  /** The replicas read from and written to. */
  private final List<String> contributors;

  /** The inclusive rating threshold on a 0-10 scale. */
  private final double minRating;

  /** The maximum number of entries in the merged set and in playlists. */
  private final int cap;

  /** The candidate collector. */
  private final Collector collector = new Collector();

  /** The merger. */
  private final Merger merger = new Merger();

  /** The playlist writer. */
  private final PlaylistWriter writer = new PlaylistWriter();

  /**
   * Creates a new policy.
   *
   * @param theContributors the contributing replicas, never null or empty
   * @param theMinRating    the inclusive rating threshold on a 0-10 scale
   * @param theCap          the maximum playlist length, greater than zero
   *
   * @throws IllegalArgumentException if contributors is empty or cap is
   *                                  not positive
   */
  public IncrementalCappedPolicy(final List<String> theContributors,
      final double theMinRating, final int theCap) {
    Objects.requireNonNull(theContributors, "contributors must not be null");
    if (theContributors.isEmpty()) {
      throw new IllegalArgumentException("contributors must not be empty");
    }
    if (theCap <= 0) {
      throw new IllegalArgumentException(
          "cap must be greater than 0, got: " + theCap);
    }
    contributors = List.copyOf(theContributors);
    minRating = theMinRating;
    cap = theCap;
  }

  /** {@inheritDoc} */
  @Override
  public void reconcile(final ReconciliationContext context,
      final SyncReport report) {
    final String name = context.playlistName();
    log.info("Updating '{}' from contributors: {}", name, contributors);

    final List<MergedItem> merged = merger.merge(
        collector.collect(context, contributors,
            InclusionRule.ratedAtLeast(minRating), report),
        MergeRule.LATEST_RATED, cap);
    PlaylistWriter.recordMerge(report, merged);

    if (merged.isEmpty()) {
      log.warn("No tracks rated {} or above found across contributors of "
          + "'{}'", minRating, name);
      return;
    }
    log.info("Compiled top {} unique tracks for '{}'", merged.size(), name);

    if (context.isPreview()) {
      return;
    }

    final List<Item> items = PlaylistWriter.itemsOf(merged);
    for (final String replicaId : contributors) {
      if (context.stopRequested()) {
        return;
      }
      writer.writeToReplica(context, report, replicaId,
          scope -> writer.appendMissing(scope, name, items, cap));
    }
  }

  /** {@inheritDoc} */
  @Override
  public MergeRule mergeRule() {
    return MergeRule.LATEST_RATED;
  }

  /**
   * Returns the contributing replicas.
   *
   * @return the contributors, never null
   */
  public List<String> contributors() {
    return contributors;
  }

  /**
   * Returns the rating threshold.
   *
   * @return the inclusive threshold on a 0-10 scale
   */
  public double minRating() {
    return minRating;
  }

  /**
   * Returns the playlist cap.
   *
   * @return the maximum playlist length
   */
  public int cap() {
    return cap;
  }
}
