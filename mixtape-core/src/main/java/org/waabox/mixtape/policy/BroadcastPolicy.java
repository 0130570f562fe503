package org.waabox.mixtape.policy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.reconcile.Collector;
import org.waabox.mixtape.reconcile.InclusionRule;
import org.waabox.mixtape.reconcile.MergeRule;
import org.waabox.mixtape.reconcile.MergedItem;
import org.waabox.mixtape.reconcile.Merger;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.SyncReport;

/**
 * Pushes the curators' merged playlist to every replica of the catalog.
 *
 * <p>Only the curators' playlists are read. The merged set (folded with
 * {@link MergeRule#EARLIEST_ADDED}) is then fully replaced onto the root
 * scope first and onto every replica returned by
 * {@link org.waabox.mixtape.catalog.CatalogClient#members()}, whether or
 * not it contributed. Write targets usually outnumber read sources, which
 * is why the result reports replicas updated separately from the total.
 *
 * <p>The root scope and the membership list are resolved before any
 * collection; if either is unavailable the run aborts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BroadcastPolicy implements ReconciliationPolicy {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(BroadcastPolicy.class);

  /** The replicas read from. */
  private final List<String> curators;

  /** The candidate collector. */
  private final Collector collector = new Collector();

  /** The merger. */
  private final Merger merger = new Merger();

  /** The playlist writer. */
  private final PlaylistWriter writer = new PlaylistWriter();

  /**
   * Creates a new policy.
   *
   * @param theCurators the curator replicas, never null or empty
   *
   * @throws IllegalArgumentException if curators is empty
   */
  public BroadcastPolicy(final List<String> theCurators) {
    Objects.requireNonNull(theCurators, "curators must not be null");
    if (theCurators.isEmpty()) {
      throw new IllegalArgumentException("curators must not be empty");
    }
    curators = List.copyOf(theCurators);
  }

  /** {@inheritDoc} */
  @Override
  public void reconcile(final ReconciliationContext context,
      final SyncReport report) {
    final String name = context.playlistName();
    final ScopedCatalog root = context.rootScope();
    final List<String> targets = targetsExcluding(root.replicaId(),
        context.members());

    log.info("Syncing '{}' from curators: {}", name, curators);

    final List<MergedItem> merged = merger.merge(
        collector.collect(context, curators, InclusionRule.memberOf(name),
            report),
        MergeRule.EARLIEST_ADDED);
    PlaylistWriter.recordMerge(report, merged);

    if (merged.isEmpty()) {
      log.info("No tracks found in any curator's '{}'", name);
      return;
    }
    log.info("Merged '{}' has {} unique tracks", name, merged.size());

    if (context.isPreview()) {
      return;
    }

    final List<Item> items = PlaylistWriter.itemsOf(merged);
    writer.writeToScope(context, report, root,
        scope -> writer.replace(scope, name, items));

    for (final String replicaId : targets) {
      if (context.stopRequested()) {
        return;
      }
      writer.writeToReplica(context, report, replicaId,
          scope -> writer.replace(scope, name, items));
    }
  }

  /** {@inheritDoc} */
  @Override
  public MergeRule mergeRule() {
    return MergeRule.EARLIEST_ADDED;
  }

  /**
   * Returns the curator replicas.
   *
   * @return the curators, never null
   */
  public List<String> curators() {
    return curators;
  }

  private static List<String> targetsExcluding(final String rootId,
      final List<String> members) {
    final Set<String> targets = new LinkedHashSet<>(members);
    targets.remove(rootId);
    return new ArrayList<>(targets);
  }
}
