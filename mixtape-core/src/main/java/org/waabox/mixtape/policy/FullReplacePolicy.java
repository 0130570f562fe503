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
 * Keeps a collaborative playlist identical across its members.
 *
 * <p>Reads the playlist of every member, merges the union with
 * {@link MergeRule#EARLIEST_ADDED} and rewrites every member's playlist with
 * the full merged set. After one pass all members that were written hold
 * the same items in the same order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FullReplacePolicy implements ReconciliationPolicy {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FullReplacePolicy.class);

  /** The replicas read from and written to. */
  private final List<String> members;

  /** The candidate collector. */
  private final Collector collector = new Collector();

  /** The merger. */
  private final Merger merger = new Merger();

  /** The playlist writer. */
  private final PlaylistWriter writer = new PlaylistWriter();

  /**
   * Creates a new policy.
   *
   * @param theMembers the member replicas, never null or empty
   *
   * @throws IllegalArgumentException if members is empty
   */
  public FullReplacePolicy(final List<String> theMembers) {
    Objects.requireNonNull(theMembers, "members must not be null");
    if (theMembers.isEmpty()) {
      throw new IllegalArgumentException("members must not be empty");
    }
    members = List.copyOf(theMembers);
  }

  /** {@inheritDoc} */
  @Override
  public void reconcile(final ReconciliationContext context,
      final SyncReport report) {
    final String name = context.playlistName();
    log.info("Syncing '{}' across members: {}", name, members);

    final List<MergedItem> merged = merger.merge(
        collector.collect(context, members, InclusionRule.memberOf(name),
            report),
        MergeRule.EARLIEST_ADDED);
    PlaylistWriter.recordMerge(report, merged);

    if (merged.isEmpty()) {
      log.info("No tracks found in any '{}' playlist", name);
      return;
    }
    log.info("Merged '{}' has {} unique tracks", name, merged.size());

    if (context.isPreview()) {
      return;
    }

    final List<Item> items = PlaylistWriter.itemsOf(merged);
    for (final String replicaId : members) {
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
   * Returns the member replicas.
   *
   * @return the members, never null
   */
  public List<String> members() {
    return members;
  }
}
