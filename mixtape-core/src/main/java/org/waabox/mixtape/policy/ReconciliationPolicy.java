package org.waabox.mixtape.policy;

import org.waabox.mixtape.reconcile.MergeRule;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.SyncReport;

/**
 * A strategy for reconciling one named playlist across replicas.
 *
 * <p>Every policy runs the same cycle: collect candidates from its source
 * replicas, merge them with its {@link MergeRule}, then write the merged
 * set to its target replicas. Policies differ in which replicas they read
 * and write and in how a write diffs against the replica's current
 * playlist.
 *
 * <p>Implementations must be stateless: the same instance serves every run
 * of its playlist, and runs may overlap.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ReconciliationPolicy {

  /**
   * Runs one reconciliation.
   *
   * <p>Per-replica failures are recorded in the report and never thrown.
   * When {@link ReconciliationContext#isPreview()} is set, the merge is
   * recorded and nothing is written.
   *
   * @param context the run context, never null
   * @param report  the report to fill, never null
   *
   * @throws org.waabox.mixtape.MixtapeException if the run cannot start,
   *                                             for example because the
   *                                             catalog root is unreachable
   */
  void reconcile(ReconciliationContext context, SyncReport report);

  /**
   * Returns the merge rule this policy folds candidates with.
   *
   * @return the merge rule, never null
   */
  MergeRule mergeRule();
}
