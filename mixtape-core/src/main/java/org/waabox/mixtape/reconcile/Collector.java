package org.waabox.mixtape.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ScopedCatalog;
import org.waabox.mixtape.report.ReplicaOutcome;
import org.waabox.mixtape.report.SyncReport;

/**
 * Gathers merge candidates from one or more replicas.
 *
 * <p>Collection is read-only and sequential. A replica that cannot be
 * entered or read is logged, recorded as a failed read and skipped; the
 * remaining replicas are still collected. Duplicate keys across replicas
 * are kept, deduplication is the {@link Merger}'s job.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Collector {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Collector.class);

  /**
   * Collects candidates from each of the given replicas in order.
   *
   * @param context  the run context, never null
   * @param replicas the replica identifiers to read, never null
   * @param rule     the inclusion rule, never null
   * @param report   the report receiving one READ outcome per replica,
   *                 never null
   *
   * @return the candidates, in replica order then catalog order, never null
   */
  public List<Candidate> collect(final ReconciliationContext context,
      final List<String> replicas, final InclusionRule rule,
      final SyncReport report) {
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(replicas, "replicas must not be null");
    Objects.requireNonNull(rule, "rule must not be null");
    Objects.requireNonNull(report, "report must not be null");

    final List<Candidate> candidates = new ArrayList<>();
    for (final String replicaId : replicas) {
      if (context.stopRequested()) {
        break;
      }
      try {
        final ScopedCatalog scope = context.openScope(replicaId);
        candidates.addAll(select(context, scope, rule));
        report.record(ReplicaOutcome.read(replicaId));
      } catch (final RuntimeException e) {
        log.warn("Playlist '{}': could not read replica '{}': {}",
            context.playlistName(), replicaId, e.getMessage());
        report.record(ReplicaOutcome.readFailed(replicaId, e));
        context.replicaFailed(replicaId, e);
      }
    }
    return candidates;
  }

  /**
   * Collects candidates from an already opened scope, typically the root.
   *
   * <p>Unlike {@link #collect(ReconciliationContext, List, InclusionRule,
   * SyncReport)} a failure here is recorded and yields no candidates.
   *
   * @param context the run context, never null
   * @param scope   the scope to read, never null
   * @param rule    the inclusion rule, never null
   * @param report  the report receiving the READ outcome, never null
   *
   * @return the candidates in catalog order, never null
   */
  public List<Candidate> collect(final ReconciliationContext context,
      final ScopedCatalog scope, final InclusionRule rule,
      final SyncReport report) {
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(rule, "rule must not be null");
    Objects.requireNonNull(report, "report must not be null");

    try {
      final List<Candidate> candidates = select(context, scope, rule);
      report.record(ReplicaOutcome.read(scope.replicaId()));
      return candidates;
    } catch (final RuntimeException e) {
      log.warn("Playlist '{}': could not read replica '{}': {}",
          context.playlistName(), scope.replicaId(), e.getMessage());
      report.record(ReplicaOutcome.readFailed(scope.replicaId(), e));
      context.replicaFailed(scope.replicaId(), e);
      return List.of();
    }
  }

  private List<Candidate> select(final ReconciliationContext context,
      final ScopedCatalog scope, final InclusionRule rule) {
    final List<Item> items = rule.select(scope);
    log.info("Playlist '{}': collected {} item(s) from {}",
        context.playlistName(), items.size(), scope.replicaId());

    final List<Candidate> candidates = new ArrayList<>(items.size());
    for (final Item item : items) {
      candidates.add(new Candidate(item, scope.replicaId()));
    }
    return candidates;
  }
}
