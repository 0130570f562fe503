package org.waabox.mixtape.reconcile;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.mixtape.RetryPolicy;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.memory.InMemoryCatalogClient;
import org.waabox.mixtape.metrics.MixtapeMetrics;
import org.waabox.mixtape.metrics.NoopMixtapeMetrics;
import org.waabox.mixtape.report.ReplicaOutcome;
import org.waabox.mixtape.report.SyncReport;

/**
 * Tests for {@link Collector}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CollectorTest {

  private static final Instant DAY_1 = Instant.parse("2026-01-01T00:00:00Z");

  private final Collector collector = new Collector();

  @Test
  void whenCollectingRatings_givenUntimestampedItem_shouldExcludeIt() {
    final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
    client.replica("alice")
        .rate(Item.of("k1", "Dated", "X"), 10.0, DAY_1)
        .rate(Item.of("k2", "Undated", "X"), 10.0, null);

    final SyncReport report = new SyncReport("Recent Raves");
    final List<Candidate> candidates = collector.collect(
        context(client, new NoopMixtapeMetrics()), List.of("alice"),
        InclusionRule.ratedAtLeast(9.9), report);

    assertEquals(1, candidates.size());
    assertEquals("k1", candidates.get(0).item().key().value());
    assertEquals("alice", candidates.get(0).replicaId());
    assertTrue(report.failures().isEmpty());
  }

  @Test
  void whenCollectingMembers_givenMissingPlaylist_shouldContributeNothing() {
    final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
    client.replica("alice");
    client.replica("bob").seed("Jam Jar",
        List.of(Item.of("k1", "Song", "X").withActivityAt(DAY_1)));

    final SyncReport report = new SyncReport("Jam Jar");
    final List<Candidate> candidates = collector.collect(
        context(client, new NoopMixtapeMetrics()), List.of("alice", "bob"),
        InclusionRule.memberOf("Jam Jar"), report);

    assertEquals(1, candidates.size());
    assertEquals("bob", candidates.get(0).replicaId());
    assertEquals(2, report.outcomes().size());
    assertTrue(report.outcomes().get(0).success());
  }

  @Test
  void whenCollecting_givenUnreachableReplica_shouldSkipAndRecordIt() {
    final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
    client.replica("alice").seed("Jam Jar",
        List.of(Item.of("k1", "One", "X").withActivityAt(DAY_1)));
    client.replica("bob");
    client.replica("carol").seed("Jam Jar",
        List.of(Item.of("k2", "Two", "X").withActivityAt(DAY_1)));
    client.markUnreachable("bob");

    final MixtapeMetrics metrics = createMock(MixtapeMetrics.class);
    metrics.replicaFailed(eq("Jam Jar"), eq("bob"),
        anyObject(Throwable.class));
    expectLastCall().once();
    replay(metrics);

    final SyncReport report = new SyncReport("Jam Jar");
    final List<Candidate> candidates = collector.collect(
        context(client, metrics), List.of("alice", "bob", "carol"),
        InclusionRule.memberOf("Jam Jar"), report);

    assertEquals(2, candidates.size());
    assertEquals(1, report.failures().size());
    final ReplicaOutcome failure = report.failures().get(0);
    assertEquals("bob", failure.replicaId());
    assertEquals(ReplicaOutcome.Operation.READ, failure.operation());
    assertTrue(failure.failureMessage().isPresent());

    verify(metrics);
  }

  @Test
  void whenCollecting_givenFailingRead_shouldSkipReplica() {
    final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
    client.replica("alice").failReads(true);

    final SyncReport report = new SyncReport("Jam Jar");
    final List<Candidate> candidates = collector.collect(
        context(client, new NoopMixtapeMetrics()), List.of("alice"),
        InclusionRule.memberOf("Jam Jar"), report);

    assertTrue(candidates.isEmpty());
    assertFalse(report.outcomes().get(0).success());
  }

  @Test
  void whenCollecting_givenInterruptedThread_shouldStopBeforeNextReplica() {
    final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
    client.replica("alice").seed("Jam Jar",
        List.of(Item.of("k1", "One", "X").withActivityAt(DAY_1)));

    final SyncReport report = new SyncReport("Jam Jar");
    Thread.currentThread().interrupt();
    try {
      final List<Candidate> candidates = collector.collect(
          context(client, new NoopMixtapeMetrics()), List.of("alice"),
          InclusionRule.memberOf("Jam Jar"), report);

      assertTrue(candidates.isEmpty());
      assertTrue(report.outcomes().isEmpty());
    } finally {
      Thread.interrupted();
    }
  }

  private static ReconciliationContext context(
      final InMemoryCatalogClient client, final MixtapeMetrics metrics) {
    return new ReconciliationContext("Jam Jar", client,
        RetryPolicy.singleAttempt(), metrics, false);
  }
}
