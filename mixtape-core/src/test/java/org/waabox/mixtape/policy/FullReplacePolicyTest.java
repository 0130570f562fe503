package org.waabox.mixtape.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.mixtape.RetryPolicy;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.memory.InMemoryCatalogClient;
import org.waabox.mixtape.metrics.NoopMixtapeMetrics;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.ReplicaOutcome;
import org.waabox.mixtape.report.SyncReport;
import org.waabox.mixtape.report.SyncResult;

/**
 * Tests for {@link FullReplacePolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FullReplacePolicyTest {

  private static final String NAME = "Jam Jar";

  private static final Instant EPOCH = Instant.parse("2026-01-01T00:00:00Z");

  private InMemoryCatalogClient client;

  @BeforeEach
  void setUp() {
    client = new InMemoryCatalogClient("admin");
    client.replica("A").seed(NAME, List.of(added("T1", 1), added("T2", 4)));
    client.replica("B").seed(NAME, List.of(added("T2", 2), added("T3", 3)));
    client.replica("C");
  }

  @Test
  void whenReconciling_givenDivergentMembers_shouldConvergeAll() {
    final SyncResult result = run(List.of("A", "B", "C"), false).result();

    assertEquals(3, result.total());
    assertEquals(3, result.replicasUpdated());
    assertEquals(9, result.added());
    assertEquals("T2", result.tracks().get(1).title());
    assertEquals("B", result.tracks().get(1).attributedReplica());
    assertEquals(EPOCH.plus(Duration.ofDays(2)),
        result.tracks().get(1).timestamp());

    for (final String replica : List.of("A", "B", "C")) {
      assertEquals(List.of("T3", "T2", "T1"), keysOf(replica));
    }
  }

  @Test
  void whenReconciling_givenTrackOnlyOnLateMember_shouldSpreadIt() {
    client.replica("C").seed(NAME, List.of(Item.of("OLD", "Old", "X")));

    run(List.of("A", "B"), false);
    run(List.of("A", "B", "C"), false);

    assertEquals(List.of("T3", "T2", "T1", "OLD"), keysOf("A"));
    assertEquals(keysOf("A"), keysOf("C"));
  }

  @Test
  void whenReconciling_givenFailingWrite_shouldStillWriteTheRest() {
    client.replica("B").failWrites(true);

    final SyncReport report = run(List.of("A", "B", "C"), false);

    assertEquals(2, report.replicasUpdated());
    assertEquals(1, report.failures().size());
    final ReplicaOutcome failure = report.failures().get(0);
    assertEquals("B", failure.replicaId());
    assertEquals(ReplicaOutcome.Operation.WRITE, failure.operation());
    assertEquals(List.of("T3", "T2", "T1"), keysOf("C"));
    assertEquals(List.of("T2", "T3"), keysOf("B"));
  }

  @Test
  void whenReconciling_givenNoMemberHasThePlaylist_shouldReturnEmpty() {
    final InMemoryCatalogClient empty = new InMemoryCatalogClient("admin");
    empty.replica("A");

    final SyncReport report = new SyncReport(NAME);
    new FullReplacePolicy(List.of("A")).reconcile(new ReconciliationContext(
        NAME, empty, RetryPolicy.singleAttempt(), new NoopMixtapeMetrics(),
        false), report);

    assertTrue(report.result().isEmpty());
    assertTrue(empty.replica("A").itemsOf(NAME).isEmpty());
  }

  private SyncReport run(final List<String> members, final boolean preview) {
    final SyncReport report = new SyncReport(NAME);
    new FullReplacePolicy(members).reconcile(new ReconciliationContext(NAME,
        client, RetryPolicy.singleAttempt(), new NoopMixtapeMetrics(),
        preview), report);
    return report;
  }

  private List<String> keysOf(final String replica) {
    final List<String> keys = new ArrayList<>();
    for (final Item item : client.replica(replica).itemsOf(NAME)) {
      keys.add(item.key().value());
    }
    return keys;
  }

  private static Item added(final String key, final int day) {
    return Item.of(key, key, "Artist")
        .withActivityAt(EPOCH.plus(Duration.ofDays(day)));
  }
}
