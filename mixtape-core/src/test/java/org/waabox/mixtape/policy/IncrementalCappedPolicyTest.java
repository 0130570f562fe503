package org.waabox.mixtape.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
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
import org.waabox.mixtape.report.SyncReport;
import org.waabox.mixtape.report.SyncResult;
import org.waabox.mixtape.report.TrackSummary;

/**
 * Tests for {@link IncrementalCappedPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class IncrementalCappedPolicyTest {

  private static final String NAME = "Recent Raves";

  private static final Instant EPOCH = Instant.parse("2026-01-01T00:00:00Z");

  private InMemoryCatalogClient client;

  @BeforeEach
  void setUp() {
    client = new InMemoryCatalogClient("admin");
    client.replica("A")
        .rate(track("T1"), 10.0, day(1))
        .rate(track("T2"), 10.0, day(3));
    client.replica("B")
        .rate(track("T2"), 10.0, day(2))
        .rate(track("T3"), 10.0, day(5));
    client.replica("C");
  }

  @Test
  void whenReconciling_givenOverlappingRatings_shouldSeedEveryContributor() {
    final SyncResult result = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 50), false).result();

    assertEquals(3, result.total());
    assertEquals(9, result.added());
    assertEquals(3, result.replicasUpdated());

    final List<TrackSummary> tracks = result.tracks();
    assertEquals("T3", tracks.get(0).title());
    assertEquals("B", tracks.get(0).attributedReplica());
    assertEquals(day(5), tracks.get(0).timestamp());
    assertEquals("T2", tracks.get(1).title());
    assertEquals("A", tracks.get(1).attributedReplica());
    assertEquals(day(3), tracks.get(1).timestamp());
    assertEquals("T1", tracks.get(2).title());
    assertEquals("A", tracks.get(2).attributedReplica());

    for (final String replica : List.of("A", "B", "C")) {
      assertEquals(List.of("T3", "T2", "T1"), keysOf(replica));
    }
  }

  @Test
  void whenReconcilingTwice_givenNoNewRatings_shouldAddNothing() {
    final IncrementalCappedPolicy policy = new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 50);
    run(policy, false);

    final SyncResult second = run(policy, false).result();

    assertEquals(3, second.total());
    assertEquals(0, second.added());
    assertEquals(3, second.replicasUpdated());
    assertEquals(List.of("T3", "T2", "T1"), keysOf("C"));
  }

  @Test
  void whenReconciling_givenExistingPlaylist_shouldOnlyAppendMissingTracks() {
    client.replica("C").seed(NAME, List.of(track("T1"), track("X1")));

    final SyncReport report = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 50), false);

    assertEquals(List.of("T1", "X1", "T3", "T2"), keysOf("C"));
    assertEquals(8, report.added());
  }

  @Test
  void whenReconciling_givenPlaylistBeyondCap_shouldEvictStaleTracksFirst() {
    client.replica("C").seed(NAME, List.of(track("X1"), track("X2")));

    final SyncReport report = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 3), false);

    assertEquals(List.of("T3", "T2", "T1"), keysOf("C"));
    assertEquals(List.of("T3", "T2", "T1"), keysOf("A"));
    assertEquals(9, report.added());
  }

  @Test
  void whenReconcilingTwice_givenPlaylistAtCap_shouldAddNothing() {
    client.replica("D")
        .seed(NAME, List.of(track("X1"), track("X2")))
        .rate(track("T9"), 10.0, day(9));
    final IncrementalCappedPolicy policy = new IncrementalCappedPolicy(
        List.of("D"), 10.0, 2);

    final SyncReport first = run(policy, false);
    assertEquals(1, first.added());
    assertEquals(List.of("X1", "T9"), keysOf("D"));

    final SyncReport second = run(policy, false);
    assertEquals(0, second.added());
    assertEquals(List.of("X1", "T9"), keysOf("D"));
  }

  @Test
  void whenReconciling_givenRepeatedTrack_shouldEvictOnlyTheRepeat() {
    client.replica("D")
        .seed(NAME, List.of(track("X1"), track("X2"), track("X1")))
        .rate(track("T9"), 10.0, day(9));

    run(new IncrementalCappedPolicy(List.of("D"), 10.0, 3), false);

    assertEquals(List.of("X1", "X2", "T9"), keysOf("D"));
  }

  @Test
  void whenReconciling_givenMoreRatingsThanCap_shouldNeverExceedCap() {
    for (int i = 10; i < 20; i++) {
      client.replica("C").rate(track("N" + i), 10.0, day(i));
    }

    final SyncResult result = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 5), false).result();

    assertEquals(5, result.total());
    assertEquals("N19", result.tracks().get(0).title());
    for (final String replica : List.of("A", "B", "C")) {
      assertEquals(5, keysOf(replica).size());
    }
  }

  @Test
  void whenReconciling_givenUnreachableContributor_shouldUpdateTheOthers() {
    client.markUnreachable("B");

    final SyncReport report = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 50), false);

    assertEquals(2, report.result().total());
    assertEquals(2, report.replicasUpdated());
    assertEquals(2, report.failures().size());
    assertEquals(List.of("T2", "T1"), keysOf("C"));
    assertFalse(client.replica("B").hasPlaylist(NAME));
  }

  @Test
  void whenReconciling_givenRatingsBelowThreshold_shouldWriteNothing() {
    final SyncResult result = run(new IncrementalCappedPolicy(
        List.of("C"), 10.0, 50), false).result();

    assertTrue(result.isEmpty());
    assertFalse(client.replica("C").hasPlaylist(NAME));
  }

  @Test
  void whenPreviewing_givenRatings_shouldMergeWithoutWriting() {
    final SyncResult result = run(new IncrementalCappedPolicy(
        List.of("A", "B", "C"), 10.0, 50), true).result();

    assertEquals(3, result.total());
    assertEquals(0, result.added());
    assertEquals(0, result.replicasUpdated());
    assertFalse(client.replica("A").hasPlaylist(NAME));
  }

  @Test
  void whenCreating_givenInvalidArguments_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> new IncrementalCappedPolicy(List.of(), 10.0, 50));
    assertThrows(IllegalArgumentException.class,
        () -> new IncrementalCappedPolicy(List.of("A"), 10.0, 0));
  }

  private SyncReport run(final IncrementalCappedPolicy policy,
      final boolean preview) {
    final SyncReport report = new SyncReport(NAME);
    policy.reconcile(new ReconciliationContext(NAME, client,
        RetryPolicy.singleAttempt(), new NoopMixtapeMetrics(), preview),
        report);
    return report;
  }

  private List<String> keysOf(final String replica) {
    final List<String> keys = new ArrayList<>();
    for (final Item item : client.replica(replica).itemsOf(NAME)) {
      keys.add(item.key().value());
    }
    return keys;
  }

  private static Item track(final String key) {
    return Item.of(key, key, "Artist " + key);
  }

  private static Instant day(final int day) {
    return EPOCH.plus(Duration.ofDays(day));
  }
}
