package org.waabox.mixtape;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.mixtape.policy.BroadcastPolicy;
import org.waabox.mixtape.policy.FullReplacePolicy;
import org.waabox.mixtape.policy.IncrementalCappedPolicy;
import org.waabox.mixtape.policy.ReconciliationPolicy;
import org.waabox.mixtape.policy.TopRatedPolicy;

/**
 * Tests for {@link PlaylistDefinition}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PlaylistDefinitionTest {

  @Test
  void whenBuilding_givenIncrementalWithoutOptions_shouldUseDefaults() {
    final PlaylistDefinition definition = PlaylistDefinition
        .named("Recent Raves")
        .incremental(List.of("alice", "bob"))
        .build();

    assertEquals("Recent Raves", definition.name());
    assertEquals(PlaylistDefinition.Kind.INCREMENTAL, definition.kind());
    final IncrementalCappedPolicy policy = assertInstanceOf(
        IncrementalCappedPolicy.class, definition.policy());
    assertEquals(PlaylistDefinition.DEFAULT_CAP, policy.cap());
    assertEquals(PlaylistDefinition.DEFAULT_RAVE_RATING, policy.minRating());
    assertEquals(List.of("alice", "bob"), policy.contributors());
  }

  @Test
  void whenBuilding_givenEachKind_shouldCreateMatchingPolicy() {
    assertInstanceOf(FullReplacePolicy.class, PlaylistDefinition
        .named("Jam Jar").fullReplace(List.of("alice")).build().policy());
    assertInstanceOf(BroadcastPolicy.class, PlaylistDefinition
        .named("Staff Picks").broadcast(List.of("alice")).build().policy());

    final TopRatedPolicy topRated = assertInstanceOf(TopRatedPolicy.class,
        PlaylistDefinition.named("Top Rated").topRated().minRating(9.0)
            .build().policy());
    assertEquals(9.0, topRated.minRating());
  }

  @Test
  void whenBuilding_givenCustomPolicy_shouldKeepIt() {
    final ReconciliationPolicy custom = new FullReplacePolicy(List.of("x"));

    final PlaylistDefinition definition = PlaylistDefinition.named("Custom")
        .policy(custom)
        .build();

    assertEquals(PlaylistDefinition.Kind.CUSTOM, definition.kind());
    assertSame(custom, definition.policy());
  }

  @Test
  void whenBuilding_givenNoPolicy_shouldThrow() {
    assertThrows(IllegalStateException.class,
        () -> PlaylistDefinition.named("Empty").build());
  }

  @Test
  void whenBuilding_givenTwoPolicies_shouldThrow() {
    final PlaylistDefinition.Builder builder = PlaylistDefinition
        .named("Twice").fullReplace(List.of("alice"));

    assertThrows(IllegalStateException.class,
        () -> builder.broadcast(List.of("bob")));
  }

  @Test
  void whenBuilding_givenInvalidOptions_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> PlaylistDefinition.named(" "));
    assertThrows(IllegalArgumentException.class,
        () -> PlaylistDefinition.named("X").cap(0));
    assertThrows(IllegalArgumentException.class,
        () -> PlaylistDefinition.named("X").minRating(11));
    assertThrows(IllegalArgumentException.class,
        () -> PlaylistDefinition.named("X").fullReplace(List.of()).build());
  }
}
