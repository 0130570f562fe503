package org.waabox.mixtape;

import java.util.List;
import java.util.Objects;

import org.waabox.mixtape.policy.BroadcastPolicy;
import org.waabox.mixtape.policy.FullReplacePolicy;
import org.waabox.mixtape.policy.IncrementalCappedPolicy;
import org.waabox.mixtape.policy.ReconciliationPolicy;
import org.waabox.mixtape.policy.TopRatedPolicy;

/**
 * A shared playlist registered with {@link Mixtape}: its name and the
 * policy that reconciles it.
 *
 * <p>Definitions are built with a fluent DSL:
 * <pre>{@code
 * PlaylistDefinition raves = PlaylistDefinition.named("Recent Raves")
 *     .incremental(List.of("alice", "bob"))
 *     .minRating(10.0)
 *     .cap(50)
 *     .build();
 *
 * PlaylistDefinition jamJar = PlaylistDefinition.named("Jam Jar")
 *     .fullReplace(List.of("alice", "bob", "carol"))
 *     .build();
 *
 * PlaylistDefinition picks = PlaylistDefinition.named("Staff Picks")
 *     .broadcast(List.of("alice"))
 *     .build();
 * }</pre>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PlaylistDefinition {

  /** The default cap of incremental playlists. */
  public static final int DEFAULT_CAP = 50;

  /** The default threshold of incremental playlists: five stars. */
  public static final double DEFAULT_RAVE_RATING = 10.0;

  /** The default threshold of top-rated playlists: four stars. */
  public static final double DEFAULT_TOP_RATING = 8.0;

  /** The built-in reconciliation policies. */
  public enum Kind {

    /** Capped and rating based. See {@link IncrementalCappedPolicy}. */
    INCREMENTAL,

    /** Rewrites every member. See {@link FullReplacePolicy}. */
    FULL_REPLACE,

    /** Curators to every replica. See {@link BroadcastPolicy}. */
    BROADCAST,

    /** Root-only rating snapshot. See {@link TopRatedPolicy}. */
    TOP_RATED,

    /** A caller-supplied {@link ReconciliationPolicy}. */
    CUSTOM
  }

  /** The playlist name, identical in every replica. */
  private final String name;

  /** The kind of policy. */
  private final Kind kind;

  /** The policy reconciling the playlist. */
  private final ReconciliationPolicy policy;

  private PlaylistDefinition(final String theName, final Kind theKind,
      final ReconciliationPolicy thePolicy) {
    name = theName;
    kind = theKind;
    policy = thePolicy;
  }

  /**
   * Starts building a definition for the playlist with the given name.
   *
   * @param name the playlist name, never null or blank
   *
   * @return the builder, never null
   *
   * @throws NullPointerException     if name is null
   * @throws IllegalArgumentException if name is blank
   */
  public static Builder named(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return new Builder(name);
  }

  /**
   * Returns the playlist name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the kind of policy reconciling the playlist.
   *
   * @return the kind, never null
   */
  public Kind kind() {
    return kind;
  }

  /**
   * Returns the policy reconciling the playlist.
   *
   * @return the policy, never null
   */
  public ReconciliationPolicy policy() {
    return policy;
  }

  @Override
  public String toString() {
    return "PlaylistDefinition{name='" + name + "', kind=" + kind + "}";
  }

  /** A fluent builder of {@link PlaylistDefinition}. */
  public static final class Builder {

    /** The playlist name. */
    private final String name;

    /** The selected kind, null until one is chosen. */
    private Kind kind;

    /** The replicas the policy reads (and for most kinds, writes). */
    private List<String> replicas;

    /** The cap, only meaningful for incremental playlists. */
    private int cap = DEFAULT_CAP;

    /** The rating threshold, null means the kind's default. */
    private Double minRating;

    /** The custom policy, only for {@link Kind#CUSTOM}. */
    private ReconciliationPolicy custom;

    private Builder(final String theName) {
      name = theName;
    }

    /**
     * Reconciles with {@link IncrementalCappedPolicy} over the given
     * contributors.
     *
     * @param contributors the contributors, never null or empty
     *
     * @return this builder for chaining, never null
     */
    public Builder incremental(final List<String> contributors) {
      return select(Kind.INCREMENTAL, contributors);
    }

    /**
     * Reconciles with {@link FullReplacePolicy} over the given members.
     *
     * @param members the members, never null or empty
     *
     * @return this builder for chaining, never null
     */
    public Builder fullReplace(final List<String> members) {
      return select(Kind.FULL_REPLACE, members);
    }

    /**
     * Reconciles with {@link BroadcastPolicy} from the given curators.
     *
     * @param curators the curators, never null or empty
     *
     * @return this builder for chaining, never null
     */
    public Builder broadcast(final List<String> curators) {
      return select(Kind.BROADCAST, curators);
    }

    /**
     * Reconciles with {@link TopRatedPolicy} on the root scope.
     *
     * @return this builder for chaining, never null
     */
    public Builder topRated() {
      return select(Kind.TOP_RATED, List.of());
    }

    /**
     * Reconciles with a caller-supplied policy.
     *
     * @param policy the policy, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder policy(final ReconciliationPolicy policy) {
      custom = Objects.requireNonNull(policy, "policy must not be null");
      return select(Kind.CUSTOM, List.of());
    }

    /**
     * Sets the cap of an incremental playlist.
     *
     * @param theCap the maximum playlist length, greater than zero
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theCap is not positive
     */
    public Builder cap(final int theCap) {
      if (theCap <= 0) {
        throw new IllegalArgumentException(
            "cap must be greater than 0, got: " + theCap);
      }
      cap = theCap;
      return this;
    }

    /**
     * Sets the inclusive rating threshold of rating-based playlists.
     *
     * @param theMinRating the threshold on a 0-10 scale
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if the threshold is outside 0-10
     */
    public Builder minRating(final double theMinRating) {
      if (theMinRating < 0 || theMinRating > 10) {
        throw new IllegalArgumentException(
            "minRating must be between 0 and 10, got: " + theMinRating);
      }
      minRating = theMinRating;
      return this;
    }

    /**
     * Builds the definition.
     *
     * @return the definition, never null
     *
     * @throws IllegalStateException if no policy was selected
     */
    public PlaylistDefinition build() {
      if (kind == null) {
        throw new IllegalStateException(
            "No reconciliation policy selected for playlist '" + name + "'");
      }
      return new PlaylistDefinition(name, kind, createPolicy());
    }

    private Builder select(final Kind theKind, final List<String> theReplicas) {
      Objects.requireNonNull(theReplicas, "replicas must not be null");
      if (kind != null) {
        throw new IllegalStateException("Playlist '" + name
            + "' already uses the " + kind + " policy");
      }
      kind = theKind;
      replicas = List.copyOf(theReplicas);
      return this;
    }

    private ReconciliationPolicy createPolicy() {
      switch (kind) {
        case INCREMENTAL:
          return new IncrementalCappedPolicy(replicas,
              minRating != null ? minRating : DEFAULT_RAVE_RATING, cap);
        case FULL_REPLACE:
          return new FullReplacePolicy(replicas);
        case BROADCAST:
          return new BroadcastPolicy(replicas);
        case TOP_RATED:
          return new TopRatedPolicy(
              minRating != null ? minRating : DEFAULT_TOP_RATING);
        case CUSTOM:
          return custom;
        default:
          throw new IllegalStateException("Unknown policy kind: " + kind);
      }
    }
  }
}
