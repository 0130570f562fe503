package org.waabox.mixtape.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.mixtape.PlaylistDefinition;

/**
 * Configuration properties for Mixtape, mapped from the {@code mixtape.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code mixtape.retry.max-attempts} and {@code mixtape.retry.backoff}
 *       - attempts and pause when entering a replica scope.</li>
 *   <li>{@code mixtape.playlists.<id>.*} - one playlist per entry, see
 *       {@link Playlist}.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "mixtape")
public class MixtapeProperties {

  /** The retry settings. */
  private final Retry retry = new Retry();

  /** The playlists by id, in declaration order. */
  private final Map<String, Playlist> playlists = new LinkedHashMap<>();

  /**
   * Returns the retry settings.
   *
   * @return the retry settings, never null
   */
  public Retry getRetry() {
    return retry;
  }

  /**
   * Returns the configured playlists keyed by id.
   *
   * @return the playlists, never null
   */
  public Map<String, Playlist> getPlaylists() {
    return playlists;
  }

  /** Retry settings; unset values fall back to the library defaults. */
  public static class Retry {

    /** The maximum number of attempts, null for the default. */
    private Integer maxAttempts;

    /** The pause between attempts, null for the default. */
    private Duration backoff;

    public Integer getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final Integer maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(final Duration backoff) {
      this.backoff = backoff;
    }

    /**
     * Whether any retry setting was given.
     *
     * @return true if max-attempts or backoff is set
     */
    boolean isConfigured() {
      return maxAttempts != null || backoff != null;
    }
  }

  /**
   * One playlist. The map key is used as the playlist name unless
   * {@code name} is set, which allows names with spaces.
   */
  public static class Playlist {

    /** The playlist name as shown in the catalog, null to use the id. */
    private String name;

    /** The reconciliation policy. */
    private PlaylistDefinition.Kind policy;

    /** The contributors, members or curators, depending on the policy. */
    private List<String> replicas = new ArrayList<>();

    /** The maximum length of an incremental playlist, null for default. */
    private Integer cap;

    /** The rating threshold, null for the policy default. */
    private Double minRating;

    public String getName() {
      return name;
    }

    public void setName(final String name) {
      this.name = name;
    }

    public PlaylistDefinition.Kind getPolicy() {
      return policy;
    }

    public void setPolicy(final PlaylistDefinition.Kind policy) {
      this.policy = policy;
    }

    public List<String> getReplicas() {
      return replicas;
    }

    public void setReplicas(final List<String> replicas) {
      this.replicas = replicas;
    }

    public Integer getCap() {
      return cap;
    }

    public void setCap(final Integer cap) {
      this.cap = cap;
    }

    public Double getMinRating() {
      return minRating;
    }

    public void setMinRating(final Double minRating) {
      this.minRating = minRating;
    }

    /**
     * Builds the definition this entry describes.
     *
     * @param id the entry's key under {@code mixtape.playlists}, never null
     *
     * @return the definition, never null
     *
     * @throws IllegalStateException if the policy is missing or cannot be
     *                               configured through properties
     */
    PlaylistDefinition toDefinition(final String id) {
      final String playlistName = name != null && !name.isBlank()
          ? name : id;
      if (policy == null) {
        throw new IllegalStateException("mixtape.playlists." + id
            + ".policy must be set");
      }

      final PlaylistDefinition.Builder builder =
          PlaylistDefinition.named(playlistName);
      switch (policy) {
        case INCREMENTAL:
          builder.incremental(replicas);
          break;
        case FULL_REPLACE:
          builder.fullReplace(replicas);
          break;
        case BROADCAST:
          builder.broadcast(replicas);
          break;
        case TOP_RATED:
          builder.topRated();
          break;
        default:
          throw new IllegalStateException("mixtape.playlists." + id
              + ".policy " + policy + " requires a PlaylistRegistrar bean");
      }
      if (cap != null) {
        builder.cap(cap);
      }
      if (minRating != null) {
        builder.minRating(minRating);
      }
      return builder.build();
    }
  }
}
