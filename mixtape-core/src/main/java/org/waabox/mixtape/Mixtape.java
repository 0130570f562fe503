package org.waabox.mixtape;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.metrics.MixtapeMetrics;
import org.waabox.mixtape.metrics.NoopMixtapeMetrics;
import org.waabox.mixtape.reconcile.ReconciliationContext;
import org.waabox.mixtape.report.SyncReport;
import org.waabox.mixtape.report.SyncResult;

/**
 * The main entry point for the Mixtape playlist reconciliation library.
 *
 * <p>Mixtape keeps shared playlists consistent across the replicas (per
 * user views) of one catalog. Each playlist is registered with a
 * {@link PlaylistDefinition} naming the policy that reconciles it; a call
 * to {@link #sync(String)} then collects, merges and redistributes it.
 *
 * <p>Mixtape holds no state between runs: every run recomputes the merge
 * from the replicas' current contents. Runs are synchronous and visit
 * replicas one at a time. Concurrent runs of the same playlist are not
 * serialized.
 *
 * <p>Usage example:
 * <pre>{@code
 * Mixtape mixtape = Mixtape.builder()
 *     .catalogClient(plexCatalogClient)
 *     .retryPolicy(RetryPolicy.of(3, Duration.ofSeconds(1)))
 *     .metrics(micrometerMetrics)
 *     .build();
 *
 * mixtape.register(PlaylistDefinition.named("Jam Jar")
 *     .fullReplace(List.of("alice", "bob"))
 *     .build());
 *
 * SyncResult result = mixtape.sync("Jam Jar");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Mixtape {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Mixtape.class);

  /** The catalog client. */
  private final CatalogClient catalogClient;

  /** The retry policy for entering replica scopes. */
  private final RetryPolicy retryPolicy;

  /** The metrics reporter. */
  private final MixtapeMetrics metrics;

  /** The registered playlists, keyed by name. */
  private final Map<String, PlaylistDefinition> definitionsByName;

  /**
   * Creates a new Mixtape instance.
   *
   * @param theCatalogClient the catalog client, never null
   * @param theRetryPolicy   the retry policy, never null
   * @param theMetrics       the metrics reporter, never null
   */
  private Mixtape(final CatalogClient theCatalogClient,
      final RetryPolicy theRetryPolicy, final MixtapeMetrics theMetrics) {
    catalogClient = theCatalogClient;
    retryPolicy = theRetryPolicy;
    metrics = theMetrics;
    definitionsByName = new ConcurrentHashMap<>();
  }

  /**
   * Creates a new builder for constructing a Mixtape instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a playlist.
   *
   * @param definition the playlist definition, never null
   *
   * @throws NullPointerException     if definition is null
   * @throws IllegalArgumentException if a playlist with the same name is
   *                                  already registered
   */
  public void register(final PlaylistDefinition definition) {
    Objects.requireNonNull(definition, "definition must not be null");

    final String name = definition.name();
    final PlaylistDefinition existing =
        definitionsByName.putIfAbsent(name, definition);
    if (existing != null) {
      throw new IllegalArgumentException(
          "A playlist with name '" + name + "' is already registered");
    }
    log.info("Registered playlist '{}' with {} policy", name,
        definition.kind());
  }

  /**
   * Reconciles a registered playlist and returns its summary.
   *
   * @param playlistName the playlist name, never null
   *
   * @return the summary, never null; zero-valued when there was nothing
   *         to reconcile
   *
   * @throws IllegalArgumentException if no playlist with the given name is
   *                                  registered
   * @throws MixtapeException         if the run could not start
   */
  public SyncResult sync(final String playlistName) {
    return reconcile(playlistName).result();
  }

  /**
   * Reconciles a registered playlist and returns the full report,
   * including the outcome of every replica read and write.
   *
   * @param playlistName the playlist name, never null
   *
   * @return the report, never null
   *
   * @throws IllegalArgumentException if no playlist with the given name is
   *                                  registered
   * @throws MixtapeException         if the run could not start
   */
  public SyncReport reconcile(final String playlistName) {
    return run(playlistName, false);
  }

  /**
   * Computes the merge of a registered playlist without writing to any
   * replica.
   *
   * @param playlistName the playlist name, never null
   *
   * @return the summary of the merge; {@code added} and
   *         {@code replicasUpdated} are always zero
   *
   * @throws IllegalArgumentException if no playlist with the given name is
   *                                  registered
   * @throws MixtapeException         if the run could not start
   */
  public SyncResult preview(final String playlistName) {
    return run(playlistName, true).result();
  }

  /**
   * Returns the registered playlists.
   *
   * @return an unmodifiable collection of definitions, never null
   */
  public Collection<PlaylistDefinition> definitions() {
    return Collections.unmodifiableCollection(definitionsByName.values());
  }

  private SyncReport run(final String playlistName, final boolean preview) {
    Objects.requireNonNull(playlistName, "playlistName must not be null");
    final PlaylistDefinition definition = requireDefinition(playlistName);

    final ReconciliationContext context = new ReconciliationContext(
        playlistName, catalogClient, retryPolicy, metrics, preview);
    final SyncReport report = new SyncReport(playlistName);

    final long start = System.nanoTime();
    definition.policy().reconcile(context, report);
    final long durationMs = TimeUnit.NANOSECONDS.toMillis(
        System.nanoTime() - start);

    final SyncResult result = report.result();
    metrics.reconciled(playlistName, durationMs, result.total());

    if (report.failures().isEmpty()) {
      log.info("{} '{}' in {} ms: {} tracks, {} added, {} replicas updated",
          preview ? "Previewed" : "Reconciled", playlistName, durationMs,
          result.total(), result.added(), result.replicasUpdated());
    } else {
      log.warn("{} '{}' in {} ms with {} failed replica(s): {} tracks, "
          + "{} added, {} replicas updated",
          preview ? "Previewed" : "Reconciled", playlistName, durationMs,
          report.failures().size(), result.total(), result.added(),
          result.replicasUpdated());
    }
    return report;
  }

  /**
   * Looks up a playlist definition by name, throwing if not found.
   *
   * @param playlistName the playlist name, never null
   *
   * @return the definition, never null
   *
   * @throws IllegalArgumentException if no playlist with the given name is
   *                                  registered
   */
  private PlaylistDefinition requireDefinition(final String playlistName) {
    final PlaylistDefinition definition =
        definitionsByName.get(playlistName);
    if (definition == null) {
      throw new IllegalArgumentException(
          "No playlist registered with name '" + playlistName + "'");
    }
    return definition;
  }

  /**
   * A fluent builder for constructing {@link Mixtape} instances.
   *
   * <p>The catalog client is mandatory. Defaults:
   * <ul>
   *   <li>retryPolicy: {@link RetryPolicy#defaultPolicy()}</li>
   *   <li>metrics: {@link NoopMixtapeMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The catalog client. */
    private CatalogClient catalogClient;

    /** The optional retry policy. */
    private RetryPolicy retryPolicy;

    /** The optional metrics reporter. */
    private MixtapeMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the catalog client.
     *
     * @param theCatalogClient the catalog client, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theCatalogClient is null
     */
    public Builder catalogClient(final CatalogClient theCatalogClient) {
      Objects.requireNonNull(theCatalogClient,
          "catalogClient must not be null");
      this.catalogClient = theCatalogClient;
      return this;
    }

    /**
     * Sets the retry policy for entering replica scopes.
     *
     * <p>If not set, {@link RetryPolicy#defaultPolicy()} is used.
     *
     * @param theRetryPolicy the retry policy, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theRetryPolicy is null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      Objects.requireNonNull(theRetryPolicy,
          "retryPolicy must not be null");
      this.retryPolicy = theRetryPolicy;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopMixtapeMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final MixtapeMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the Mixtape instance with the configured settings.
     *
     * @return a new Mixtape instance, never null
     *
     * @throws IllegalStateException if no catalog client was set
     */
    public Mixtape build() {
      if (catalogClient == null) {
        throw new IllegalStateException("catalogClient must be set");
      }
      final RetryPolicy resolvedRetry = retryPolicy != null
          ? retryPolicy : RetryPolicy.defaultPolicy();
      final MixtapeMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopMixtapeMetrics();

      return new Mixtape(catalogClient, resolvedRetry, resolvedMetrics);
    }
  }
}
