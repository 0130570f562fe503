package org.waabox.mixtape.catalog.plex;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.ScopeUnavailableException;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.catalog.ScopedCatalog;

/**
 * A {@link CatalogClient} backed by a Plex Media Server.
 *
 * <p>Each replica is a Plex user. Entering a replica's scope checks that the
 * server answers {@code /identity} with that user's token, then issues all
 * further requests with it. The root replica is the server owner.
 *
 * <p>Typical usage:
 * <pre>{@code
 * PlexCatalogConfig config = PlexCatalogConfig.create(
 *     "http://plex.local:32400", "admin", adminToken,
 *     Map.of("alice", aliceToken, "bob", bobToken));
 * Mixtape mixtape = Mixtape.builder()
 *     .catalogClient(new PlexCatalogClient(config))
 *     .build();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PlexCatalogClient implements CatalogClient {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PlexCatalogClient.class);

  /** The configuration. */
  private final PlexCatalogConfig config;

  /** The transport. */
  private final PlexHttp http;

  /**
   * Creates a new client with its own {@link HttpClient}.
   *
   * @param config the configuration, never null
   */
  public PlexCatalogClient(final PlexCatalogConfig config) {
    this(config, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(config,
            "config must not be null").timeout())
        .build());
  }

  /**
   * Creates a new client sharing the given {@link HttpClient}.
   *
   * @param config     the configuration, never null
   * @param httpClient the HTTP client, never null
   */
  public PlexCatalogClient(final PlexCatalogConfig config,
      final HttpClient httpClient) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    http = new PlexHttp(config, Objects.requireNonNull(httpClient,
        "httpClient must not be null"));
  }

  /** {@inheritDoc} */
  @Override
  public ScopedCatalog root() {
    return open(config.adminId(), config.adminToken());
  }

  /** {@inheritDoc} */
  @Override
  public ScopedCatalog switchScope(final String replicaId) {
    Objects.requireNonNull(replicaId, "replicaId must not be null");
    if (config.adminId().equals(replicaId)) {
      return root();
    }
    final String token = config.replicaTokens().get(replicaId);
    if (token == null) {
      throw new ScopeUnavailableException(replicaId);
    }
    return open(replicaId, token);
  }

  /** {@inheritDoc} */
  @Override
  public List<String> members() {
    return new ArrayList<>(config.replicaTokens().keySet());
  }

  private ScopedCatalog open(final String replicaId, final String token) {
    final String machineId;
    try {
      machineId = PlexResponses.machineIdentifier(
          http.get(token, "/identity"))
          .orElseThrow(() -> new ScopeUnavailableException(replicaId));
    } catch (final ScopeUnavailableException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new ScopeUnavailableException(replicaId, e);
    }
    log.debug("Switched to Plex user {} on server {}", replicaId, machineId);
    return new PlexScope(replicaId, token, machineId, http);
  }
}
