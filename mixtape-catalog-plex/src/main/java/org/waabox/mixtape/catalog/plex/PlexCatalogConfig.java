package org.waabox.mixtape.catalog.plex;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration holder for the Plex catalog client.
 *
 * <p>Holds the server base URL, the identity and token of the server owner
 * (the root replica), the access token of every managed or shared user
 * keyed by replica id, and the timeout applied to each HTTP request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PlexCatalogConfig {

  /** The default timeout for each HTTP request. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The server base URL, without a trailing slash. */
  private final String baseUrl;

  /** The replica id of the server owner. */
  private final String adminId;

  /** The server owner's token. */
  private final String adminToken;

  /** The access token of each non-root replica, in declaration order. */
  private final Map<String, String> replicaTokens;

  /** The timeout for each HTTP request. */
  private final Duration timeout;

  /** Private constructor; use the static factory methods instead. */
  private PlexCatalogConfig(final String baseUrl, final String adminId,
      final String adminToken, final Map<String, String> replicaTokens,
      final Duration timeout) {
    Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    Objects.requireNonNull(adminId, "adminId must not be null");
    Objects.requireNonNull(adminToken, "adminToken must not be null");
    Objects.requireNonNull(replicaTokens, "replicaTokens must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException(
          "timeout must be positive, got: " + timeout);
    }
    this.baseUrl = baseUrl.endsWith("/")
        ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.adminId = adminId;
    this.adminToken = adminToken;
    final Map<String, String> tokens = new LinkedHashMap<>(replicaTokens);
    tokens.remove(adminId);
    this.replicaTokens = Collections.unmodifiableMap(tokens);
    this.timeout = timeout;
  }

  /**
   * Creates a new configuration using the default request timeout.
   *
   * @param baseUrl       the server base URL, never null
   * @param adminId       the replica id of the server owner, never null
   * @param adminToken    the server owner's token, never null
   * @param replicaTokens the token of each other replica, never null
   * @return a new {@link PlexCatalogConfig} instance, never null
   */
  public static PlexCatalogConfig create(final String baseUrl,
      final String adminId, final String adminToken,
      final Map<String, String> replicaTokens) {
    return new PlexCatalogConfig(baseUrl, adminId, adminToken, replicaTokens,
        DEFAULT_TIMEOUT);
  }

  /**
   * Creates a new configuration.
   *
   * @param baseUrl       the server base URL, never null
   * @param adminId       the replica id of the server owner, never null
   * @param adminToken    the server owner's token, never null
   * @param replicaTokens the token of each other replica, never null
   * @param timeout       the timeout for each request, positive
   * @return a new {@link PlexCatalogConfig} instance, never null
   */
  public static PlexCatalogConfig create(final String baseUrl,
      final String adminId, final String adminToken,
      final Map<String, String> replicaTokens, final Duration timeout) {
    return new PlexCatalogConfig(baseUrl, adminId, adminToken, replicaTokens,
        timeout);
  }

  /**
   * Returns the server base URL.
   *
   * @return the base URL without a trailing slash, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the replica id of the server owner.
   *
   * @return the admin replica id, never null
   */
  public String adminId() {
    return adminId;
  }

  /**
   * Returns the server owner's token.
   *
   * @return the admin token, never null
   */
  public String adminToken() {
    return adminToken;
  }

  /**
   * Returns the token of every replica other than the owner.
   *
   * @return an unmodifiable map of replica id to token, never null
   */
  public Map<String, String> replicaTokens() {
    return replicaTokens;
  }

  /**
   * Returns the timeout applied to each request.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /** Renders the configuration without its tokens. */
  @Override
  public String toString() {
    return "PlexCatalogConfig{baseUrl='" + baseUrl + "', adminId='" + adminId
        + "', replicas=" + replicaTokens.keySet() + ", timeout=" + timeout
        + "}";
  }
}
