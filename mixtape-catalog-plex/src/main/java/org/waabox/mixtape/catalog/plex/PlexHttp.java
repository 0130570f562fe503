package org.waabox.mixtape.catalog.plex;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mixtape.PlaylistReadException;
import org.waabox.mixtape.PlaylistWriteException;

/**
 * Sends authenticated requests to a Plex server and parses the JSON
 * responses with Jackson's tree model.
 *
 * <p>Reads raise {@link PlaylistReadException} and writes raise
 * {@link PlaylistWriteException} on any transport error or non-2xx status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PlexHttp {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(PlexHttp.class);

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The header carrying the access token. */
  static final String TOKEN_HEADER = "X-Plex-Token";

  /** The configuration. */
  private final PlexCatalogConfig config;

  /** The HTTP client. */
  private final HttpClient client;

  PlexHttp(final PlexCatalogConfig theConfig, final HttpClient theClient) {
    config = theConfig;
    client = theClient;
  }

  /**
   * Issues a GET request.
   *
   * @param token        the access token, never null
   * @param pathAndQuery the path and query, starting with a slash
   *
   * @return the parsed response body, never null
   *
   * @throws PlaylistReadException if the request fails
   */
  JsonNode get(final String token, final String pathAndQuery) {
    try {
      return send("GET", token, pathAndQuery);
    } catch (final PlexRequestFailure e) {
      throw new PlaylistReadException(e.getMessage(), e.getCause());
    }
  }

  /**
   * Issues a mutating request.
   *
   * @param method       the HTTP method, one of POST, PUT or DELETE
   * @param token        the access token, never null
   * @param pathAndQuery the path and query, starting with a slash
   *
   * @return the parsed response body, an empty object when the server
   *         returned none
   *
   * @throws PlaylistWriteException if the request fails
   */
  JsonNode write(final String method, final String token,
      final String pathAndQuery) {
    try {
      return send(method, token, pathAndQuery);
    } catch (final PlexRequestFailure e) {
      throw new PlaylistWriteException(e.getMessage(), e.getCause());
    }
  }

  /**
   * Percent-encodes a query parameter value, spaces included.
   *
   * @param value the raw value, never null
   *
   * @return the encoded value, never null
   */
  static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("+", "%20");
  }

  private JsonNode send(final String method, final String token,
      final String pathAndQuery) {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(config.baseUrl() + pathAndQuery))
        .timeout(config.timeout())
        .header(TOKEN_HEADER, token)
        .header("Accept", "application/json")
        .method(method, HttpRequest.BodyPublishers.noBody())
        .build();

    log.debug("{} {}", method, pathAndQuery);

    final HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new PlexRequestFailure(method + " " + pathAndQuery
          + " failed: " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PlexRequestFailure(method + " " + pathAndQuery
          + " interrupted", e);
    }

    final int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new PlexRequestFailure(method + " " + pathAndQuery
          + " responded with status " + status, null);
    }

    final String body = response.body();
    if (body == null || body.isBlank()) {
      return MAPPER.createObjectNode();
    }
    try {
      return MAPPER.readTree(body);
    } catch (final IOException e) {
      throw new PlexRequestFailure(method + " " + pathAndQuery
          + " returned malformed JSON", e);
    }
  }

  /** A failed request, rethrown as a read or write failure. */
  private static final class PlexRequestFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    PlexRequestFailure(final String message, final Throwable cause) {
      super(message, cause);
    }
  }
}
