package org.waabox.mixtape.example.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Connection settings for the Plex server, mapped from {@code plex.*}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "plex")
public class PlexSettings {

  /** The server base URL. */
  private String baseUrl;

  /** The replica id of the server owner. */
  private String adminId = "admin";

  /** The server owner's token. */
  private String adminToken;

  /** The access token of each Plex user, keyed by replica id. */
  private Map<String, String> users = new LinkedHashMap<>();

  /** The timeout for each request. */
  private Duration timeout = Duration.ofSeconds(30);

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(final String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getAdminId() {
    return adminId;
  }

  public void setAdminId(final String adminId) {
    this.adminId = adminId;
  }

  public String getAdminToken() {
    return adminToken;
  }

  public void setAdminToken(final String adminToken) {
    this.adminToken = adminToken;
  }

  public Map<String, String> getUsers() {
    return users;
  }

  public void setUsers(final Map<String, String> users) {
    this.users = users;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(final Duration timeout) {
    this.timeout = timeout;
  }
}
