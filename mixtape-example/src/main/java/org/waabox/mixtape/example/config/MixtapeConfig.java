package org.waabox.mixtape.example.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.catalog.plex.PlexCatalogClient;
import org.waabox.mixtape.catalog.plex.PlexCatalogConfig;

/** Spring configuration that defines the catalog the Mixtape instance
 * works against.
 *
 * <p>The {@link CatalogClient} bean is picked up by the
 * mixtape-spring-boot-starter auto-configuration; the playlists themselves
 * come from {@code mixtape.playlists.*} in {@code application.yml}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(PlexSettings.class)
public class MixtapeConfig {

  /** Creates the Plex-backed catalog client.
   *
   * @param settings the Plex connection settings, never null
   *
   * @return the catalog client, never null
   */
  @Bean
  public CatalogClient catalogClient(final PlexSettings settings) {
    return new PlexCatalogClient(PlexCatalogConfig.create(
        settings.getBaseUrl(),
        settings.getAdminId(),
        settings.getAdminToken(),
        settings.getUsers(),
        settings.getTimeout()));
  }
}
