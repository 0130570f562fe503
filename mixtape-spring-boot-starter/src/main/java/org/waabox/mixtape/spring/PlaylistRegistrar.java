package org.waabox.mixtape.spring;

import org.waabox.mixtape.Mixtape;

/**
 * A callback interface for registering playlists with a {@link Mixtape}
 * instance during Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to register playlists that
 * cannot be described through {@code mixtape.playlists.*} properties, for
 * example those using a custom
 * {@link org.waabox.mixtape.policy.ReconciliationPolicy}.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * PlaylistRegistrar staffPicksRegistrar() {
 *     return mixtape -> mixtape.register(
 *         PlaylistDefinition.named("Staff Picks")
 *             .broadcast(List.of("admin", "alice"))
 *             .build());
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface PlaylistRegistrar {

  /**
   * Registers one or more playlists with the given Mixtape instance.
   *
   * @param mixtape the Mixtape instance, never null
   */
  void register(Mixtape mixtape);
}
