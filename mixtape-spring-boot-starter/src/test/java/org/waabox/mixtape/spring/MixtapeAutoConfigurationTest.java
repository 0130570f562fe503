package org.waabox.mixtape.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.mixtape.Mixtape;
import org.waabox.mixtape.PlaylistDefinition;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.memory.InMemoryCatalogClient;
import org.waabox.mixtape.metrics.MixtapeMetrics;
import org.waabox.mixtape.policy.IncrementalCappedPolicy;

/**
 * Tests for {@link MixtapeAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MixtapeAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(MixtapeAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoCatalogClient_shouldFail() {
    runner.run(context -> assertTrue(context.getStartupFailure() != null));
  }

  @Test
  void whenContextLoads_givenCatalogClient_shouldCreateEmptyMixtape() {
    runner.withUserConfiguration(CatalogConfig.class)
        .run(context -> {
          final Mixtape mixtape = context.getBean(Mixtape.class);
          assertNotNull(mixtape);
          assertTrue(mixtape.definitions().isEmpty());
        });
  }

  @Test
  void whenContextLoads_givenPlaylistProperties_shouldRegisterThem() {
    runner.withUserConfiguration(CatalogConfig.class)
        .withPropertyValues(
            "mixtape.playlists.jam-jar.name=Jam Jar",
            "mixtape.playlists.jam-jar.policy=full-replace",
            "mixtape.playlists.jam-jar.replicas=alice,bob",
            "mixtape.playlists.raves.name=Recent Raves",
            "mixtape.playlists.raves.policy=incremental",
            "mixtape.playlists.raves.replicas=alice",
            "mixtape.playlists.raves.cap=20",
            "mixtape.playlists.raves.min-rating=9",
            "mixtape.retry.max-attempts=1")
        .run(context -> {
          final Map<String, PlaylistDefinition> byName = definitions(
              context.getBean(Mixtape.class));

          assertEquals(2, byName.size());
          assertEquals(PlaylistDefinition.Kind.FULL_REPLACE,
              byName.get("Jam Jar").kind());

          final IncrementalCappedPolicy raves = assertInstanceOf(
              IncrementalCappedPolicy.class,
              byName.get("Recent Raves").policy());
          assertEquals(20, raves.cap());
          assertEquals(9.0, raves.minRating());

          final Mixtape mixtape = context.getBean(Mixtape.class);
          assertEquals(2, mixtape.sync("Jam Jar").total());
        });
  }

  @Test
  void whenContextLoads_givenPlaylistWithoutPolicy_shouldFail() {
    runner.withUserConfiguration(CatalogConfig.class)
        .withPropertyValues("mixtape.playlists.broken.replicas=alice")
        .run(context -> assertTrue(context.getStartupFailure() != null));
  }

  @Test
  void whenContextLoads_givenPlaylistRegistrar_shouldInvokeIt() {
    runner.withUserConfiguration(CatalogConfig.class, RegistrarConfig.class)
        .run(context -> {
          final Map<String, PlaylistDefinition> byName = definitions(
              context.getBean(Mixtape.class));
          assertEquals(PlaylistDefinition.Kind.BROADCAST,
              byName.get("Staff Picks").kind());
        });
  }

  @Test
  void whenContextLoads_givenCustomMetrics_shouldReportThroughIt() {
    runner.withUserConfiguration(CatalogConfig.class, MetricsConfig.class)
        .withPropertyValues(
            "mixtape.playlists.jam-jar.name=Jam Jar",
            "mixtape.playlists.jam-jar.policy=full-replace",
            "mixtape.playlists.jam-jar.replicas=alice,bob")
        .run(context -> {
          context.getBean(Mixtape.class).sync("Jam Jar");

          final RecordingMetrics metrics =
              context.getBean(RecordingMetrics.class);
          assertEquals(List.of("Jam Jar"), metrics.reconciled);
        });
  }

  @Test
  void whenContextLoads_givenTwoMetricsBeans_shouldFail() {
    runner.withUserConfiguration(CatalogConfig.class, MetricsConfig.class,
        SecondMetricsConfig.class)
        .run(context -> assertTrue(context.getStartupFailure() != null));
  }

  private static Map<String, PlaylistDefinition> definitions(
      final Mixtape mixtape) {
    return mixtape.definitions().stream().collect(Collectors.toMap(
        PlaylistDefinition::name, Function.identity()));
  }

  /** Provides an in-memory catalog with two seeded replicas. */
  @Configuration(proxyBeanMethods = false)
  static class CatalogConfig {

    @Bean
    CatalogClient catalogClient() {
      final InMemoryCatalogClient client = new InMemoryCatalogClient("admin");
      client.replica("alice").seed("Jam Jar", List.of(
          Item.of("k1", "One", "X").withActivityAt(Instant.EPOCH)));
      client.replica("bob").seed("Jam Jar", List.of(
          Item.of("k2", "Two", "Y").withActivityAt(Instant.EPOCH)));
      return client;
    }
  }

  /** Registers a broadcast playlist programmatically. */
  @Configuration(proxyBeanMethods = false)
  static class RegistrarConfig {

    @Bean
    PlaylistRegistrar staffPicksRegistrar() {
      return mixtape -> mixtape.register(PlaylistDefinition
          .named("Staff Picks")
          .broadcast(List.of("admin"))
          .build());
    }
  }

  /** Provides a recording metrics bean. */
  @Configuration(proxyBeanMethods = false)
  static class MetricsConfig {

    @Bean
    RecordingMetrics recordingMetrics() {
      return new RecordingMetrics();
    }
  }

  /** Provides a second metrics bean. */
  @Configuration(proxyBeanMethods = false)
  static class SecondMetricsConfig {

    @Bean
    MixtapeMetrics otherMetrics() {
      return new RecordingMetrics();
    }
  }

  /** Remembers the playlists it was told about. */
  static class RecordingMetrics implements MixtapeMetrics {

    private final List<String> reconciled = new ArrayList<>();

    @Override
    public void reconciled(final String playlistName, final long durationMs,
        final int mergedItems) {
      reconciled.add(playlistName);
    }

    @Override
    public void replicaFailed(final String playlistName,
        final String replicaId, final Throwable cause) {
    }

    @Override
    public void itemsAdded(final String playlistName, final String replicaId,
        final int count) {
    }
  }
}
