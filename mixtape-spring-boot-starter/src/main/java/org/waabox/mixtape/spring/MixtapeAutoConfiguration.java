package org.waabox.mixtape.spring;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.mixtape.Mixtape;
import org.waabox.mixtape.RetryPolicy;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.metrics.MixtapeMetrics;

/**
 * Spring Boot auto-configuration for the Mixtape playlist reconciliation
 * library.
 *
 * <p>This configuration creates a singleton {@link Mixtape} instance over
 * the application's {@link CatalogClient} bean, wiring optional
 * {@link MixtapeMetrics} and {@link RetryPolicy} beans. Without a
 * {@link RetryPolicy} bean, the {@code mixtape.retry.*} properties are
 * used.
 *
 * <p>Playlists declared under {@code mixtape.playlists} are registered
 * first, then every {@link PlaylistRegistrar} bean is invoked.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(MixtapeProperties.class)
public class MixtapeAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MixtapeAutoConfiguration.class);

  /**
   * Creates the singleton {@link Mixtape} bean.
   *
   * @param properties            the configuration properties, never null
   * @param catalogClientProvider provider for the required CatalogClient
   * @param metricsProvider       provider for an optional MixtapeMetrics
   * @param retryPolicyProvider   provider for an optional RetryPolicy
   * @param registrars            the playlist registrars, may be empty
   *
   * @return the configured Mixtape instance, never null
   *
   * @throws IllegalStateException if there is no CatalogClient bean, or
   *                               more than one bean of a collaborator type
   */
  @Bean
  public Mixtape mixtape(
      final MixtapeProperties properties,
      final ObjectProvider<CatalogClient> catalogClientProvider,
      final ObjectProvider<MixtapeMetrics> metricsProvider,
      final ObjectProvider<RetryPolicy> retryPolicyProvider,
      final ObjectProvider<PlaylistRegistrar> registrars) {

    requireAtMostOne(catalogClientProvider, CatalogClient.class);
    requireAtMostOne(metricsProvider, MixtapeMetrics.class);
    requireAtMostOne(retryPolicyProvider, RetryPolicy.class);

    final CatalogClient catalogClient = catalogClientProvider.getIfAvailable();
    if (catalogClient == null) {
      throw new IllegalStateException(
          "Mixtape requires a CatalogClient bean, but none was found");
    }

    final Mixtape.Builder builder = Mixtape.builder()
        .catalogClient(catalogClient);
    log.info("Mixtape using CatalogClient: {}",
        catalogClient.getClass().getSimpleName());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Mixtape using custom MixtapeMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(
        () -> retryPolicyOf(properties.getRetry()));
    builder.retryPolicy(retryPolicy);
    log.info("Mixtape scope retry: {} attempt(s), {} backoff",
        retryPolicy.maxAttempts(), retryPolicy.backoff());

    final Mixtape mixtape = builder.build();

    for (final Map.Entry<String, MixtapeProperties.Playlist> entry
        : properties.getPlaylists().entrySet()) {
      mixtape.register(entry.getValue().toDefinition(entry.getKey()));
    }

    registrars.orderedStream().forEach(registrar -> {
      registrar.register(mixtape);
      log.debug("Invoked PlaylistRegistrar: {}",
          registrar.getClass().getSimpleName());
    });

    log.info("Mixtape created with {} playlist(s)",
        mixtape.definitions().size());

    return mixtape;
  }

  /**
   * Builds the retry policy from properties, keeping the library default
   * for any value left unset.
   *
   * @param retry the retry properties, never null
   *
   * @return the retry policy, never null
   */
  private static RetryPolicy retryPolicyOf(
      final MixtapeProperties.Retry retry) {
    final RetryPolicy defaults = RetryPolicy.defaultPolicy();
    if (!retry.isConfigured()) {
      return defaults;
    }
    return RetryPolicy.of(
        retry.getMaxAttempts() != null
            ? retry.getMaxAttempts() : defaults.maxAttempts(),
        retry.getBackoff() != null
            ? retry.getBackoff() : defaults.backoff());
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Mixtape requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
