package com.polybot.finder.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.finder.catalog.CatalogCache;
import com.polybot.finder.catalog.CatalogFetcher;
import com.polybot.finder.catalog.GammaCatalogFetcher;
import com.polybot.finder.classify.ResultClassifier;
import com.polybot.finder.match.FuzzyMarketMatcher;
import com.polybot.finder.metrics.FinderMetrics;
import com.polybot.finder.polymarket.config.PolymarketConfiguration;
import com.polybot.finder.polymarket.gamma.PolymarketGammaClient;
import com.polybot.finder.query.QueryNormalizer;
import com.polybot.finder.search.MarketSearchService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the discovery pipeline from {@link FinderProperties}.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(FinderProperties.class)
@Import(PolymarketConfiguration.class)
public class FinderConfiguration {

  @Bean
  public FinderMetrics finderMetrics(ObjectProvider<MeterRegistry> registry) {
    return new FinderMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  public CatalogFetcher catalogFetcher(
      FinderProperties properties,
      PolymarketGammaClient gammaClient,
      ObjectProvider<ObjectMapper> objectMapper,
      Clock clock
  ) {
    return new GammaCatalogFetcher(gammaClient, objectMapper.getIfAvailable(ObjectMapper::new), clock, properties.polymarket().pageLimit());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService catalogRefreshExecutor() {
    return Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "catalog-refresh");
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  public CatalogCache catalogCache(
      FinderProperties properties,
      CatalogFetcher catalogFetcher,
      Clock clock,
      ExecutorService catalogRefreshExecutor,
      FinderMetrics finderMetrics
  ) {
    return new CatalogCache(catalogFetcher, properties.cache().ttl(), clock, catalogRefreshExecutor, finderMetrics);
  }

  @Bean
  public QueryNormalizer queryNormalizer(FinderProperties properties) {
    return new QueryNormalizer(properties.matching().minQueryLength());
  }

  @Bean
  public FuzzyMarketMatcher fuzzyMarketMatcher(FinderProperties properties) {
    FinderProperties.Matching matching = properties.matching();
    return new FuzzyMarketMatcher(matching.scoreCutoff(), matching.maxResults());
  }

  @Bean
  public ResultClassifier resultClassifier(FinderProperties properties) {
    FinderProperties.Matching matching = properties.matching();
    return new ResultClassifier(
        matching.scoreCutoff(),
        matching.highConfidenceThreshold(),
        matching.ambiguityMargin(),
        matching.maxResults()
    );
  }

  @Bean
  public MarketSearchService marketSearchService(
      QueryNormalizer queryNormalizer,
      CatalogCache catalogCache,
      FuzzyMarketMatcher fuzzyMarketMatcher,
      ResultClassifier resultClassifier,
      FinderMetrics finderMetrics
  ) {
    return new MarketSearchService(queryNormalizer, catalogCache, fuzzyMarketMatcher, resultClassifier, finderMetrics);
  }
}
