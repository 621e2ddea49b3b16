package com.polybot.finder.polymarket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.finder.config.FinderProperties;
import com.polybot.finder.polymarket.gamma.PolymarketGammaClient;
import com.polybot.finder.polymarket.http.HttpRequestFactory;
import com.polybot.finder.polymarket.http.PolymarketHttpTransport;
import com.polybot.finder.polymarket.http.RetryPolicy;
import com.polybot.finder.polymarket.http.Sleeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class PolymarketConfiguration {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public HttpClient httpClient(FinderProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(Math.min(10, properties.polymarket().requestTimeoutSeconds())))
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public PolymarketHttpTransport polymarketHttpTransport(
      FinderProperties properties,
      HttpClient httpClient,
      ObjectProvider<ObjectMapper> objectMapper
  ) {
    RetryPolicy retry = buildRetryPolicy(properties.polymarket().retry());
    return new PolymarketHttpTransport(httpClient, objectMapper.getIfAvailable(ObjectMapper::new), retry, Sleeper.system());
  }

  @Bean
  public PolymarketGammaClient polymarketGammaClient(FinderProperties properties, PolymarketHttpTransport transport) {
    FinderProperties.Polymarket polymarket = properties.polymarket();
    HttpRequestFactory requestFactory = new HttpRequestFactory(
        URI.create(polymarket.gammaUrl()),
        polymarket.requestTimeout(),
        polymarket.userAgent()
    );
    return new PolymarketGammaClient(requestFactory, transport);
  }

  static RetryPolicy buildRetryPolicy(FinderProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.noRetry();
    }
    return new RetryPolicy(
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }
}
