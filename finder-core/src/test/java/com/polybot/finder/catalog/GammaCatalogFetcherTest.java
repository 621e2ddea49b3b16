package com.polybot.finder.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.finder.polymarket.gamma.PolymarketGammaClient;
import com.polybot.finder.polymarket.http.HttpRequestFactory;
import com.polybot.finder.polymarket.http.PolymarketHttpTransport;
import com.polybot.finder.polymarket.http.RetryPolicy;
import com.polybot.finder.testing.MutableClock;
import com.polybot.finder.testing.StubGammaServer;
import com.polybot.finder.testing.StubGammaServer.Reply;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GammaCatalogFetcherTest {

  private static final Instant NOW = Instant.parse("2025-10-01T12:00:00Z");

  private StubGammaServer server;
  private GammaCatalogFetcher fetcher;

  @BeforeEach
  void setUp() throws Exception {
    server = new StubGammaServer();
    ObjectMapper objectMapper = new ObjectMapper();
    PolymarketHttpTransport transport = new PolymarketHttpTransport(
        HttpClient.newHttpClient(), objectMapper, new RetryPolicy(3, 1_000, 60_000), millis -> {
    });
    PolymarketGammaClient client = new PolymarketGammaClient(
        new HttpRequestFactory(server.baseUri(), Duration.ofSeconds(5), "finder-test"), transport);
    fetcher = new GammaCatalogFetcher(client, objectMapper, new MutableClock(NOW), 500);
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void requestsOpenMarketsInOnePage() {
    server.enqueue(Reply.ok("[]"));

    fetcher.fetch();

    assertThat(server.requests()).singleElement().satisfies(uri -> {
      assertThat(uri.getPath()).isEqualTo("/markets");
      assertThat(uri.getQuery()).isEqualTo("closed=false&limit=500");
    });
  }

  @Test
  void buildsSnapshotInCatalogOrder() {
    server.enqueue(Reply.ok("""
        [
          {"id": "1", "question": "Bitcoin above 200k in 2027?", "outcomePrices": "[\\"0.2\\", \\"0.8\\"]"},
          {"id": "2", "slug": "no-question"},
          {"id": "3", "question": "Government shutdown in 2025?", "volume": 50}
        ]
        """));

    CatalogSnapshot snapshot = fetcher.fetch();

    assertThat(snapshot.capturedAt()).isEqualTo(NOW);
    assertThat(snapshot.markets()).extracting(MarketRecord::id).containsExactly("1", "3");
  }

  @Test
  void oneUnrepresentableNumberDoesNotSinkTheBatch() {
    server.enqueue(Reply.ok("""
        [
          {"id": "1", "question": "Good market"},
          {"id": "2", "question": "Bad volume", "volume": 1e400},
          {"id": "3", "question": "Bad price", "outcomePrices": [1e400, 0.5]}
        ]
        """));

    CatalogSnapshot snapshot = fetcher.fetch();

    assertThat(snapshot.markets()).extracting(MarketRecord::id).containsExactly("1", "2", "3");
    assertThat(snapshot.markets().get(1).volume()).isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void acceptsDataEnvelope() {
    server.enqueue(Reply.ok("{\"data\": [{\"question\": \"Ukraine joins NATO?\"}]}"));

    assertThat(fetcher.fetch().size()).isEqualTo(1);
  }

  @Test
  void unexpectedShapeIsMalformed() {
    server.enqueue(Reply.ok("{\"error\": \"rate limited\"}"));

    assertThatThrownBy(() -> fetcher.fetch())
        .isInstanceOfSatisfying(MalformedResponseException.class,
            e -> assertThat(e.failure()).isEqualTo(CatalogFailure.MALFORMED_RESPONSE));
    assertThat(server.hits()).isEqualTo(1);
  }

  @Test
  void nonJsonBodyIsMalformed() {
    server.enqueue(Reply.ok("<html></html>"));

    assertThatThrownBy(() -> fetcher.fetch()).isInstanceOf(MalformedResponseException.class);
  }

  @Test
  void exhaustedRetriesAreRemoteUnavailable() {
    server.enqueue(Reply.status(503));

    assertThatThrownBy(() -> fetcher.fetch())
        .isInstanceOfSatisfying(RemoteUnavailableException.class,
            e -> assertThat(e.failure()).isEqualTo(CatalogFailure.REMOTE_UNAVAILABLE));
    assertThat(server.hits()).isEqualTo(3);
  }
}
