package com.polybot.finder.search;

import com.polybot.finder.catalog.CatalogCache;
import com.polybot.finder.catalog.CatalogFailure;
import com.polybot.finder.catalog.CatalogFetcher;
import com.polybot.finder.catalog.CatalogSnapshot;
import com.polybot.finder.catalog.MalformedResponseException;
import com.polybot.finder.catalog.RemoteUnavailableException;
import com.polybot.finder.classify.ClassifiedResult;
import com.polybot.finder.classify.ResultClassifier;
import com.polybot.finder.match.FuzzyMarketMatcher;
import com.polybot.finder.match.MatchCandidate;
import com.polybot.finder.metrics.FinderMetrics;
import com.polybot.finder.query.QueryNormalizer;
import com.polybot.finder.query.QueryValidationException;
import com.polybot.finder.testing.Markets;
import com.polybot.finder.testing.MutableClock;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MarketSearchServiceTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2025-10-01T00:00:00Z"));
  private final FinderMetrics metrics = new FinderMetrics(new SimpleMeterRegistry());
  private final AtomicInteger fetches = new AtomicInteger();

  @Test
  void invalidQueryNeverLoadsTheCatalog() {
    MarketSearchService service = service(() -> Markets.catalog("Bitcoin above 100k?"));

    SearchOutcome outcome = service.search("  ?! ");

    assertThat(outcome).isEqualTo(new SearchOutcome.Rejected(QueryValidationException.Reason.TOO_SHORT, "  ?! ", 3));
    assertThat(service.search(null)).isInstanceOfSatisfying(SearchOutcome.Rejected.class,
        rejected -> assertThat(rejected.reason()).isEqualTo(QueryValidationException.Reason.EMPTY));
    assertThat(fetches).hasValue(0);
    assertThat(metrics.counterValue(FinderMetrics.SEARCHES, Tag.of("outcome", "rejected"))).isEqualTo(2.0);
  }

  @Test
  void unreachableCatalogWithoutCacheFails() {
    MarketSearchService service = service(() -> {
      throw new RemoteUnavailableException("connection refused", null);
    });

    SearchOutcome outcome = service.search("bitcoin");

    assertThat(outcome).isInstanceOfSatisfying(SearchOutcome.Failed.class,
        failed -> assertThat(failed.failure()).isEqualTo(CatalogFailure.REMOTE_UNAVAILABLE));
    assertThat(metrics.counterValue(FinderMetrics.SEARCHES, Tag.of("outcome", "failed"))).isEqualTo(1.0);
  }

  @Test
  void malformedCatalogWithoutCacheFails() {
    MarketSearchService service = service(() -> {
      throw new MalformedResponseException("expected an array of markets");
    });

    assertThat(service.search("bitcoin")).isEqualTo(
        new SearchOutcome.Failed(CatalogFailure.MALFORMED_RESPONSE, "expected an array of markets"));
  }

  @Test
  void keywordsInAnyOrderResolveToOneMarket() {
    MarketSearchService service = service(() -> Markets.catalog(
        "Will the Fed cut rates in December?",
        "Will Trump end the Department of Education in 2025?",
        "Bitcoin above 100k on December 31?"));

    SearchOutcome outcome = service.search("Trump Department Education");

    assertThat(outcome).isInstanceOfSatisfying(SearchOutcome.Classified.class, classified ->
        assertThat(classified.result()).isInstanceOfSatisfying(ClassifiedResult.Single.class, single -> {
          assertThat(single.candidate().market().id()).isEqualTo("m2");
          assertThat(single.candidate().score()).isGreaterThanOrEqualTo(90.0);
        }));
    assertThat(metrics.counterValue(FinderMetrics.SEARCHES, Tag.of("outcome", "single"))).isEqualTo(1.0);
  }

  @Test
  void broadQueryListsTopCandidates() {
    MarketSearchService service = service(() -> Markets.catalog(
        "Government shutdown in October?",
        "Will the government shutdown end soon?",
        "Shutdown of federal agencies",
        "Another shutdown before Christmas?",
        "Senate vote to avoid shutdown",
        "Shutdown lasts longer than a month?"));

    SearchOutcome outcome = service.search("shutdown 2025");

    assertThat(outcome).isInstanceOfSatisfying(SearchOutcome.Classified.class, classified ->
        assertThat(classified.result()).isInstanceOfSatisfying(ClassifiedResult.Multiple.class, multiple -> {
          assertThat(multiple.candidates()).extracting(c -> c.market().id())
              .containsExactly("m1", "m2", "m3", "m4", "m5");
          assertThat(multiple.candidates()).extracting(MatchCandidate::score)
              .allSatisfy(score -> assertThat(score).isBetween(60.0, 80.0));
        }));
  }

  @Test
  void unrelatedQueryIsNoMatch() {
    MarketSearchService service = service(() -> Markets.catalog(
        "Will the Fed cut rates in December?",
        "Bitcoin above 100k on December 31?"));

    SearchOutcome outcome = service.search("alien invasion xyz123");

    assertThat(outcome).isEqualTo(new SearchOutcome.Classified(new ClassifiedResult.NoMatch("alien invasion xyz123")));
    assertThat(metrics.counterValue(FinderMetrics.SEARCHES, Tag.of("outcome", "nomatch"))).isEqualTo(1.0);
  }

  @Test
  void repeatedSearchesWithinTtlShareOneFetch() {
    MarketSearchService service = service(() -> Markets.catalog("Bitcoin above 100k on December 31?"));

    service.search("bitcoin 100k");
    clock.advance(Duration.ofSeconds(120));
    service.search("bitcoin december");

    assertThat(fetches).hasValue(1);
  }

  @Test
  void staleCatalogIsSearchedWhenRefreshFails() {
    AtomicInteger call = new AtomicInteger();
    MarketSearchService service = service(() -> {
      if (call.getAndIncrement() > 0) {
        throw new RemoteUnavailableException("HTTP 503", null);
      }
      return Markets.catalog("Bitcoin above 100k on December 31?");
    });

    service.search("bitcoin 100k");
    clock.advance(Duration.ofSeconds(301));
    SearchOutcome outcome = service.search("bitcoin 100k");

    assertThat(outcome).isInstanceOfSatisfying(SearchOutcome.Classified.class,
        classified -> assertThat(classified.result()).isInstanceOf(ClassifiedResult.Single.class));
    assertThat(fetches).hasValue(2);
  }

  private MarketSearchService service(CatalogFetcher delegate) {
    CatalogFetcher counting = () -> {
      fetches.incrementAndGet();
      CatalogSnapshot snapshot = delegate.fetch();
      return new CatalogSnapshot(snapshot.markets(), clock.instant());
    };
    CatalogCache cache = new CatalogCache(counting, Duration.ofSeconds(300), clock, Runnable::run, metrics);
    return new MarketSearchService(new QueryNormalizer(3), cache, new FuzzyMarketMatcher(60.0, 5),
        new ResultClassifier(60.0, 85.0, 1.0, 5), metrics);
  }
}
