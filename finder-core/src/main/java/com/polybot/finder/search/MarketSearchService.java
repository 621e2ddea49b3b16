package com.polybot.finder.search;

import com.polybot.finder.catalog.CatalogCache;
import com.polybot.finder.catalog.CatalogException;
import com.polybot.finder.catalog.CatalogSnapshot;
import com.polybot.finder.classify.ClassifiedResult;
import com.polybot.finder.classify.ResultClassifier;
import com.polybot.finder.match.FuzzyMarketMatcher;
import com.polybot.finder.match.MatchCandidate;
import com.polybot.finder.metrics.FinderMetrics;
import com.polybot.finder.query.NormalizedQuery;
import com.polybot.finder.query.QueryNormalizer;
import com.polybot.finder.query.QueryValidationException;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Entry point of the discovery pipeline: normalize, load catalog, match, classify.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketSearchService {

  private final QueryNormalizer normalizer;
  private final CatalogCache catalogCache;
  private final FuzzyMarketMatcher matcher;
  private final ResultClassifier classifier;
  private final FinderMetrics metrics;

  public SearchOutcome search(String rawQuery) {
    NormalizedQuery query;
    try {
      query = normalizer.normalize(rawQuery);
    } catch (QueryValidationException e) {
      log.info("search rejected reason={} raw='{}'", e.reason(), e.rawQuery());
      record("rejected");
      return new SearchOutcome.Rejected(e.reason(), e.rawQuery(), e.minLength());
    }

    CatalogSnapshot catalog;
    try {
      catalog = catalogCache.getCatalog();
    } catch (CatalogException e) {
      log.warn("search failed query='{}' failure={}: {}", query, e.failure(), e.getMessage());
      record("failed");
      return new SearchOutcome.Failed(e.failure(), e.getMessage());
    }

    List<MatchCandidate> candidates = matcher.match(query, catalog);
    ClassifiedResult result = classifier.classify(candidates, query);
    if (log.isInfoEnabled()) {
      log.info("search query='{}' markets={} candidates={} outcome={} topScore={}",
          query, catalog.size(), candidates.size(), result.getClass().getSimpleName(),
          candidates.isEmpty() ? "-" : String.format(Locale.ROOT, "%.1f", candidates.get(0).score()));
    }
    record(result.getClass().getSimpleName().toLowerCase(Locale.ROOT));
    return new SearchOutcome.Classified(result);
  }

  private void record(String outcome) {
    metrics.incrementCounter(FinderMetrics.SEARCHES, Tag.of("outcome", outcome));
  }
}
