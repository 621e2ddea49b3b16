package com.polybot.finder.match;

import com.polybot.finder.catalog.CatalogSnapshot;
import com.polybot.finder.catalog.MarketRecord;
import com.polybot.finder.query.NormalizedQuery;
import com.polybot.finder.query.QueryNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores every catalog question against a query with {@link TokenSetSimilarity}.
 * A linear scan is enough for a catalog of a few hundred markets.
 */
public final class FuzzyMarketMatcher {

  static final Comparator<MatchCandidate> BY_SCORE_DESC = Comparator.comparingDouble(MatchCandidate::score).reversed();

  private final double scoreCutoff;
  private final int maxResults;

  public FuzzyMarketMatcher(double scoreCutoff, int maxResults) {
    if (scoreCutoff < 0.0 || scoreCutoff > 100.0) {
      throw new IllegalArgumentException("scoreCutoff must be within [0, 100]");
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be >= 1");
    }
    this.scoreCutoff = scoreCutoff;
    this.maxResults = maxResults;
  }

  /**
   * @return candidates at or above the cutoff, best first, ties in catalog order, at most {@code maxResults}
   */
  public List<MatchCandidate> match(NormalizedQuery query, CatalogSnapshot catalog) {
    List<MatchCandidate> scored = new ArrayList<>();
    for (MarketRecord market : catalog.markets()) {
      double score = TokenSetSimilarity.score(query.text(), QueryNormalizer.canonicalize(market.question()));
      if (score >= scoreCutoff) {
        scored.add(new MatchCandidate(market, score));
      }
    }
    // List.sort is stable, which keeps catalog order among equal scores.
    scored.sort(BY_SCORE_DESC);
    return scored.size() <= maxResults ? List.copyOf(scored) : List.copyOf(scored.subList(0, maxResults));
  }

  public double scoreCutoff() {
    return scoreCutoff;
  }

  public int maxResults() {
    return maxResults;
  }
}
