package com.polybot.finder.service.web;

import com.polybot.finder.catalog.MarketRecord;
import com.polybot.finder.classify.ClassifiedResult;
import com.polybot.finder.match.MatchCandidate;
import com.polybot.finder.search.SearchOutcome;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * JSON view of a {@link SearchOutcome}. {@code outcome} is one of {@code single}, {@code multiple}, {@code no_match},
 * {@code rejected}, {@code remote_unavailable}, {@code malformed_response}.
 */
public record MarketSearchResponse(
    String outcome,
    String query,
    List<Candidate> candidates,
    String error
) {

  public static MarketSearchResponse from(String rawQuery, SearchOutcome searchOutcome) {
    if (searchOutcome instanceof SearchOutcome.Rejected rejected) {
      return new MarketSearchResponse("rejected", rawQuery, List.of(),
          rejected.reason().name().toLowerCase(Locale.ROOT) + " (min " + rejected.minLength() + ")");
    }
    if (searchOutcome instanceof SearchOutcome.Failed failed) {
      return new MarketSearchResponse(failed.failure().name().toLowerCase(Locale.ROOT), rawQuery, List.of(), failed.detail());
    }
    ClassifiedResult result = ((SearchOutcome.Classified) searchOutcome).result();
    if (result instanceof ClassifiedResult.Single single) {
      return new MarketSearchResponse("single", rawQuery, List.of(Candidate.of(single.candidate())), null);
    }
    if (result instanceof ClassifiedResult.Multiple multiple) {
      return new MarketSearchResponse("multiple", rawQuery, multiple.candidates().stream().map(Candidate::of).toList(), null);
    }
    return new MarketSearchResponse("no_match", rawQuery, List.of(), null);
  }

  public record Candidate(
      String id,
      String question,
      String slug,
      double score,
      double yesPrice,
      double noPrice,
      BigDecimal volume,
      Instant closesAt
  ) {
    static Candidate of(MatchCandidate candidate) {
      MarketRecord m = candidate.market();
      return new Candidate(
          m.id(),
          m.question(),
          m.slug(),
          Math.round(candidate.score() * 10.0) / 10.0,
          m.outcomePrices().first(),
          m.outcomePrices().second(),
          m.volume(),
          m.closesAt()
      );
    }
  }
}
