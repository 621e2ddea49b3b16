package com.polybot.finder.search;

import com.polybot.finder.catalog.CatalogFailure;
import com.polybot.finder.classify.ClassifiedResult;
import com.polybot.finder.query.QueryValidationException;

import java.util.Objects;

/**
 * Result of {@link MarketSearchService#search(String)}. Every failure the pipeline knows about ends up here
 * rather than as an exception.
 */
public sealed interface SearchOutcome {

  record Classified(ClassifiedResult result) implements SearchOutcome {
    public Classified {
      Objects.requireNonNull(result, "result");
    }
  }

  record Rejected(QueryValidationException.Reason reason, String rawQuery, int minLength) implements SearchOutcome {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }
  }

  record Failed(CatalogFailure failure, String detail) implements SearchOutcome {
    public Failed {
      Objects.requireNonNull(failure, "failure");
    }
  }
}
