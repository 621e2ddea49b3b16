package com.polybot.finder.classify;

import com.polybot.finder.match.MatchCandidate;

import java.util.List;
import java.util.Objects;

/**
 * What a search found, before any presentation.
 */
public sealed interface ClassifiedResult {

  /**
   * One market is trusted as the answer.
   */
  record Single(MatchCandidate candidate) implements ClassifiedResult {
    public Single {
      Objects.requireNonNull(candidate, "candidate");
    }
  }

  /**
   * Several plausible markets, best first, for the user to pick from.
   */
  record Multiple(List<MatchCandidate> candidates) implements ClassifiedResult {
    public Multiple {
      candidates = List.copyOf(candidates);
      if (candidates.size() < 2) {
        throw new IllegalArgumentException("Multiple needs at least two candidates");
      }
    }
  }

  record NoMatch(String query) implements ClassifiedResult {
    public NoMatch {
      Objects.requireNonNull(query, "query");
    }
  }
}
