package com.polybot.finder.classify;

import com.polybot.finder.match.MatchCandidate;
import com.polybot.finder.query.NormalizedQuery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a ranked candidate list into a single answer, a short list, or nothing.
 * <p>
 * A top score above {@code highConfidenceThreshold} is trusted unless the runner-up is within
 * {@code ambiguityMargin} of it; a cluster of medium scores is returned as a list instead of guessed at.
 */
public final class ResultClassifier {

  private final double scoreCutoff;
  private final double highConfidenceThreshold;
  private final double ambiguityMargin;
  private final int maxResults;

  public ResultClassifier(double scoreCutoff, double highConfidenceThreshold, double ambiguityMargin, int maxResults) {
    if (ambiguityMargin < 0.0) {
      throw new IllegalArgumentException("ambiguityMargin must be >= 0");
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be >= 1");
    }
    this.scoreCutoff = scoreCutoff;
    this.highConfidenceThreshold = highConfidenceThreshold;
    this.ambiguityMargin = ambiguityMargin;
    this.maxResults = maxResults;
  }

  public ClassifiedResult classify(List<MatchCandidate> candidates, NormalizedQuery query) {
    List<MatchCandidate> ranked = new ArrayList<>();
    for (MatchCandidate candidate : candidates) {
      if (candidate.score() >= scoreCutoff) {
        ranked.add(candidate);
      }
    }
    ranked.sort(Comparator.comparingDouble(MatchCandidate::score).reversed());
    if (ranked.size() > maxResults) {
      ranked = ranked.subList(0, maxResults);
    }

    if (ranked.isEmpty()) {
      return new ClassifiedResult.NoMatch(query.text());
    }
    MatchCandidate top = ranked.get(0);
    if (ranked.size() == 1) {
      return new ClassifiedResult.Single(top);
    }
    double runnerUp = ranked.get(1).score();
    if (top.score() > highConfidenceThreshold && top.score() - runnerUp > ambiguityMargin) {
      return new ClassifiedResult.Single(top);
    }
    return new ClassifiedResult.Multiple(ranked);
  }
}
