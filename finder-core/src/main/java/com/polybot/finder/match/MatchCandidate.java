package com.polybot.finder.match;

import com.polybot.finder.catalog.MarketRecord;

import java.util.Objects;

public record MatchCandidate(MarketRecord market, double score) {

  public MatchCandidate {
    Objects.requireNonNull(market, "market");
    if (Double.isNaN(score) || score < 0.0 || score > 100.0) {
      throw new IllegalArgumentException("score must be within [0, 100]: " + score);
    }
  }
}
