package com.polybot.finder.catalog;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The whole catalog as returned by one successful fetch.
 */
public record CatalogSnapshot(List<MarketRecord> markets, Instant capturedAt) {

  public CatalogSnapshot {
    markets = List.copyOf(Objects.requireNonNull(markets, "markets"));
    Objects.requireNonNull(capturedAt, "capturedAt");
  }

  public int size() {
    return markets.size();
  }

  public Duration ageAt(Instant now) {
    return Duration.between(capturedAt, now);
  }

  public boolean isFreshAt(Instant now, Duration ttl) {
    return ageAt(now).compareTo(ttl) < 0;
  }
}
