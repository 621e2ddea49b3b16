package com.polybot.finder.catalog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * One Gamma market, frozen at fetch time. Missing wire fields are already defaulted here.
 */
public record MarketRecord(
    String id,
    String question,
    String slug,
    OutcomePrices outcomePrices,
    BigDecimal volume,
    Instant closesAt,
    String description,
    boolean closed
) {

  public MarketRecord {
    id = id == null ? "" : id;
    question = question == null ? "" : question;
    slug = slug == null ? "" : slug;
    outcomePrices = outcomePrices == null ? OutcomePrices.UNKNOWN : outcomePrices;
    volume = volume == null || volume.signum() < 0 ? BigDecimal.ZERO : volume;
    description = description == null ? "" : description;
  }

  /**
   * Close time, absent when Gamma did not report a parsable one.
   */
  public Optional<Instant> closeTime() {
    return Optional.ofNullable(closesAt);
  }

  /**
   * Ordered outcome probabilities, usually YES then NO.
   */
  public record OutcomePrices(double first, double second) {

    public static final OutcomePrices UNKNOWN = new OutcomePrices(0.0, 0.0);

    public OutcomePrices {
      first = clamp(first);
      second = clamp(second);
    }

    private static double clamp(double p) {
      if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
        return 0.0;
      }
      return p;
    }
  }
}
