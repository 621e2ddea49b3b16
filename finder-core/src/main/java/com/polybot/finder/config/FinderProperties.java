package com.polybot.finder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "finder")
public record FinderProperties(
    @Valid Polymarket polymarket,
    @Valid Cache cache,
    @Valid Matching matching
) {

  public FinderProperties {
    if (polymarket == null) {
      polymarket = defaultPolymarket();
    }
    if (cache == null) {
      cache = defaultCache();
    }
    if (matching == null) {
      matching = defaultMatching();
    }
  }

  public static FinderProperties defaults() {
    return new FinderProperties(null, null, null);
  }

  private static Polymarket defaultPolymarket() {
    return new Polymarket(null, null, null, null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null);
  }

  private static Cache defaultCache() {
    return new Cache(null);
  }

  private static Matching defaultMatching() {
    return new Matching(null, null, null, null, null);
  }

  public record Polymarket(
      String gammaUrl,
      /**
       * Page size requested from Gamma {@code /markets}. Gamma caps the page on its side regardless.
       */
      @NotNull @Min(1) Integer pageLimit,
      String userAgent,
      @NotNull @Min(1) Integer requestTimeoutSeconds,
      @Valid Retry retry
  ) {
    public Polymarket {
      if (gammaUrl == null || gammaUrl.isBlank()) {
        gammaUrl = "https://gamma-api.polymarket.com";
      }
      if (pageLimit == null) {
        pageLimit = 500;
      }
      if (userAgent == null || userAgent.isBlank()) {
        userAgent = "polybot-market-finder/1.0";
      }
      if (requestTimeoutSeconds == null) {
        requestTimeoutSeconds = 30;
      }
      if (retry == null) {
        retry = defaultRetry();
      }
    }

    public Duration requestTimeout() {
      return Duration.ofSeconds(requestTimeoutSeconds);
    }
  }

  public record Retry(
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 1_000L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 60_000L;
      }
    }
  }

  public record Cache(@NotNull @Min(1) Long ttlSeconds) {
    public Cache {
      if (ttlSeconds == null) {
        ttlSeconds = 300L;
      }
    }

    public Duration ttl() {
      return Duration.ofSeconds(ttlSeconds);
    }
  }

  public record Matching(
      /**
       * Candidates scoring below this are never reported.
       */
      @NotNull @PositiveOrZero @DecimalMax("100.0") Double scoreCutoff,
      /**
       * A top score above this is trusted without disambiguation, unless a runner-up is within {@code ambiguityMargin}.
       */
      @NotNull @PositiveOrZero @DecimalMax("100.0") Double highConfidenceThreshold,
      @NotNull @PositiveOrZero Double ambiguityMargin,
      @NotNull @Min(1) Integer maxResults,
      @NotNull @Min(1) Integer minQueryLength
  ) {
    public Matching {
      if (scoreCutoff == null) {
        scoreCutoff = 60.0;
      }
      if (highConfidenceThreshold == null) {
        highConfidenceThreshold = 85.0;
      }
      if (ambiguityMargin == null) {
        ambiguityMargin = 1.0;
      }
      if (maxResults == null) {
        maxResults = 5;
      }
      if (minQueryLength == null) {
        minQueryLength = 3;
      }
    }
  }
}
