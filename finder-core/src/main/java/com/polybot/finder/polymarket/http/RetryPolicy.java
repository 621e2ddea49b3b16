package com.polybot.finder.polymarket.http;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pure retry schedule for idempotent Gamma calls.
 * <p>
 * Attempts are numbered from 0. The delay after a failed attempt {@code n} is {@code initialBackoffMillis * 2^n},
 * capped at {@code maxBackoffMillis}. A numeric {@code Retry-After} replaces the exponential delay but is held to the
 * same cap.
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (initialBackoffMillis < 0 || maxBackoffMillis < 0) {
      throw new IllegalArgumentException("backoff must be >= 0");
    }
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, 0, 0);
  }

  private static Long parseRetryAfterSeconds(String raw) {
    if (raw == null) {
      return null;
    }
    String t = raw.trim();
    if (t.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(t);
    } catch (NumberFormatException ignored) {
      // HTTP-date form is not used by Gamma; fall back to the exponential schedule.
      return null;
    }
  }

  public boolean isRetryableStatus(int statusCode) {
    if (statusCode == 429 || statusCode == 408) {
      return true;
    }
    return statusCode >= 500 && statusCode <= 599;
  }

  /**
   * @param attempt index of the attempt that just failed
   * @param retryAfterHeader raw {@code Retry-After} value of the failed response, if any
   * @return the delay before the next attempt, or empty when the attempt budget is spent
   */
  public OptionalLong delayBeforeNextAttempt(int attempt, Optional<String> retryAfterHeader) {
    if (attempt + 1 >= maxAttempts) {
      return OptionalLong.empty();
    }
    if (retryAfterHeader != null && retryAfterHeader.isPresent()) {
      Long parsed = parseRetryAfterSeconds(retryAfterHeader.get());
      if (parsed != null && parsed > 0) {
        long millis = parsed > Long.MAX_VALUE / 1000L ? Long.MAX_VALUE : parsed * 1000L;
        return OptionalLong.of(Math.min(millis, Math.max(initialBackoffMillis, maxBackoffMillis)));
      }
    }
    return OptionalLong.of(backoffMillis(attempt));
  }

  public long backoffMillis(int attempt) {
    long base = Math.max(0, initialBackoffMillis);
    long max = Math.max(base, maxBackoffMillis);
    long delay = base;
    for (int i = 0; i < attempt && delay < max; i++) {
      delay = Math.min(max, delay * 2);
    }
    return delay;
  }
}
