package com.polybot.finder.polymarket.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Sends idempotent requests, retrying per {@link RetryPolicy}.
 * <p>
 * Every attempt is classified into an {@link AttemptOutcome}; the loop only decides whether and how long to wait.
 */
@Slf4j
public final class PolymarketHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public PolymarketHttpTransport(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RetryPolicy retryPolicy,
      Sleeper sleeper
  ) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    String body = sendString(request);
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new PolymarketDecodeException(request.uri(), e);
    }
  }

  public String sendString(HttpRequest request) {
    for (int attempt = 0; ; attempt++) {
      AttemptOutcome outcome = attempt(request);
      if (outcome instanceof AttemptOutcome.Success success) {
        return success.body();
      }
      if (outcome instanceof AttemptOutcome.TerminalFailure terminal) {
        throw terminal.error();
      }

      AttemptOutcome.RetryableFailure retryable = (AttemptOutcome.RetryableFailure) outcome;
      OptionalLong delay = retryPolicy.delayBeforeNextAttempt(attempt, retryable.retryAfter());
      if (delay.isEmpty()) {
        log.warn("giving up after {} attempt(s) uri={}: {}", attempt + 1, request.uri(), retryable.error().getMessage());
        throw retryable.error();
      }
      log.warn("attempt {}/{} failed uri={}, retrying in {}ms: {}",
          attempt + 1, retryPolicy.maxAttempts(), request.uri(), delay.getAsLong(), retryable.error().getMessage());
      pause(request, delay.getAsLong());
    }
  }

  private AttemptOutcome attempt(HttpRequest request) {
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return AttemptOutcome.ofResponse(request, response, retryPolicy);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketTransportException("HTTP request interrupted: " + request.uri(), e);
    } catch (IOException e) {
      return AttemptOutcome.ofIoFailure(request, e);
    }
  }

  private void pause(HttpRequest request, long delayMillis) {
    if (delayMillis <= 0) {
      return;
    }
    try {
      sleeper.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketTransportException("Retry backoff interrupted: " + request.uri(), e);
    }
  }
}
