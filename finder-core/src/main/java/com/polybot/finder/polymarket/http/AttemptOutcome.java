package com.polybot.finder.polymarket.http;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Optional;

/**
 * Classification of a single HTTP attempt, consumed by {@link PolymarketHttpTransport}'s retry loop.
 */
public sealed interface AttemptOutcome {

  static AttemptOutcome ofResponse(HttpRequest request, HttpResponse<String> response, RetryPolicy retryPolicy) {
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return new Success(response.body() == null ? "" : response.body());
    }
    PolymarketHttpException error = new PolymarketHttpException(request.method(), request.uri(), status, response.body());
    if (retryPolicy.isRetryableStatus(status)) {
      return new RetryableFailure(error, response.headers().firstValue("retry-after"));
    }
    return new TerminalFailure(error);
  }

  static AttemptOutcome ofIoFailure(HttpRequest request, IOException e) {
    String kind = e instanceof HttpTimeoutException ? "timed out" : "failed";
    return new RetryableFailure(
        new PolymarketTransportException("HTTP " + request.method() + " " + request.uri() + " " + kind, e),
        Optional.empty()
    );
  }

  record Success(String body) implements AttemptOutcome {
  }

  record RetryableFailure(RuntimeException error, Optional<String> retryAfter) implements AttemptOutcome {
  }

  record TerminalFailure(RuntimeException error) implements AttemptOutcome {
  }
}
