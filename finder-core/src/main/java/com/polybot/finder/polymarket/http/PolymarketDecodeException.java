package com.polybot.finder.polymarket.http;

import java.net.URI;

/**
 * A 2xx response whose body is not valid JSON.
 */
public final class PolymarketDecodeException extends RuntimeException {

  public PolymarketDecodeException(URI uri, Throwable cause) {
    super("Failed to decode JSON response from " + uri, cause);
  }
}
