package com.polybot.finder.polymarket.http;

import java.net.URI;

/**
 * Non-2xx answer from a Polymarket endpoint.
 */
public final class PolymarketHttpException extends RuntimeException {

  private static final int SNIPPET_LIMIT = 500;

  private final int statusCode;

  public PolymarketHttpException(String method, URI uri, int statusCode, String responseBody) {
    super("HTTP " + statusCode + " from " + method + " " + uri + ": " + truncate(responseBody));
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }

  private static String truncate(String s) {
    if (s == null) {
      return "";
    }
    return s.length() <= SNIPPET_LIMIT ? s : s.substring(0, SNIPPET_LIMIT) + "...";
  }
}
