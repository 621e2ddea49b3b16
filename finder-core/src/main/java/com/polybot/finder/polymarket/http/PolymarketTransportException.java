package com.polybot.finder.polymarket.http;

/**
 * The request never produced an HTTP response (connect failure, timeout, interruption).
 */
public final class PolymarketTransportException extends RuntimeException {

  public PolymarketTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
