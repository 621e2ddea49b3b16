package com.polybot.finder.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.polybot.finder.polymarket.http.HttpRequestFactory;
import com.polybot.finder.polymarket.http.PolymarketHttpTransport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class PolymarketGammaClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;

  public PolymarketGammaClient(HttpRequestFactory requestFactory, PolymarketHttpTransport transport) {
    this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * Lists markets that are not closed, asking for up to {@code limit} rows in a single page.
   */
  public JsonNode openMarkets(int limit) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("closed", "false");
    query.put("limit", String.valueOf(limit));
    return markets(query);
  }

  public JsonNode markets(Map<String, String> query) {
    return transport.sendJson(requestFactory.get(PolymarketGammaPaths.MARKETS, query), JsonNode.class);
  }
}
