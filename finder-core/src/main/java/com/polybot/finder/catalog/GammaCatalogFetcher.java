package com.polybot.finder.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.finder.polymarket.gamma.PolymarketGammaClient;
import com.polybot.finder.polymarket.http.PolymarketDecodeException;
import com.polybot.finder.polymarket.http.PolymarketHttpException;
import com.polybot.finder.polymarket.http.PolymarketTransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads the open-market catalog from Gamma in one page.
 */
@Slf4j
public class GammaCatalogFetcher implements CatalogFetcher {

  private final PolymarketGammaClient gammaClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final int pageLimit;

  public GammaCatalogFetcher(PolymarketGammaClient gammaClient, ObjectMapper objectMapper, Clock clock, int pageLimit) {
    this.gammaClient = Objects.requireNonNull(gammaClient, "gammaClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (pageLimit < 1) {
      throw new IllegalArgumentException("pageLimit must be >= 1");
    }
    this.pageLimit = pageLimit;
  }

  @Override
  public CatalogSnapshot fetch() {
    JsonNode root = loadPayload();

    List<JsonNode> entries = MarketRecordParser.extractMarkets(root)
        .orElseThrow(() -> new MalformedResponseException(
            "Unexpected Gamma /markets payload: " + (root == null ? "null" : root.getNodeType())));

    List<MarketRecord> markets = new ArrayList<>(entries.size());
    int dropped = 0;
    for (JsonNode entry : entries) {
      Optional<MarketRecord> market;
      try {
        market = MarketRecordParser.parse(entry, objectMapper);
      } catch (RuntimeException e) {
        log.debug("Dropping unparseable Gamma entry id={}: {}", entry.path("id").asText(""), e.toString());
        market = Optional.empty();
      }
      if (market.isPresent()) {
        markets.add(market.get());
      } else {
        dropped++;
      }
    }
    if (dropped > 0) {
      log.debug("Dropped {} of {} Gamma entries", dropped, entries.size());
    }
    log.info("Fetched {} markets from Gamma", markets.size());
    return new CatalogSnapshot(markets, clock.instant());
  }

  private JsonNode loadPayload() {
    log.info("Fetching open markets from Gamma (limit={})", pageLimit);
    try {
      return gammaClient.openMarkets(pageLimit);
    } catch (PolymarketDecodeException e) {
      throw new MalformedResponseException("Gamma /markets returned a body that is not JSON", e);
    } catch (PolymarketHttpException e) {
      throw new RemoteUnavailableException("Gamma /markets answered HTTP " + e.statusCode(), e);
    } catch (PolymarketTransportException e) {
      throw new RemoteUnavailableException("Gamma /markets unreachable: " + e.getMessage(), e);
    }
  }
}
