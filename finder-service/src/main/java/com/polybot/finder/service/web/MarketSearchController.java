package com.polybot.finder.service.web;

import com.polybot.finder.catalog.CatalogCache;
import com.polybot.finder.catalog.CatalogException;
import com.polybot.finder.catalog.CatalogFailure;
import com.polybot.finder.catalog.CatalogSnapshot;
import com.polybot.finder.catalog.MarketRecord;
import com.polybot.finder.search.MarketSearchService;
import com.polybot.finder.search.SearchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/markets")
@RequiredArgsConstructor
@Slf4j
public class MarketSearchController {

  private static final int MAX_LISTED_QUESTIONS = 100;

  private final MarketSearchService searchService;
  private final CatalogCache catalogCache;

  @GetMapping("/search")
  public ResponseEntity<MarketSearchResponse> search(@RequestParam(name = "q", required = false) String q) {
    log.info("api /markets/search q='{}'", q);
    SearchOutcome outcome = searchService.search(q);
    return ResponseEntity.status(statusOf(outcome)).body(MarketSearchResponse.from(q, outcome));
  }

  @GetMapping("/catalog")
  public ResponseEntity<CatalogOverviewResponse> catalog(
      @RequestParam(name = "limit", defaultValue = "10") int limit,
      @RequestParam(name = "contains", required = false) String contains
  ) {
    log.info("api /markets/catalog limit={} contains='{}'", limit, contains);
    CatalogSnapshot snapshot = catalogCache.getCatalog();
    String needle = contains == null || contains.isBlank() ? null : contains.trim().toLowerCase(Locale.ROOT);
    List<String> matching = snapshot.markets().stream()
        .map(MarketRecord::question)
        .filter(q -> needle == null || q.toLowerCase(Locale.ROOT).contains(needle))
        .toList();
    int shown = Math.max(0, Math.min(limit, MAX_LISTED_QUESTIONS));
    return ResponseEntity.ok(new CatalogOverviewResponse(
        snapshot.size(),
        snapshot.capturedAt(),
        catalogCache.isFresh(),
        catalogCache.ttl().toSeconds(),
        needle,
        matching.size(),
        matching.subList(0, Math.min(shown, matching.size()))
    ));
  }

  @ExceptionHandler(CatalogException.class)
  public ResponseEntity<MarketSearchResponse> handleCatalogFailure(CatalogException e) {
    log.warn("catalog unavailable: failure={} {}", e.failure(), e.getMessage());
    return ResponseEntity.status(statusOf(e.failure()))
        .body(new MarketSearchResponse(e.failure().name().toLowerCase(Locale.ROOT), null, List.of(), e.getMessage()));
  }

  static HttpStatus statusOf(SearchOutcome outcome) {
    if (outcome instanceof SearchOutcome.Rejected) {
      return HttpStatus.BAD_REQUEST;
    }
    if (outcome instanceof SearchOutcome.Failed failed) {
      return statusOf(failed.failure());
    }
    return HttpStatus.OK;
  }

  private static HttpStatus statusOf(CatalogFailure failure) {
    return failure == CatalogFailure.MALFORMED_RESPONSE ? HttpStatus.BAD_GATEWAY : HttpStatus.SERVICE_UNAVAILABLE;
  }
}
