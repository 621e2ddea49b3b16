package com.polybot.finder.catalog;

import com.polybot.finder.metrics.FinderMetrics;
import io.micrometer.core.instrument.Tag;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Holds the latest catalog snapshot and refreshes it on expiry.
 * <p>
 * At most one refresh runs at a time; callers arriving while it runs wait for the same result. The refresh itself
 * runs on {@code refreshExecutor}, so a caller that stops waiting does not cancel it for the others.
 * When a refresh fails and an older snapshot exists, the older snapshot is served.
 */
@Slf4j
public class CatalogCache {

  private final CatalogFetcher fetcher;
  private final Duration ttl;
  private final Clock clock;
  private final Executor refreshExecutor;
  private final FinderMetrics metrics;

  private final Object lock = new Object();
  private volatile CatalogSnapshot current;
  private CompletableFuture<CatalogSnapshot> inFlight;

  public CatalogCache(CatalogFetcher fetcher, Duration ttl, Clock clock, Executor refreshExecutor, FinderMetrics metrics) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.refreshExecutor = Objects.requireNonNull(refreshExecutor, "refreshExecutor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be > 0");
    }
    metrics.registerIntGauge(FinderMetrics.CATALOG_SIZE, "Markets in the cached catalog", () -> {
      CatalogSnapshot snapshot = current;
      return snapshot == null ? 0 : snapshot.size();
    });
  }

  /**
   * @throws CatalogException when no snapshot exists yet and the refresh failed
   */
  public CatalogSnapshot getCatalog() {
    CatalogSnapshot snapshot = current;
    if (isFresh(snapshot)) {
      metrics.incrementCounter(FinderMetrics.CATALOG_CACHE, Tag.of("result", "hit"));
      return snapshot;
    }

    CompletableFuture<CatalogSnapshot> refresh;
    boolean leader = false;
    synchronized (lock) {
      snapshot = current;
      if (isFresh(snapshot)) {
        metrics.incrementCounter(FinderMetrics.CATALOG_CACHE, Tag.of("result", "hit"));
        return snapshot;
      }
      if (inFlight == null) {
        inFlight = new CompletableFuture<>();
        leader = true;
      }
      refresh = inFlight;
    }

    if (leader) {
      startRefresh(refresh);
    }
    return await(refresh);
  }

  /**
   * Current snapshot, fresh or not. Never touches the network.
   */
  public Optional<CatalogSnapshot> peek() {
    return Optional.ofNullable(current);
  }

  public boolean isFresh() {
    return isFresh(current);
  }

  public Duration ttl() {
    return ttl;
  }

  private boolean isFresh(CatalogSnapshot snapshot) {
    return snapshot != null && snapshot.isFreshAt(clock.instant(), ttl);
  }

  private void startRefresh(CompletableFuture<CatalogSnapshot> target) {
    try {
      refreshExecutor.execute(() -> runRefresh(target));
    } catch (RejectedExecutionException e) {
      synchronized (lock) {
        inFlight = null;
      }
      target.completeExceptionally(new RemoteUnavailableException("Catalog refresh could not be scheduled", e));
    }
  }

  private void runRefresh(CompletableFuture<CatalogSnapshot> target) {
    CatalogSnapshot previous = current;
    try {
      CatalogSnapshot fresh = fetcher.fetch();
      synchronized (lock) {
        current = fresh;
        inFlight = null;
      }
      metrics.incrementCounter(FinderMetrics.CATALOG_CACHE, Tag.of("result", "refresh"));
      log.info("Catalog refreshed: {} markets, ttl={}s", fresh.size(), ttl.toSeconds());
      target.complete(fresh);
    } catch (Throwable t) {
      synchronized (lock) {
        inFlight = null;
      }
      if (previous != null) {
        metrics.incrementCounter(FinderMetrics.CATALOG_CACHE, Tag.of("result", "stale"));
        log.warn("Catalog refresh failed, serving stale snapshot captured at {} ({} markets): {}",
            previous.capturedAt(), previous.size(), t.toString());
        target.complete(previous);
      } else {
        metrics.incrementCounter(FinderMetrics.CATALOG_CACHE, Tag.of("result", "failed"));
        log.error("Catalog refresh failed with no snapshot to fall back on: {}", t.toString());
        target.completeExceptionally(t instanceof CatalogException ? t
            : new RemoteUnavailableException("Catalog refresh failed: " + t, t));
      }
    } finally {
      // never leave waiters joined on a future nobody will complete
      synchronized (lock) {
        if (inFlight == target) {
          inFlight = null;
        }
      }
      if (!target.isDone()) {
        target.completeExceptionally(new RemoteUnavailableException("Catalog refresh aborted", null));
      }
    }
  }

  private static CatalogSnapshot await(CompletableFuture<CatalogSnapshot> refresh) {
    try {
      return refresh.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof CatalogException catalogException) {
        throw catalogException;
      }
      throw new RemoteUnavailableException("Catalog refresh failed: " + cause, cause);
    }
  }
}
