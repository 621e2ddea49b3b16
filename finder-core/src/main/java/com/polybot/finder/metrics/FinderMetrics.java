package com.polybot.finder.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Thin helper over the Micrometer registry used by the discovery pipeline.
 */
@RequiredArgsConstructor
@Slf4j
public class FinderMetrics {

  public static final String CATALOG_CACHE = "finder_catalog_cache_total";
  public static final String SEARCHES = "finder_searches_total";
  public static final String CATALOG_SIZE = "finder_catalog_size";

  private final MeterRegistry registry;

  /**
   * Increment a counter by name (creates if doesn't exist).
   */
  public void incrementCounter(String name, Tag... tags) {
    Counter.builder(name)
        .tags(List.of(tags))
        .register(registry)
        .increment();
  }

  public void registerIntGauge(String name, String description, Supplier<Integer> valueSupplier, Tag... tags) {
    Gauge.builder(name, valueSupplier, supplier -> {
          Integer value = supplier.get();
          return value != null ? value.doubleValue() : 0.0;
        })
        .description(description)
        .tags(List.of(tags))
        .register(registry);
    log.debug("Registered gauge: {} with description: {}", name, description);
  }

  public double counterValue(String name, Tag... tags) {
    Counter counter = registry.find(name).tags(List.of(tags)).counter();
    return counter == null ? 0.0 : counter.count();
  }
}
