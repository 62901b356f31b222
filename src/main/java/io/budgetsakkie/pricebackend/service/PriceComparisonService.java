package io.budgetsakkie.pricebackend.service;

import io.budgetsakkie.pricebackend.cache.TtlCache;
import io.budgetsakkie.pricebackend.model.ComparisonResult;
import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.budgetsakkie.pricebackend.model.PriceRange;
import io.budgetsakkie.pricebackend.retailer.RetailerAdapter;
import io.budgetsakkie.pricebackend.retailer.RetailerRegistry;
import io.budgetsakkie.pricebackend.util.Prices;
import io.budgetsakkie.pricebackend.util.ProductNames;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Compares one item across every registered retailer.
 *
 * <p>On a cache miss all adapters are called at once and the comparison waits for every one of
 * them; quotes come back in registry order whatever order the calls complete in. A fresh cached
 * result is returned as is.
 */
@Service
public class PriceComparisonService {
  private static final Logger log = LoggerFactory.getLogger(PriceComparisonService.class);

  static final String DEFAULT_LOCATION = "default";

  private final RetailerRegistry registry;
  private final TtlCache<ComparisonResult> cache;
  private final ComparisonMetrics metrics;
  private final Clock clock;
  private final String currency;

  public PriceComparisonService(
      RetailerRegistry registry,
      TtlCache<ComparisonResult> comparisonResultCache,
      ComparisonMetrics metrics,
      Clock clock,
      @Value("${app.retailers.currency:ZAR}") String currency) {
    this.registry = registry;
    this.cache = comparisonResultCache;
    this.metrics = metrics;
    this.clock = clock;
    this.currency = currency;
  }

  public ComparisonResult compare(String item, String location) {
    String normalizedItem = ProductNames.normalize(item);
    String normalizedLocation = ProductNames.normalizeLocation(location);
    String cacheKey = cacheKey(normalizedItem, normalizedLocation);

    Optional<ComparisonResult> cached = cache.get(cacheKey);
    if (cached.isPresent()) {
      metrics.resultCache(true);
      log.debug("returning cached comparison: key={}", cacheKey);
      return cached.get();
    }
    metrics.resultCache(false);

    log.info(
        "fetching fresh prices: item={} location={} retailers={}",
        normalizedItem,
        normalizedLocation == null ? DEFAULT_LOCATION : normalizedLocation,
        registry.size());
    List<PriceQuote> quotes = fetchAll(normalizedItem, normalizedLocation);
    ComparisonResult result = rank(normalizedItem, quotes, clock.millis());
    cache.set(cacheKey, result);

    log.info(
        "comparison ready: item={} available={}/{} cheapest={}",
        normalizedItem,
        result.availableCount(),
        quotes.size(),
        result.cheapest() == null ? "none" : result.cheapest().retailerId());
    return result;
  }

  public static String cacheKey(String normalizedItem, String normalizedLocation) {
    return normalizedItem + "-" + (normalizedLocation == null ? DEFAULT_LOCATION : normalizedLocation);
  }

  private List<PriceQuote> fetchAll(String item, String location) {
    List<RetailerAdapter> adapters = registry.adapters();
    // Callers block below, so adapter work must stay off their pool.
    Scheduler scheduler = registry.scheduler();
    List<Mono<PriceQuote>> calls = new ArrayList<>(adapters.size());
    for (RetailerAdapter adapter : adapters) {
      calls.add(
          Mono.defer(() -> adapter.fetchQuote(item, location))
              .subscribeOn(scheduler)
              .onErrorResume(
                  e -> {
                    // Adapters are expected to degrade on their own; keep the slot filled anyway.
                    log.error("{} raised instead of degrading", adapter.info().name(), e);
                    return Mono.just(failedQuote(adapter, e.getMessage()));
                  })
              .defaultIfEmpty(failedQuote(adapter, "No response"))
              .doOnNext(metrics::quote));
    }

    // zip keeps each result at its source index, which is registry order.
    List<PriceQuote> quotes =
        Mono.zip(
                calls,
                results -> {
                  List<PriceQuote> out = new ArrayList<>(results.length);
                  for (Object r : results) out.add((PriceQuote) r);
                  return out;
                })
            .block();
    return quotes == null ? List.of() : quotes;
  }

  private PriceQuote failedQuote(RetailerAdapter adapter, String reason) {
    return PriceQuote.failed(
        adapter.info(), currency, reason == null ? "Unknown error" : reason, clock.millis());
  }

  /**
   * Picks the cheapest available quote (first in order on ties) and the price spread across
   * available quotes.
   */
  static ComparisonResult rank(String item, List<PriceQuote> quotes, long generatedAt) {
    PriceQuote cheapest = null;
    BigDecimal max = null;
    for (PriceQuote q : quotes) {
      if (!q.available() || q.price() == null) continue;
      if (cheapest == null || q.price().compareTo(cheapest.price()) < 0) cheapest = q;
      if (max == null || q.price().compareTo(max) > 0) max = q.price();
    }

    if (cheapest == null) {
      return new ComparisonResult(item, quotes, null, Prices.ZERO, null, generatedAt);
    }
    BigDecimal min = cheapest.price();
    return new ComparisonResult(
        item,
        quotes,
        cheapest,
        Prices.round2(max.subtract(min)),
        new PriceRange(min, max),
        generatedAt);
  }
}
