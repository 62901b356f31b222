package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.util.ProductNames;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Prices an item from a retailer's static catalog. A query matches an entry when the normalized
 * query contains the entry key, or the key contains the query's first word; the first matching
 * entry wins.
 */
public class CatalogPriceLookup implements PriceLookup {
  private final RetailerCatalog catalog;
  private final PriceVariance variance;
  private final Duration minLatency;
  private final Duration maxLatency;

  public CatalogPriceLookup(RetailerCatalog catalog, PriceVariance variance) {
    this(catalog, variance, Duration.ZERO, Duration.ZERO);
  }

  public CatalogPriceLookup(
      RetailerCatalog catalog, PriceVariance variance, Duration minLatency, Duration maxLatency) {
    this.catalog = catalog;
    this.variance = variance;
    this.minLatency = minLatency == null ? Duration.ZERO : minLatency;
    this.maxLatency =
        maxLatency == null || maxLatency.compareTo(this.minLatency) < 0 ? this.minLatency : maxLatency;
  }

  @Override
  public Optional<ProductMatch> lookup(String normalizedItemName, String location) {
    simulateLatency();
    return match(normalizedItemName)
        .map(
            entry ->
                new ProductMatch(
                    entry.productName(),
                    variance.apply(entry.basePrice()),
                    catalog.productUrl(entry.productName())));
  }

  Optional<CatalogEntry> match(String itemName) {
    String query = ProductNames.normalize(itemName);
    // An empty first word would match every key.
    if (query.isEmpty()) return Optional.empty();
    String firstToken = ProductNames.firstToken(query);
    for (CatalogEntry entry : catalog.entries()) {
      if (query.contains(entry.key()) || entry.key().contains(firstToken)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  private void simulateLatency() {
    long min = minLatency.toMillis();
    long max = maxLatency.toMillis();
    if (max <= 0) return;
    long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
    try {
      Thread.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RetailerTransportException("interrupted while waiting for " + catalog.retailer().name(), e);
    }
  }
}
