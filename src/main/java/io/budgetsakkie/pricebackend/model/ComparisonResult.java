package io.budgetsakkie.pricebackend.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Merged answer for one query: one quote per registered retailer in registry order. {@code
 * cheapest} and {@code priceRange} are null when no retailer has the item.
 */
public record ComparisonResult(
    String item,
    List<PriceQuote> quotes,
    PriceQuote cheapest,
    BigDecimal savings,
    PriceRange priceRange,
    long generatedAt) {

  public ComparisonResult {
    quotes = quotes == null ? List.of() : List.copyOf(quotes);
  }

  public int availableCount() {
    return (int) quotes.stream().filter(PriceQuote::available).count();
  }
}
