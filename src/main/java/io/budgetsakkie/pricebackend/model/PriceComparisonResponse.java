package io.budgetsakkie.pricebackend.model;

import java.math.BigDecimal;
import java.util.List;

public record PriceComparisonResponse(
    String item,
    List<PriceQuote> quotes,
    PriceQuote cheapest,
    BigDecimal savings,
    PriceRange priceRange,
    long generatedAt,
    ComparisonMetadata metadata) {

  public static PriceComparisonResponse of(ComparisonResult result, ComparisonMetadata metadata) {
    return new PriceComparisonResponse(
        result.item(),
        result.quotes(),
        result.cheapest(),
        result.savings(),
        result.priceRange(),
        result.generatedAt(),
        metadata);
  }
}
