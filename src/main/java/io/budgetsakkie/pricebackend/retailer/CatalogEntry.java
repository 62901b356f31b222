package io.budgetsakkie.pricebackend.retailer;

import java.math.BigDecimal;

/** A catalog row: the match key, the product it resolves to and its base price. */
public record CatalogEntry(String key, String productName, BigDecimal basePrice) {

  public static CatalogEntry of(String key, String productName, String basePrice) {
    return new CatalogEntry(key, productName, new BigDecimal(basePrice));
  }
}
