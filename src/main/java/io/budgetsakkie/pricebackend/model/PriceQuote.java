package io.budgetsakkie.pricebackend.model;

import java.math.BigDecimal;

/**
 * One retailer's answer for one query. {@code price}, {@code productName} and {@code productUrl}
 * are set only when {@code available}; {@code error} is set only when not.
 */
public record PriceQuote(
    String retailerId,
    String retailerName,
    String logo,
    String color,
    boolean available,
    BigDecimal price,
    String currency,
    String productName,
    String productUrl,
    String error,
    long lastUpdated) {

  public static PriceQuote found(
      RetailerInfo retailer,
      BigDecimal price,
      String currency,
      String productName,
      String productUrl,
      long now) {
    return new PriceQuote(
        retailer.id(),
        retailer.name(),
        retailer.logo(),
        retailer.color(),
        true,
        price,
        currency,
        productName,
        productUrl,
        null,
        now);
  }

  public static PriceQuote failed(
      RetailerInfo retailer, String currency, String error, long now) {
    return new PriceQuote(
        retailer.id(),
        retailer.name(),
        retailer.logo(),
        retailer.color(),
        false,
        null,
        currency,
        null,
        null,
        error,
        now);
  }
}
