package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.budgetsakkie.pricebackend.model.RetailerInfo;
import reactor.core.publisher.Mono;

/**
 * Produces one retailer's quote for a normalized item name.
 *
 * <p>The returned {@link Mono} never errors: timeouts, transport failures and catalog misses all
 * arrive as a quote with {@code available=false} and an error reason.
 */
public interface RetailerAdapter {

  RetailerInfo info();

  /**
   * @param normalizedItemName item name as produced by {@code ProductNames.normalize}
   * @param location optional location hint, may be null
   */
  Mono<PriceQuote> fetchQuote(String normalizedItemName, String location);
}
