package io.budgetsakkie.pricebackend.retailer;

import java.util.Optional;

/**
 * One attempt at pricing an item at a single retailer. Returns empty when the retailer has no
 * matching product and throws {@link RetailerTransportException} when the attempt itself failed.
 */
@FunctionalInterface
public interface PriceLookup {

  Optional<ProductMatch> lookup(String normalizedItemName, String location);
}
