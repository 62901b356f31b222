package io.budgetsakkie.pricebackend.cache;

import java.util.Optional;

/**
 * Backing store for whole HTTP responses keyed by request signature. Implementations return only
 * fresh entries and never throw.
 */
public interface ResponseCacheStore {

  Optional<CacheEntry<CachedResponse>> get(String signature);

  void put(String signature, CachedResponse response);
}
