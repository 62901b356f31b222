package io.budgetsakkie.pricebackend.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class InMemoryResponseCacheStore implements ResponseCacheStore {
  private final TtlCache<CachedResponse> cache;

  public InMemoryResponseCacheStore(Duration ttl, Clock clock) {
    this.cache = new TtlCache<>(ttl, clock);
  }

  @Override
  public Optional<CacheEntry<CachedResponse>> get(String signature) {
    return cache.getEntry(signature);
  }

  @Override
  public void put(String signature, CachedResponse response) {
    cache.set(signature, response);
  }
}
