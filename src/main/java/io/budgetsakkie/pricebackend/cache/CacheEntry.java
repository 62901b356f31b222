package io.budgetsakkie.pricebackend.cache;

public record CacheEntry<T>(T value, long storedAt) {

  public long ageMillis(long now) {
    return Math.max(0, now - storedAt);
  }
}
