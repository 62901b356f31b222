package io.budgetsakkie.pricebackend.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key/value cache whose entries are fresh while {@code now - storedAt < ttl}.
 *
 * <p>Stale entries are not purged; a read treats them as absent and the next {@link #set}
 * replaces them. There is no bound on the number of keys. Concurrent writers to one key resolve
 * as last writer wins.
 */
public class TtlCache<V> {
  private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public TtlCache(Duration ttl, Clock clock) {
    if (ttl == null || ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    this.ttl = ttl;
    this.clock = clock;
  }

  public Optional<V> get(String key) {
    return getEntry(key).map(CacheEntry::value);
  }

  public Optional<CacheEntry<V>> getEntry(String key) {
    if (key == null) return Optional.empty();
    CacheEntry<V> entry = entries.get(key);
    if (entry == null || !isFresh(entry)) return Optional.empty();
    return Optional.of(entry);
  }

  public CacheEntry<V> set(String key, V value) {
    CacheEntry<V> entry = new CacheEntry<>(value, clock.millis());
    entries.put(key, entry);
    return entry;
  }

  public boolean isFresh(CacheEntry<V> entry) {
    return clock.millis() - entry.storedAt() < ttl.toMillis();
  }

  /** Number of stored keys, stale ones included. */
  public int size() {
    return entries.size();
  }
}
