package io.budgetsakkie.pricebackend.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Response store shared across instances through Redis. Redis errors are logged and read as a
 * miss so a cache outage never fails the request.
 */
public class RedisResponseCacheStore implements ResponseCacheStore {
  private static final Logger log = LoggerFactory.getLogger(RedisResponseCacheStore.class);

  static final String KEY_PREFIX = "resp:cache:";

  public record StoredResponse(String contentType, byte[] body, long storedAt) {}

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final Duration ttl;
  private final Clock clock;

  public RedisResponseCacheStore(
      StringRedisTemplate redis, ObjectMapper mapper, Duration ttl, Clock clock) {
    this.redis = redis;
    this.mapper = mapper;
    this.ttl = ttl;
    this.clock = clock;
  }

  @Override
  public Optional<CacheEntry<CachedResponse>> get(String signature) {
    if (signature == null) return Optional.empty();
    String key = key(signature);
    try {
      String v = redis.opsForValue().get(key);
      if (v == null) return Optional.empty();
      StoredResponse stored = mapper.readValue(v, StoredResponse.class);
      if (clock.millis() - stored.storedAt() >= ttl.toMillis()) return Optional.empty();
      return Optional.of(
          new CacheEntry<>(
              new CachedResponse(stored.contentType(), stored.body()), stored.storedAt()));
    } catch (Exception e) {
      log.warn("response cache read failed: key={}", key, e);
      return Optional.empty();
    }
  }

  @Override
  public void put(String signature, CachedResponse response) {
    if (signature == null || response == null) return;
    String key = key(signature);
    try {
      StoredResponse stored =
          new StoredResponse(response.contentType(), response.body(), clock.millis());
      redis
          .opsForValue()
          .set(key, mapper.writeValueAsString(stored), Duration.ofSeconds(Math.max(1, ttl.toSeconds())));
    } catch (Exception e) {
      log.warn("response cache write failed: key={}", key, e);
    }
  }

  static String key(String signature) {
    return KEY_PREFIX + sha1(signature);
  }

  private static String sha1(String input) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-1");
      byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder();
      for (byte b : digest) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (Exception e) {
      return Integer.toHexString(input.hashCode());
    }
  }
}
