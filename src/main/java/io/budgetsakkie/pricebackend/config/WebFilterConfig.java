package io.budgetsakkie.pricebackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.budgetsakkie.pricebackend.cache.InMemoryResponseCacheStore;
import io.budgetsakkie.pricebackend.cache.RedisResponseCacheStore;
import io.budgetsakkie.pricebackend.cache.ResponseCacheStore;
import io.budgetsakkie.pricebackend.service.ComparisonMetrics;
import io.budgetsakkie.pricebackend.web.RateLimitWebFilter;
import io.budgetsakkie.pricebackend.web.ResponseCacheWebFilter;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class WebFilterConfig {

  @Bean
  @ConditionalOnProperty(
      name = "app.responseCache.store",
      havingValue = "memory",
      matchIfMissing = true)
  public ResponseCacheStore inMemoryResponseCacheStore(
      Clock clock, @Value("${app.responseCache.ttlMinutes:30}") long ttlMinutes) {
    return new InMemoryResponseCacheStore(Duration.ofMinutes(Math.max(0, ttlMinutes)), clock);
  }

  @Bean
  @ConditionalOnProperty(name = "app.responseCache.store", havingValue = "redis")
  public ResponseCacheStore redisResponseCacheStore(
      StringRedisTemplate redis,
      ObjectMapper mapper,
      Clock clock,
      @Value("${app.responseCache.ttlMinutes:30}") long ttlMinutes) {
    return new RedisResponseCacheStore(
        redis, mapper, Duration.ofMinutes(Math.max(0, ttlMinutes)), clock);
  }

  @Bean
  public ResponseCacheWebFilter responseCacheWebFilter(
      ResponseCacheStore store,
      ComparisonMetrics metrics,
      Clock clock,
      @Value("${app.responseCache.paths:/api/price}") String paths) {
    Set<String> parsed =
        Arrays.stream(paths.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toSet());
    return new ResponseCacheWebFilter(store, parsed, metrics, clock);
  }

  @Bean
  public RateLimitWebFilter rateLimitWebFilter(
      Clock clock,
      @Value("${app.rateLimit.windowMs:60000}") long windowMs,
      @Value("${app.rateLimit.maxRequests:100}") int maxRequests) {
    return new RateLimitWebFilter(windowMs, maxRequests, clock);
  }
}
