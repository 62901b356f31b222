package io.budgetsakkie.pricebackend.web;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/** Fixed-window request limit per client address. */
public class RateLimitWebFilter implements WebFilter, Ordered {
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

  private static final class Window {
    final long start;
    final AtomicInteger count = new AtomicInteger();

    Window(long start) {
      this.start = start;
    }
  }

  private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
  private final long windowMs;
  private final int maxRequests;
  private final Clock clock;

  public RateLimitWebFilter(long windowMs, int maxRequests, Clock clock) {
    this.windowMs = Math.max(1000L, windowMs);
    this.maxRequests = Math.max(1, maxRequests);
    this.clock = clock;
  }

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    long now = clock.millis();
    windows.values().removeIf(w -> now - w.start >= windowMs);

    Window window =
        windows.compute(
            clientId(exchange),
            (k, current) ->
                current == null || now - current.start >= windowMs ? new Window(now) : current);
    int count = window.count.incrementAndGet();

    ServerHttpResponse response = exchange.getResponse();
    if (count > maxRequests) {
      long retryAfter = Math.max(1, (window.start + windowMs - now + 999) / 1000);
      return rateLimited(response, retryAfter, now);
    }

    HttpHeaders headers = response.getHeaders();
    headers.set("X-RateLimit-Limit", String.valueOf(maxRequests));
    headers.set("X-RateLimit-Remaining", String.valueOf(Math.max(0, maxRequests - count)));
    headers.set("X-RateLimit-Reset", Instant.ofEpochMilli(window.start + windowMs).toString());
    return chain.filter(exchange);
  }

  private Mono<Void> rateLimited(ServerHttpResponse response, long retryAfter, long now) {
    response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
    response.getHeaders().set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
    String body =
        "{\"error\":\"Rate limit exceeded\",\"message\":\"Too many requests. Limit: "
            + maxRequests
            + " per "
            + (windowMs / 1000)
            + " seconds\",\"retryAfter\":"
            + retryAfter
            + ",\"timestamp\":"
            + now
            + "}";
    return response.writeWith(
        Mono.just(response.bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8))));
  }

  private static String clientId(ServerWebExchange exchange) {
    InetSocketAddress remote = exchange.getRequest().getRemoteAddress();
    if (remote == null || remote.getAddress() == null) return "unknown";
    return remote.getAddress().getHostAddress();
  }
}
