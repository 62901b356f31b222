package io.budgetsakkie.pricebackend.web;

import io.budgetsakkie.pricebackend.cache.CacheEntry;
import io.budgetsakkie.pricebackend.cache.CachedResponse;
import io.budgetsakkie.pricebackend.cache.ResponseCacheStore;
import io.budgetsakkie.pricebackend.service.ComparisonMetrics;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.http.server.reactive.ServerHttpResponseDecorator;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Serves repeated GET requests for the configured paths from a response cache keyed by the raw
 * path and query string. Hits are tagged {@code X-Cache: HIT} with {@code X-Cache-Age} in
 * seconds; forwarded requests are tagged {@code X-Cache: MISS} and their 2xx bodies stored.
 */
public class ResponseCacheWebFilter implements WebFilter, Ordered {
  private static final Logger log = LoggerFactory.getLogger(ResponseCacheWebFilter.class);

  public static final String CACHE_HEADER = "X-Cache";
  public static final String CACHE_AGE_HEADER = "X-Cache-Age";
  public static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 100;

  private final ResponseCacheStore store;
  private final Set<String> paths;
  private final ComparisonMetrics metrics;
  private final Clock clock;

  public ResponseCacheWebFilter(
      ResponseCacheStore store, Set<String> paths, ComparisonMetrics metrics, Clock clock) {
    this.store = store;
    this.paths = Set.copyOf(paths);
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public int getOrder() {
    return ORDER;
  }

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    ServerHttpRequest request = exchange.getRequest();
    if (!HttpMethod.GET.equals(request.getMethod())
        || !paths.contains(request.getPath().pathWithinApplication().value())) {
      return chain.filter(exchange);
    }

    String signature = signature(request);
    return Mono.fromCallable(() -> store.get(signature))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(
            (Optional<CacheEntry<CachedResponse>> hit) -> {
              if (hit.isPresent()) {
                metrics.responseCache(true);
                return serveHit(exchange, signature, hit.get());
              }
              metrics.responseCache(false);
              ServerHttpResponse capturing = new CapturingResponse(exchange.getResponse(), signature);
              return chain.filter(exchange.mutate().response(capturing).build());
            });
  }

  static String signature(ServerHttpRequest request) {
    String path = request.getURI().getRawPath();
    String query = request.getURI().getRawQuery();
    return query == null || query.isEmpty() ? path : path + "?" + query;
  }

  private Mono<Void> serveHit(
      ServerWebExchange exchange, String signature, CacheEntry<CachedResponse> entry) {
    long ageSeconds = entry.ageMillis(clock.millis()) / 1000;
    log.debug("response cache hit: {} age={}s", signature, ageSeconds);

    ServerHttpResponse response = exchange.getResponse();
    response.setStatusCode(HttpStatus.OK);
    response.getHeaders().set(CACHE_HEADER, "HIT");
    response.getHeaders().set(CACHE_AGE_HEADER, String.valueOf(ageSeconds));
    String contentType = entry.value().contentType();
    if (contentType != null && !contentType.isBlank()) {
      response.getHeaders().setContentType(MediaType.parseMediaType(contentType));
    }
    DataBuffer buffer = response.bufferFactory().wrap(entry.value().body());
    return response.writeWith(Mono.just(buffer));
  }

  private class CapturingResponse extends ServerHttpResponseDecorator {
    private final String signature;

    CapturingResponse(ServerHttpResponse delegate, String signature) {
      super(delegate);
      this.signature = signature;
    }

    @Override
    public Mono<Void> writeWith(Publisher<? extends DataBuffer> body) {
      return DataBufferUtils.join(body)
          .map(
              joined -> {
                byte[] bytes = new byte[joined.readableByteCount()];
                joined.read(bytes);
                DataBufferUtils.release(joined);
                return bytes;
              })
          .defaultIfEmpty(new byte[0])
          .flatMap(
              bytes -> {
                getHeaders().set(CACHE_HEADER, "MISS");
                return storeIfSuccessful(bytes)
                    .then(Mono.defer(() -> super.writeWith(Mono.just(bufferFactory().wrap(bytes)))));
              });
    }

    @Override
    public Mono<Void> writeAndFlushWith(Publisher<? extends Publisher<? extends DataBuffer>> body) {
      return writeWith(Flux.from(body).concatMap(p -> p));
    }

    private Mono<Void> storeIfSuccessful(byte[] bytes) {
      HttpStatusCode status = getStatusCode();
      if (status != null && !status.is2xxSuccessful()) return Mono.empty();
      MediaType contentType = getHeaders().getContentType();
      CachedResponse cached =
          new CachedResponse(contentType == null ? null : contentType.toString(), bytes);
      return Mono.fromRunnable(
              () -> {
                store.put(signature, cached);
                log.debug("response cached: {}", signature);
              })
          .subscribeOn(Schedulers.boundedElastic())
          .then();
    }
  }
}
