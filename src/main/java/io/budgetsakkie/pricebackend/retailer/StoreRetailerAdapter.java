package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.budgetsakkie.pricebackend.model.RetailerInfo;
import io.budgetsakkie.pricebackend.util.Prices;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * {@link RetailerAdapter} that runs a {@link PriceLookup} on a dedicated lookup scheduler,
 * bounding each attempt by the policy's request timeout and retrying failed attempts with
 * exponential backoff.
 */
public class StoreRetailerAdapter implements RetailerAdapter {
  private static final Logger log = LoggerFactory.getLogger(StoreRetailerAdapter.class);

  public static final String NOT_FOUND = "Product not found";

  private final RetailerInfo info;
  private final PriceLookup lookup;
  private final RetryPolicy policy;
  private final String currency;
  private final Clock clock;
  private final Scheduler scheduler;

  public StoreRetailerAdapter(
      RetailerInfo info, PriceLookup lookup, RetryPolicy policy, String currency, Clock clock) {
    this(info, lookup, policy, currency, clock, RetailerSchedulers.shared());
  }

  public StoreRetailerAdapter(
      RetailerInfo info,
      PriceLookup lookup,
      RetryPolicy policy,
      String currency,
      Clock clock,
      Scheduler scheduler) {
    this.info = info;
    this.lookup = lookup;
    this.policy = policy == null ? RetryPolicy.defaults() : policy;
    this.currency = currency;
    this.clock = clock;
    this.scheduler = scheduler;
  }

  @Override
  public RetailerInfo info() {
    return info;
  }

  @Override
  public Mono<PriceQuote> fetchQuote(String normalizedItemName, String location) {
    AtomicInteger attempts = new AtomicInteger();
    return Mono.defer(() -> attempt(normalizedItemName, location, attempts.incrementAndGet()))
        .retryWhen(policy.toRetrySpec())
        .map(
            match ->
                match
                    .map(m -> toQuote(m, normalizedItemName))
                    .orElseGet(() -> failed(NOT_FOUND)))
        .onErrorResume(
            e -> {
              String reason = "Failed after " + attempts.get() + " attempts: " + describe(e);
              log.warn("{} gave up on '{}': {}", info.name(), normalizedItemName, reason);
              return Mono.just(failed(reason));
            });
  }

  private Mono<Optional<ProductMatch>> attempt(String itemName, String location, int attempt) {
    log.debug("{} attempt {}/{}: {}", info.name(), attempt, policy.maxRetries(), itemName);
    return Mono.fromCallable(
            () -> {
              Optional<ProductMatch> match = lookup.lookup(itemName, location);
              return match == null ? Optional.<ProductMatch>empty() : match;
            })
        .subscribeOn(scheduler)
        .timeout(policy.requestTimeout())
        .doOnError(
            e ->
                log.warn(
                    "{} attempt {}/{} failed: {}",
                    info.name(),
                    attempt,
                    policy.maxRetries(),
                    describe(e)));
  }

  private PriceQuote toQuote(ProductMatch match, String itemName) {
    if (match.price() == null || match.price().signum() < 0) {
      return failed("Invalid price");
    }
    // Feeds may omit the product name; fall back to what was asked for.
    String productName =
        match.productName() == null || match.productName().isBlank()
            ? itemName
            : match.productName();
    return PriceQuote.found(
        info,
        Prices.round2(match.price()),
        currency,
        productName,
        match.productUrl(),
        clock.millis());
  }

  private PriceQuote failed(String reason) {
    return PriceQuote.failed(info, currency, reason, clock.millis());
  }

  private String describe(Throwable e) {
    if (e instanceof TimeoutException) {
      return "request timed out after " + policy.requestTimeout().toMillis() + "ms";
    }
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
