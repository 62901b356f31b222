package io.budgetsakkie.pricebackend.retailer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.budgetsakkie.pricebackend.model.RetailerInfo;
import io.budgetsakkie.pricebackend.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

class StoreRetailerAdapterTest {
  private static final RetailerInfo RETAILER =
      new RetailerInfo("pick-n-pay", "Pick n Pay", "logo.png", "#E31837");
  private static final long NOW = 1_739_011_200_000L;

  private final MutableClock clock = new MutableClock(NOW);
  private final AtomicInteger attempts = new AtomicInteger();

  private StoreRetailerAdapter adapter(PriceLookup lookup, RetryPolicy policy) {
    return new StoreRetailerAdapter(RETAILER, lookup, policy, "ZAR", clock);
  }

  private static RetryPolicy fastPolicy(int maxRetries) {
    return new RetryPolicy(maxRetries, Duration.ofMillis(1), Duration.ofSeconds(2));
  }

  @Test
  void matchBecomesAvailableQuote() {
    PriceLookup lookup =
        (name, location) ->
            Optional.of(
                new ProductMatch("Full Cream Milk 1L", new BigDecimal("22.99"), "https://pnp/milk"));

    StepVerifier.create(adapter(lookup, fastPolicy(3)).fetchQuote("milk", null))
        .assertNext(
            quote -> {
              assertTrue(quote.available());
              assertEquals("pick-n-pay", quote.retailerId());
              assertEquals("Pick n Pay", quote.retailerName());
              assertEquals(new BigDecimal("22.99"), quote.price());
              assertEquals("ZAR", quote.currency());
              assertEquals("Full Cream Milk 1L", quote.productName());
              assertEquals("https://pnp/milk", quote.productUrl());
              assertNull(quote.error());
              assertEquals(NOW, quote.lastUpdated());
            })
        .verifyComplete();
  }

  @Test
  void catalogMissIsUnavailableWithoutRetrying() {
    PriceLookup lookup =
        (name, location) -> {
          attempts.incrementAndGet();
          return Optional.empty();
        };

    PriceQuote quote = adapter(lookup, fastPolicy(3)).fetchQuote("caviar", null).block();

    assertFalse(quote.available());
    assertNull(quote.price());
    assertNull(quote.productName());
    assertEquals(StoreRetailerAdapter.NOT_FOUND, quote.error());
    assertEquals(1, attempts.get());
  }

  @Test
  void transientFailureIsRetried() {
    PriceLookup lookup =
        (name, location) -> {
          if (attempts.incrementAndGet() < 3) throw new RetailerTransportException("HTTP 503");
          return Optional.of(new ProductMatch("Bread", new BigDecimal("15.99"), null));
        };

    PriceQuote quote = adapter(lookup, fastPolicy(3)).fetchQuote("bread", null).block();

    assertTrue(quote.available());
    assertEquals(3, attempts.get());
  }

  @Test
  void stopsAfterMaxRetriesAndReportsOneFailedQuote() throws Exception {
    PriceLookup lookup =
        (name, location) -> {
          attempts.incrementAndGet();
          throw new RetailerTransportException("connection refused");
        };

    StepVerifier.create(adapter(lookup, fastPolicy(3)).fetchQuote("milk", null))
        .assertNext(
            quote -> {
              assertFalse(quote.available());
              assertNull(quote.price());
              assertEquals("Failed after 3 attempts: connection refused", quote.error());
            })
        .verifyComplete();

    Thread.sleep(50);
    assertEquals(3, attempts.get());
  }

  @Test
  void slowAttemptTimesOut() {
    PriceLookup lookup =
        (name, location) -> {
          attempts.incrementAndGet();
          try {
            Thread.sleep(1_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return Optional.of(new ProductMatch("Milk", BigDecimal.ONE, null));
        };
    RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(50));

    PriceQuote quote = adapter(lookup, policy).fetchQuote("milk", null).block(Duration.ofSeconds(5));

    assertFalse(quote.available());
    assertEquals("Failed after 2 attempts: request timed out after 50ms", quote.error());
  }

  @Test
  void waitsExponentiallyBetweenAttempts() {
    PriceLookup lookup =
        (name, location) -> {
          attempts.incrementAndGet();
          throw new RetailerTransportException("down");
        };
    // Waits 2 units after the first failure and 4 after the second.
    RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(1));

    long start = System.nanoTime();
    adapter(lookup, policy).fetchQuote("milk", null).block(Duration.ofSeconds(5));
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;

    assertTrue(elapsedMs >= 300, "elapsed " + elapsedMs + "ms");
    assertEquals(3, attempts.get());
  }

  @Test
  void singleAttemptPolicyNeverRetries() {
    PriceLookup lookup =
        (name, location) -> {
          attempts.incrementAndGet();
          throw new IllegalStateException("parse error");
        };

    PriceQuote quote = adapter(lookup, fastPolicy(0)).fetchQuote("milk", null).block();

    assertEquals(1, attempts.get());
    assertEquals("Failed after 1 attempts: parse error", quote.error());
  }

  @Test
  void negativePriceIsRejected() {
    PriceLookup lookup =
        (name, location) -> Optional.of(new ProductMatch("Milk", new BigDecimal("-1.00"), null));

    PriceQuote quote = adapter(lookup, fastPolicy(1)).fetchQuote("milk", null).block();

    assertFalse(quote.available());
    assertEquals("Invalid price", quote.error());
  }

  @Test
  void passesLocationToLookup() {
    PriceLookup lookup =
        (name, location) ->
            "durban".equals(location)
                ? Optional.of(new ProductMatch("Milk", new BigDecimal("20.00"), null))
                : Optional.empty();

    assertTrue(adapter(lookup, fastPolicy(1)).fetchQuote("milk", "durban").block().available());
    assertFalse(adapter(lookup, fastPolicy(1)).fetchQuote("milk", null).block().available());
  }

  @Test
  void quotePriceIsRoundedAndMissingNameFallsBackToQuery() {
    PriceLookup lookup =
        (name, location) -> Optional.of(new ProductMatch(null, new BigDecimal("22.994"), null));

    PriceQuote quote = adapter(lookup, fastPolicy(1)).fetchQuote("full cream milk", null).block();

    assertTrue(quote.available());
    assertEquals(new BigDecimal("22.99"), quote.price());
    assertEquals("full cream milk", quote.productName());
  }

  @Test
  void lookupRunsOnRetailerPool() {
    AtomicReference<String> thread = new AtomicReference<>();
    PriceLookup lookup =
        (name, location) -> {
          thread.set(Thread.currentThread().getName());
          return Optional.empty();
        };

    adapter(lookup, fastPolicy(1)).fetchQuote("milk", null).block();

    assertTrue(thread.get().startsWith(RetailerSchedulers.THREAD_PREFIX), thread.get());
  }
}
