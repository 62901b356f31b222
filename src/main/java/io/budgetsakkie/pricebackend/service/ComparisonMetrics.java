package io.budgetsakkie.pricebackend.service;

import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ComparisonMetrics {
  private final MeterRegistry meterRegistry;
  private final boolean enabled;

  public ComparisonMetrics(
      MeterRegistry meterRegistry, @Value("${app.metrics.enabled:true}") boolean enabled) {
    this.meterRegistry = meterRegistry;
    this.enabled = enabled;
  }

  public void resultCache(boolean hit) {
    if (!enabled) return;
    meterRegistry.counter("price.result_cache", "result", hit ? "hit" : "miss").increment();
  }

  public void responseCache(boolean hit) {
    if (!enabled) return;
    meterRegistry.counter("price.response_cache", "result", hit ? "hit" : "miss").increment();
  }

  public void quote(PriceQuote quote) {
    if (!enabled || quote == null) return;
    meterRegistry
        .counter(
            "price.adapter.quote",
            "retailer",
            quote.retailerId(),
            "outcome",
            quote.available() ? "available" : "unavailable")
        .increment();
  }
}
