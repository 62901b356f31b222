package io.budgetsakkie.pricebackend.config;

import io.budgetsakkie.pricebackend.client.RetailerFeedClient;
import io.budgetsakkie.pricebackend.retailer.CatalogPriceLookup;
import io.budgetsakkie.pricebackend.retailer.PriceLookup;
import io.budgetsakkie.pricebackend.retailer.PriceVariance;
import io.budgetsakkie.pricebackend.retailer.RetailerAdapter;
import io.budgetsakkie.pricebackend.retailer.RetailerCatalog;
import io.budgetsakkie.pricebackend.retailer.RetailerCatalogs;
import io.budgetsakkie.pricebackend.retailer.RetailerRegistry;
import io.budgetsakkie.pricebackend.retailer.RetailerSchedulers;
import io.budgetsakkie.pricebackend.retailer.RetryPolicy;
import io.budgetsakkie.pricebackend.retailer.StoreRetailerAdapter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;

@Configuration
public class RetailerRegistryConfig {
  private static final Logger log = LoggerFactory.getLogger(RetailerRegistryConfig.class);

  @Bean(destroyMethod = "dispose")
  public Scheduler retailerScheduler(RetailerProperties properties) {
    return RetailerSchedulers.create(
        properties.getWorkerThreads(), properties.getWorkerQueueCapacity());
  }

  @Bean
  public RetailerRegistry retailerRegistry(
      RetailerProperties properties, WebClient webClient, Clock clock, Scheduler retailerScheduler) {
    RetryPolicy policy =
        new RetryPolicy(
            properties.getMaxRetries(),
            Duration.ofMillis(properties.getBackoffUnitMs()),
            Duration.ofMillis(properties.getRequestTimeoutMs()));

    List<RetailerAdapter> adapters = new ArrayList<>();
    for (RetailerCatalog catalog : RetailerCatalogs.defaults()) {
      adapters.add(
          new StoreRetailerAdapter(
              catalog.retailer(),
              lookupFor(catalog, properties, webClient),
              policy,
              properties.getCurrency(),
              clock,
              retailerScheduler));
    }
    log.info(
        "registered {} retailers: {}",
        adapters.size(),
        adapters.stream().map(a -> a.info().id()).toList());
    return new RetailerRegistry(adapters, retailerScheduler);
  }

  static PriceLookup lookupFor(
      RetailerCatalog catalog, RetailerProperties properties, WebClient webClient) {
    String endpoint = properties.getEndpoints().get(catalog.retailer().id());
    if (endpoint != null && !endpoint.isBlank()) {
      return new RetailerFeedClient(webClient, endpoint, properties.getUserAgent());
    }
    return new CatalogPriceLookup(
        catalog,
        PriceVariance.symmetric(catalog.spread()),
        Duration.ofMillis(Math.max(0, properties.getSimulatedLatencyMinMs())),
        Duration.ofMillis(Math.max(0, properties.getSimulatedLatencyMaxMs())));
  }
}
