package io.budgetsakkie.pricebackend.controller;

import io.budgetsakkie.pricebackend.model.ComparisonMetadata;
import io.budgetsakkie.pricebackend.model.ComparisonResult;
import io.budgetsakkie.pricebackend.model.PriceComparisonResponse;
import io.budgetsakkie.pricebackend.model.RetailerInfo;
import io.budgetsakkie.pricebackend.model.RetailersResponse;
import io.budgetsakkie.pricebackend.retailer.RetailerRegistry;
import io.budgetsakkie.pricebackend.service.PriceComparisonService;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class PriceController {
  private static final Logger log = LoggerFactory.getLogger(PriceController.class);

  private final PriceComparisonService prices;
  private final RetailerRegistry registry;

  public PriceController(PriceComparisonService prices, RetailerRegistry registry) {
    this.prices = prices;
    this.registry = registry;
  }

  @GetMapping("/price")
  public Mono<PriceComparisonResponse> comparePrice(
      @RequestParam(value = "item", required = false) String item,
      @RequestParam(value = "location", required = false) @Size(max = 100) String location) {
    PriceRequests.validateItem(item);
    return Mono.fromCallable(
            () -> {
              long start = System.currentTimeMillis();
              ComparisonResult result = prices.compare(item, location);
              long duration = System.currentTimeMillis() - start;
              log.info("price comparison for '{}' completed in {}ms", item, duration);

              ComparisonMetadata metadata =
                  new ComparisonMetadata(
                      item,
                      location == null || location.isBlank() ? "default" : location,
                      duration,
                      Instant.now().toEpochMilli(),
                      result.quotes().size(),
                      result.availableCount());
              return PriceComparisonResponse.of(result, metadata);
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/price/retailers")
  public Mono<RetailersResponse> getRetailers() {
    List<RetailerInfo> retailers = registry.retailers();
    return Mono.just(
        new RetailersResponse(retailers, retailers.size(), Instant.now().toEpochMilli()));
  }
}
