package io.budgetsakkie.pricebackend.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.budgetsakkie.pricebackend.model.ComparisonResult;
import io.budgetsakkie.pricebackend.model.PriceQuote;
import io.budgetsakkie.pricebackend.model.PriceRange;
import io.budgetsakkie.pricebackend.model.RetailerInfo;
import io.budgetsakkie.pricebackend.retailer.RetailerRegistry;
import io.budgetsakkie.pricebackend.service.PriceComparisonService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

@WebFluxTest(controllers = PriceController.class)
class PriceControllerTest {
  private static final long NOW = 1_739_011_200_000L;
  private static final RetailerInfo PNP =
      new RetailerInfo("pick-n-pay", "Pick n Pay", "/logos/pick-n-pay.png", "#E31837");
  private static final RetailerInfo SPAR =
      new RetailerInfo("spar", "SPAR", "/logos/spar.png", "#00A651");

  @Autowired private WebTestClient webTestClient;

  @MockBean private PriceComparisonService prices;
  @MockBean private RetailerRegistry registry;

  private static ComparisonResult milkResult() {
    PriceQuote pnp =
        PriceQuote.found(
            PNP, new BigDecimal("22.99"), "ZAR", "Full Cream Milk 1L", null, NOW);
    PriceQuote spar = PriceQuote.failed(SPAR, "ZAR", "Product not found", NOW);
    return new ComparisonResult(
        "milk",
        List.of(pnp, spar),
        pnp,
        new BigDecimal("0.00"),
        new PriceRange(new BigDecimal("22.99"), new BigDecimal("22.99")),
        NOW);
  }

  @Test
  void returnsComparisonWithMetadata() {
    given(prices.compare("Milk", "Cape Town")).willReturn(milkResult());

    webTestClient
        .get()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/api/price")
                    .queryParam("item", "Milk")
                    .queryParam("location", "Cape Town")
                    .build())
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.item")
        .isEqualTo("milk")
        .jsonPath("$.quotes.length()")
        .isEqualTo(2)
        .jsonPath("$.quotes[0].retailerId")
        .isEqualTo("pick-n-pay")
        .jsonPath("$.quotes[1].available")
        .isEqualTo(false)
        .jsonPath("$.quotes[1].error")
        .isEqualTo("Product not found")
        .jsonPath("$.cheapest.retailerId")
        .isEqualTo("pick-n-pay")
        .jsonPath("$.metadata.searchTerm")
        .isEqualTo("Milk")
        .jsonPath("$.metadata.location")
        .isEqualTo("Cape Town")
        .jsonPath("$.metadata.totalRetailers")
        .isEqualTo(2)
        .jsonPath("$.metadata.availableRetailers")
        .isEqualTo(1);

    verify(prices).compare("Milk", "Cape Town");
  }

  @Test
  void missingLocationIsReportedAsDefault() {
    given(prices.compare("milk", null)).willReturn(milkResult());

    webTestClient
        .get()
        .uri("/api/price?item=milk")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.metadata.location")
        .isEqualTo("default");
  }

  @Test
  void missingItemReturnsBadRequestWithExample() {
    webTestClient
        .get()
        .uri("/api/price")
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("Missing required parameter")
        .jsonPath("$.example")
        .isEqualTo("/api/price?item=milk");

    verify(prices, never()).compare(any(), any());
  }

  @Test
  void blankItemReturnsBadRequest() {
    webTestClient
        .get()
        .uri(uriBuilder -> uriBuilder.path("/api/price").queryParam("item", "   ").build())
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("Invalid parameter");

    verify(prices, never()).compare(any(), any());
  }

  @Test
  void overlongItemReturnsBadRequest() {
    webTestClient
        .get()
        .uri(uriBuilder -> uriBuilder.path("/api/price").queryParam("item", "a".repeat(101)).build())
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("Parameter too long");
  }

  @Test
  void serviceFailureReturnsServerError() {
    given(prices.compare(eq("milk"), any())).willThrow(new IllegalStateException("boom"));

    webTestClient
        .get()
        .uri("/api/price?item=milk")
        .exchange()
        .expectStatus()
        .is5xxServerError()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("Failed to fetch price comparison")
        .jsonPath("$.message")
        .isEqualTo("boom");
  }

  @Test
  void listsRetailers() {
    given(registry.retailers()).willReturn(List.of(PNP, SPAR));

    webTestClient
        .get()
        .uri("/api/price/retailers")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.count")
        .isEqualTo(2)
        .jsonPath("$.retailers[0].id")
        .isEqualTo("pick-n-pay")
        .jsonPath("$.retailers[1].status")
        .isEqualTo("active");
  }
}
