package io.budgetsakkie.pricebackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.budgetsakkie.pricebackend.retailer.PriceLookup;
import io.budgetsakkie.pricebackend.retailer.ProductMatch;
import io.budgetsakkie.pricebackend.retailer.RetailerTransportException;
import io.budgetsakkie.pricebackend.util.Prices;
import java.math.BigDecimal;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Prices an item from a retailer's JSON search feed: {@code GET <endpoint>?q=<item>} answering
 * {@code {"name": ..., "price": ..., "url": ...}}. A 404 or {@code "available": false} means the
 * retailer has no such product.
 */
public class RetailerFeedClient implements PriceLookup {
  private final WebClient webClient;
  private final String endpoint;
  private final String userAgent;

  public RetailerFeedClient(WebClient webClient, String endpoint, String userAgent) {
    this.webClient = webClient;
    this.endpoint = endpoint == null ? "" : endpoint.trim();
    this.userAgent = userAgent == null ? "" : userAgent.trim();
  }

  @Override
  public Optional<ProductMatch> lookup(String normalizedItemName, String location) {
    if (endpoint.isBlank()) throw new RetailerTransportException("feed endpoint not configured");

    UriComponentsBuilder b =
        UriComponentsBuilder.fromUriString(endpoint).queryParam("q", normalizedItemName);
    if (location != null && !location.isBlank()) {
      b.queryParam("location", location);
    }
    URI uri = b.encode().build().toUri();

    JsonNode root;
    try {
      root =
          webClient
              .get()
              .uri(uri)
              .headers(
                  h -> {
                    if (!userAgent.isEmpty()) h.set(HttpHeaders.USER_AGENT, userAgent);
                    h.setAccept(List.of(MediaType.APPLICATION_JSON));
                    h.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
                  })
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block();
    } catch (WebClientResponseException.NotFound e) {
      return Optional.empty();
    } catch (WebClientResponseException e) {
      throw new RetailerTransportException(
          "HTTP " + e.getStatusCode().value() + ": " + e.getStatusText(), e);
    } catch (RetailerTransportException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RetailerTransportException(
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
    }

    if (root == null) throw new RetailerTransportException("empty response from " + uri.getHost());
    if (!root.path("available").asBoolean(true)) return Optional.empty();

    JsonNode priceNode = root.path("price");
    BigDecimal price;
    if (priceNode.isNumber()) {
      price = priceNode.decimalValue();
    } else if (priceNode.isTextual()) {
      price = parsePrice(priceNode.asText());
    } else {
      throw new RetailerTransportException("response has no price");
    }
    if (price.signum() < 0) throw new RetailerTransportException("negative price: " + price);

    String name = root.path("name").asText(null);
    String url = root.path("url").asText(null);
    return Optional.of(new ProductMatch(name, Prices.round2(price), url));
  }

  /** Accepts display prices such as {@code "R 22,99"} or {@code "22.99"}. */
  static BigDecimal parsePrice(String text) {
    String digits = text == null ? "" : text.replaceAll("[^\\d.,]", "").replace(',', '.');
    int lastDot = digits.lastIndexOf('.');
    if (lastDot >= 0) {
      digits = digits.substring(0, lastDot).replace(".", "") + digits.substring(lastDot);
    }
    try {
      return new BigDecimal(digits);
    } catch (NumberFormatException e) {
      throw new RetailerTransportException("unparseable price: " + text, e);
    }
  }
}
