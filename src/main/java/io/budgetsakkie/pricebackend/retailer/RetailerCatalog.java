package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.model.RetailerInfo;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.web.util.UriUtils;

/**
 * Static identity and product table for one retailer. Entries are matched in list order, so the
 * order is part of the matching behavior.
 *
 * @param spread total width of the symmetric price variance, e.g. {@code 0.10} for +/-5%
 */
public record RetailerCatalog(
    RetailerInfo retailer, String baseUrl, double spread, List<CatalogEntry> entries) {

  public RetailerCatalog {
    entries = List.copyOf(entries);
  }

  public String productUrl(String productName) {
    return baseUrl + "/product/" + UriUtils.encodePathSegment(productName, StandardCharsets.UTF_8);
  }
}
