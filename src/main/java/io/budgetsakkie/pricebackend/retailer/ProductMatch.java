package io.budgetsakkie.pricebackend.retailer;

import java.math.BigDecimal;

public record ProductMatch(String productName, BigDecimal price, String productUrl) {}
