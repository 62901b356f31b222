package io.budgetsakkie.pricebackend.model;

import java.math.BigDecimal;

public record PriceRange(BigDecimal min, BigDecimal max) {}
