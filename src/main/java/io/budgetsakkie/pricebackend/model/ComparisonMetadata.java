package io.budgetsakkie.pricebackend.model;

public record ComparisonMetadata(
    String searchTerm,
    String location,
    long responseTimeMs,
    long timestamp,
    int totalRetailers,
    int availableRetailers) {}
