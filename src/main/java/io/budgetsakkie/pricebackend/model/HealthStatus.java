package io.budgetsakkie.pricebackend.model;

public record HealthStatus(String status, long timestamp, String version) {}
