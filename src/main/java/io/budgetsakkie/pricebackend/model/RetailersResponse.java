package io.budgetsakkie.pricebackend.model;

import java.util.List;

public record RetailersResponse(List<RetailerInfo> retailers, int count, long timestamp) {}
