package io.budgetsakkie.pricebackend.model;

public record RetailerInfo(String id, String name, String logo, String color, String status) {

  public static final String ACTIVE = "active";

  public RetailerInfo(String id, String name, String logo, String color) {
    this(id, name, logo, color, ACTIVE);
  }
}
