package io.budgetsakkie.pricebackend.controller;

final class PriceRequests {
  private PriceRequests() {}

  static final int MAX_ITEM_LENGTH = 100;
  static final String EXAMPLE = "/api/price?item=milk";

  static void validateItem(String item) {
    if (item == null) {
      throw new PriceRequestException(
          "Missing required parameter", "The \"item\" query parameter is required", EXAMPLE);
    }
    if (item.trim().isEmpty()) {
      throw new PriceRequestException(
          "Invalid parameter", "The \"item\" parameter must be a non-empty string", EXAMPLE);
    }
    if (item.length() > MAX_ITEM_LENGTH) {
      throw new PriceRequestException(
          "Parameter too long",
          "The \"item\" parameter must be less than " + MAX_ITEM_LENGTH + " characters",
          EXAMPLE);
    }
  }
}
