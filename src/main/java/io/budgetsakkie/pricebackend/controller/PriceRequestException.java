package io.budgetsakkie.pricebackend.controller;

/** A price request rejected before any retailer is asked. */
public class PriceRequestException extends RuntimeException {
  private final String error;
  private final String example;

  public PriceRequestException(String error, String message) {
    this(error, message, null);
  }

  public PriceRequestException(String error, String message, String example) {
    super(message);
    this.error = error;
    this.example = example;
  }

  public String getError() {
    return error;
  }

  public String getExample() {
    return example;
  }
}
