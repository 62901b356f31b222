package io.budgetsakkie.pricebackend.retailer;

public class RetailerTransportException extends RuntimeException {

  public RetailerTransportException(String message) {
    super(message);
  }

  public RetailerTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
