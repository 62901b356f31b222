package io.budgetsakkie.pricebackend.cache;

/** A captured HTTP response body and its content type. */
public record CachedResponse(String contentType, byte[] body) {

  public CachedResponse {
    body = body == null ? new byte[0] : body;
  }
}
