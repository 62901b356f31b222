package io.budgetsakkie.pricebackend.controller;

import io.budgetsakkie.pricebackend.model.HealthStatus;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final String version;

  public HealthController(@Value("${app.version:1.0.0}") String version) {
    this.version = version;
  }

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public HealthStatus health() {
    return new HealthStatus("OK", Instant.now().toEpochMilli(), version);
  }
}
