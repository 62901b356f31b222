package io.budgetsakkie.pricebackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceBackendApplication {
  public static void main(String[] args) {
    SpringApplication.run(PriceBackendApplication.class, args);
  }
}
