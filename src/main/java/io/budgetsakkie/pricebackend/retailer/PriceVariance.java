package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.util.Prices;
import java.math.BigDecimal;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Turns a catalog base price into the quoted price, rounded to 2 decimals. */
@FunctionalInterface
public interface PriceVariance {

  BigDecimal apply(BigDecimal basePrice);

  static PriceVariance none() {
    return Prices::round2;
  }

  static PriceVariance symmetric(double spread) {
    return symmetric(spread, () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Multiplies the base price by {@code 1 + (r - 0.5) * spread} for {@code r} in [0, 1).
   *
   * @param random source of values in [0, 1)
   */
  static PriceVariance symmetric(double spread, DoubleSupplier random) {
    if (spread < 0 || spread >= 2) {
      throw new IllegalArgumentException("spread must be in [0, 2): " + spread);
    }
    return basePrice -> {
      double factor = 1 + (random.getAsDouble() - 0.5) * spread;
      return Prices.round2(basePrice.multiply(BigDecimal.valueOf(factor)));
    };
  }
}
