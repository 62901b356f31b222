package io.budgetsakkie.pricebackend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Prices {
  private Prices() {}

  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);

  public static BigDecimal round2(BigDecimal value) {
    if (value == null) return null;
    BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP);
    return rounded.signum() < 0 ? ZERO : rounded;
  }
}
