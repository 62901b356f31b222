package io.budgetsakkie.pricebackend.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class ProductNames {
  private ProductNames() {}

  private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Lowercases, replaces punctuation with spaces, collapses whitespace and trims. */
  public static String normalize(String name) {
    if (name == null) return "";
    String lower = name.toLowerCase(Locale.ROOT);
    String spaced = PUNCTUATION.matcher(lower).replaceAll(" ");
    return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
  }

  public static String firstToken(String normalized) {
    if (normalized == null || normalized.isEmpty()) return "";
    int space = normalized.indexOf(' ');
    return space < 0 ? normalized : normalized.substring(0, space);
  }

  public static String normalizeLocation(String location) {
    if (location == null) return null;
    String trimmed = location.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
