package io.budgetsakkie.pricebackend.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class ProductNamesTest {

  @Test
  void normalizeLowercasesStripsPunctuationAndCollapsesWhitespace() {
    assertEquals("full cream milk 1l", ProductNames.normalize("  Full-Cream   MILK (1L)! "));
  }

  @Test
  void normalizeKeepsDigitsAndUnderscores() {
    assertEquals("eggs_18 pack", ProductNames.normalize("Eggs_18 pack"));
  }

  @Test
  void normalizeOfPunctuationOnlyIsEmpty() {
    assertEquals("", ProductNames.normalize("?!..."));
    assertEquals("", ProductNames.normalize(null));
  }

  @Test
  void firstTokenIsTextBeforeFirstSpace() {
    assertEquals("brown", ProductNames.firstToken("brown sugar"));
    assertEquals("milk", ProductNames.firstToken("milk"));
    assertEquals("", ProductNames.firstToken(""));
  }

  @Test
  void blankLocationNormalizesToNull() {
    assertNull(ProductNames.normalizeLocation("   "));
    assertNull(ProductNames.normalizeLocation(null));
    assertEquals("Cape Town", ProductNames.normalizeLocation(" Cape Town "));
  }
}
