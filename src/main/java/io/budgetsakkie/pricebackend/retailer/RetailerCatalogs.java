package io.budgetsakkie.pricebackend.retailer;

import io.budgetsakkie.pricebackend.model.RetailerInfo;
import java.util.List;

/** Built-in retailers, in the order comparisons report them. */
public final class RetailerCatalogs {
  private RetailerCatalogs() {}

  private static final String LOGO_PARAMS = "?auto=compress&cs=tinysrgb&w=100&h=100&fit=crop";

  public static final RetailerCatalog PICK_N_PAY =
      new RetailerCatalog(
          new RetailerInfo(
              "pick-n-pay",
              "Pick n Pay",
              "https://images.pexels.com/photos/264547/pexels-photo-264547.jpeg" + LOGO_PARAMS,
              "#E31837"),
          "https://www.pnp.co.za",
          0.10,
          List.of(
              CatalogEntry.of("milk", "Full Cream Milk 1L", "22.99"),
              CatalogEntry.of("bread", "White Bread 700g", "15.99"),
              CatalogEntry.of("eggs", "Large Eggs 18 Pack", "34.99"),
              CatalogEntry.of("rice", "Basmati Rice 2kg", "45.99"),
              CatalogEntry.of("chicken", "Chicken Breasts per kg", "89.99"),
              CatalogEntry.of("bananas", "Bananas per kg", "19.99"),
              CatalogEntry.of("apples", "Red Apples per kg", "24.99"),
              CatalogEntry.of("coffee", "Instant Coffee 200g", "67.99"),
              CatalogEntry.of("sugar", "White Sugar 2.5kg", "32.99"),
              CatalogEntry.of("oil", "Sunflower Oil 750ml", "28.99")));

  public static final RetailerCatalog CHECKERS =
      new RetailerCatalog(
          new RetailerInfo(
              "checkers",
              "Checkers",
              "https://images.pexels.com/photos/3962285/pexels-photo-3962285.jpeg" + LOGO_PARAMS,
              "#00A651"),
          "https://www.checkers.co.za",
          0.08,
          List.of(
              CatalogEntry.of("milk", "Fresh Milk 1L", "23.49"),
              CatalogEntry.of("bread", "White Bread 700g", "16.49"),
              CatalogEntry.of("eggs", "Farm Fresh Eggs 12 Pack", "36.49"),
              CatalogEntry.of("rice", "Long Grain Rice 2kg", "42.99"),
              CatalogEntry.of("chicken", "Chicken Breast Fillets per kg", "94.99"),
              CatalogEntry.of("bananas", "Bananas per kg", "18.99"),
              CatalogEntry.of("apples", "Granny Smith Apples per kg", "26.99"),
              CatalogEntry.of("coffee", "Ground Coffee 250g", "72.99"),
              CatalogEntry.of("sugar", "Granulated Sugar 2.5kg", "34.99"),
              CatalogEntry.of("oil", "Cooking Oil 750ml", "31.99")));

  public static final RetailerCatalog WOOLWORTHS =
      new RetailerCatalog(
          new RetailerInfo(
              "woolworths",
              "Woolworths",
              "https://images.pexels.com/photos/4386370/pexels-photo-4386370.jpeg" + LOGO_PARAMS,
              "#00A86B"),
          "https://www.woolworths.co.za",
          0.06,
          List.of(
              CatalogEntry.of("milk", "Organic Full Cream Milk 1L", "28.99"),
              CatalogEntry.of("bread", "Artisan White Bread 600g", "18.99"),
              CatalogEntry.of("eggs", "Free Range Eggs 12 Pack", "44.99"),
              CatalogEntry.of("rice", "Organic Basmati Rice 1kg", "55.99"),
              CatalogEntry.of("chicken", "Free Range Chicken Breast per kg", "119.99"),
              CatalogEntry.of("bananas", "Organic Bananas per kg", "24.99"),
              CatalogEntry.of("apples", "Organic Red Apples per kg", "34.99"),
              CatalogEntry.of("coffee", "Premium Ground Coffee 250g", "89.99"),
              CatalogEntry.of("sugar", "Raw Sugar 2kg", "39.99"),
              CatalogEntry.of("oil", "Extra Virgin Olive Oil 500ml", "79.99")));

  public static final RetailerCatalog SHOPRITE =
      new RetailerCatalog(
          new RetailerInfo(
              "shoprite",
              "Shoprite",
              "https://images.pexels.com/photos/3985062/pexels-photo-3985062.jpeg" + LOGO_PARAMS,
              "#FF6B35"),
          "https://www.shoprite.co.za",
          0.12,
          List.of(
              CatalogEntry.of("milk", "Long Life Milk 1L", "20.99"),
              CatalogEntry.of("bread", "White Bread 700g", "13.99"),
              CatalogEntry.of("eggs", "Large Eggs 18 Pack", "32.99"),
              CatalogEntry.of("rice", "Parboiled Rice 2kg", "39.99"),
              CatalogEntry.of("chicken", "Chicken Portions per kg", "69.99"),
              CatalogEntry.of("bananas", "Bananas per kg", "17.99"),
              CatalogEntry.of("apples", "Red Apples per kg", "22.99"),
              CatalogEntry.of("coffee", "Instant Coffee 200g", "59.99"),
              CatalogEntry.of("sugar", "White Sugar 2.5kg", "29.99"),
              CatalogEntry.of("oil", "Sunflower Oil 750ml", "26.99")));

  public static final RetailerCatalog SPAR =
      new RetailerCatalog(
          new RetailerInfo(
              "spar",
              "SPAR",
              "https://images.pexels.com/photos/4481259/pexels-photo-4481259.jpeg" + LOGO_PARAMS,
              "#006B3F"),
          "https://www.spar.co.za",
          0.09,
          List.of(
              CatalogEntry.of("milk", "Fresh Milk 1L", "23.99"),
              CatalogEntry.of("bread", "Whole Wheat Bread 700g", "16.99"),
              CatalogEntry.of("eggs", "Farm Eggs 12 Pack", "36.99"),
              CatalogEntry.of("rice", "Jasmine Rice 2kg", "48.99"),
              CatalogEntry.of("chicken", "Chicken Thighs per kg", "74.99"),
              CatalogEntry.of("bananas", "Bananas per kg", "19.49"),
              CatalogEntry.of("apples", "Golden Apples per kg", "26.99"),
              CatalogEntry.of("coffee", "Filter Coffee 250g", "79.99"),
              CatalogEntry.of("sugar", "Brown Sugar 2kg", "36.99"),
              CatalogEntry.of("oil", "Canola Oil 750ml", "33.99")));

  public static List<RetailerCatalog> defaults() {
    return List.of(PICK_N_PAY, CHECKERS, WOOLWORTHS, SHOPRITE, SPAR);
  }
}
