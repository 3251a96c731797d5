package io.b2mash.b2b.inquiryquote.catalog;

import java.util.Objects;

/** Price list and discount schedule loaded together for one run. Never mutated after load. */
public record CatalogSnapshot(ProductCatalog products, DiscountSchedule discounts) {

  public CatalogSnapshot {
    Objects.requireNonNull(products, "products");
    Objects.requireNonNull(discounts, "discounts");
  }
}
