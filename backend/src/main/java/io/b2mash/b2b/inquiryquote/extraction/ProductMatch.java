package io.b2mash.b2b.inquiryquote.extraction;

import java.math.BigDecimal;

/**
 * Intermediate result of scanning the email for one product: what was named and what was found
 * around it. Confidence and gaps are both derived from this, independently of each other.
 *
 * @param name exact catalog key, or the text as written for items not in the catalog
 * @param inCatalog whether the name matched a catalog product
 * @param quantity number found next to the name, or null
 * @param unit canonical unit word found next to the quantity or the name, or null
 */
public record ProductMatch(String name, boolean inCatalog, BigDecimal quantity, String unit) {

  public boolean hasQuantity() {
    return quantity != null;
  }

  ProductMatch withQuantity(BigDecimal quantity, String unit) {
    return new ProductMatch(name, inCatalog, quantity, unit);
  }
}
