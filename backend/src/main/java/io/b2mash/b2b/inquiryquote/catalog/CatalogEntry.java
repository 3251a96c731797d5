package io.b2mash.b2b.inquiryquote.catalog;

import java.math.BigDecimal;

/** Price list row: unit price, billing unit and a short description. */
public record CatalogEntry(BigDecimal price, String unit, String description) {

  public CatalogEntry {
    if (unit == null || unit.isBlank()) {
      unit = "piece";
    }
    if (description == null) {
      description = "";
    }
  }
}
