package io.b2mash.b2b.inquiryquote.extraction;

import java.util.ArrayList;

/** Scores a product match and describes what was missing from it. */
final class ConfidenceScorer {

  static final double COMPLETE = 1.0;
  static final double NAME_ONLY = 0.9;

  static final String COMPLETE_NOTE = "Complete information extracted";
  static final String NO_QUANTITY_NOTE = "Quantity not specified";
  static final String NO_UNIT_NOTE = "Unit not specified";

  double score(ProductMatch match) {
    return match.hasQuantity() ? COMPLETE : NAME_ONLY;
  }

  String notes(ProductMatch match) {
    if (match.hasQuantity()) {
      return COMPLETE_NOTE;
    }
    var missing = new ArrayList<String>();
    missing.add(NO_QUANTITY_NOTE);
    if (match.unit() == null) {
      missing.add(NO_UNIT_NOTE);
    }
    return String.join("; ", missing);
  }
}
