package io.b2mash.b2b.inquiryquote.extraction;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Lists the information a quote is blocked on. Only a missing quantity is a gap; a missing unit is
 * not, since the catalog supplies the billing unit.
 */
public final class GapDetector {

  private static final String MISSING_QUANTITY = "Missing quantity for ";

  /** Gap text for a product without a quantity. Shared with the quoting engine. */
  public static String missingQuantity(String productName) {
    return MISSING_QUANTITY + productName;
  }

  List<String> detectGaps(List<ProductMatch> matches) {
    var gaps = new LinkedHashSet<String>();
    for (ProductMatch match : matches) {
      if (!match.hasQuantity()) {
        gaps.add(missingQuantity(match.name()));
      }
    }
    return List.copyOf(gaps);
  }
}
