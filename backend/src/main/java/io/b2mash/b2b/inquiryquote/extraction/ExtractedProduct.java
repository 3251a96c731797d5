package io.b2mash.b2b.inquiryquote.extraction;

import java.math.BigDecimal;

/**
 * One requested product as it appears in the parsed event.
 *
 * @param name exact catalog key when the mention matched the catalog, otherwise the text as written
 * @param quantity requested quantity, or null when the email gives none
 * @param unit unit word found next to the quantity, or null
 * @param confidence extraction confidence in [0, 1]
 * @param notes what was or was not found, separated by {@code "; "}
 */
public record ExtractedProduct(
    String name, BigDecimal quantity, String unit, double confidence, String notes) {}
