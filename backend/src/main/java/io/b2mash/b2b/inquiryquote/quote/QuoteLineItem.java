package io.b2mash.b2b.inquiryquote.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** One priced product. {@code total} is quantity * unitPrice, scale 2, HALF_UP rounding. */
public record QuoteLineItem(
    String product,
    BigDecimal quantity,
    @JsonProperty("unit_price") BigDecimal unitPrice,
    BigDecimal total,
    String unit) {

  public static QuoteLineItem of(
      String product, BigDecimal quantity, BigDecimal unitPrice, String unit) {
    return new QuoteLineItem(
        product,
        quantity,
        unitPrice,
        quantity.multiply(unitPrice).setScale(2, RoundingMode.HALF_UP),
        unit);
  }
}
