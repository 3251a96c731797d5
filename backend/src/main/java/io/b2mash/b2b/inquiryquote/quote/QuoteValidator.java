package io.b2mash.b2b.inquiryquote.quote;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Consistency checks over a computed quote. An empty result means the quote is well formed. */
@Component
public class QuoteValidator {

  private static final BigDecimal SUBTOTAL_TOLERANCE = new BigDecimal("0.01");

  public List<String> validate(Quote quote) {
    var errors = new ArrayList<String>();

    if (quote.isComplete()) {
      if (quote.lineItems().isEmpty()) {
        errors.add("Complete quote has no line items");
      }
      if (quote.total().signum() <= 0) {
        errors.add("Complete quote total must be positive, was " + quote.total());
      }
      BigDecimal lineSum =
          quote.lineItems().stream()
              .map(QuoteLineItem::total)
              .reduce(BigDecimal.ZERO, BigDecimal::add);
      if (lineSum.subtract(quote.subtotal()).abs().compareTo(SUBTOTAL_TOLERANCE) > 0) {
        errors.add(
            "Subtotal " + quote.subtotal() + " does not match line item sum " + lineSum);
      }
    } else {
      if (quote.pendingReasons().isEmpty()) {
        errors.add("Pending quote has no pending reasons");
      }
      if (quote.total().signum() != 0) {
        errors.add("Pending quote total must be zero, was " + quote.total());
      }
    }
    return errors;
  }
}
