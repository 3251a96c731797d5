package io.b2mash.b2b.inquiryquote.quote;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Quote outcome. Both values are terminal: a quote is computed once and never changes status; a new
 * email produces a new quote.
 */
public enum QuoteStatus {
  /** Every product was priced. */
  COMPLETE,

  /** At least one product could not be priced, see the pending reasons. */
  PENDING;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
