package io.b2mash.b2b.inquiryquote.quote;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Pricing result for one parsed email. A complete quote has line items and no pending reasons; a
 * pending quote has pending reasons, no line items and zero amounts.
 */
public record Quote(
    @JsonProperty("email_id") String emailId,
    Instant timestamp,
    QuoteStatus status,
    @JsonProperty("line_items") List<QuoteLineItem> lineItems,
    BigDecimal subtotal,
    BigDecimal discount,
    BigDecimal tax,
    BigDecimal total,
    String currency,
    @JsonProperty("pending_reasons") List<String> pendingReasons,
    @JsonProperty("valid_until") Instant validUntil,
    @JsonProperty("discount_rate") BigDecimal discountRate) {

  public Quote {
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    pendingReasons = pendingReasons == null ? List.of() : List.copyOf(pendingReasons);
  }

  @JsonIgnore
  public boolean isComplete() {
    return status == QuoteStatus.COMPLETE;
  }
}
