package io.b2mash.b2b.inquiryquote.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Structured extraction of one inbound email. Created once by {@link EmailExtractor} and never
 * modified; {@code gaps} depends only on {@code products}.
 */
public record ParsedEvent(
    @JsonProperty("email_id") String emailId,
    Instant timestamp,
    SenderInfo sender,
    List<ExtractedProduct> products,
    Urgency urgency,
    String currency,
    List<String> gaps,
    @JsonProperty("raw_content") String rawContent) {

  public ParsedEvent {
    products = products == null ? List.of() : List.copyOf(products);
    gaps = gaps == null ? List.of() : List.copyOf(gaps);
    if (sender == null) {
      sender = SenderInfo.unknown();
    }
  }
}
