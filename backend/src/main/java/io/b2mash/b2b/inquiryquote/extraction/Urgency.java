package io.b2mash.b2b.inquiryquote.extraction;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Urgency tier derived from keywords in the email. */
public enum Urgency {
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
