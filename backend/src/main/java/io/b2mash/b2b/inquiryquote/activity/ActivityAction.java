package io.b2mash.b2b.inquiryquote.activity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of timeline entry. Serialized in lower case. */
public enum ActivityAction {
  START,
  PARSE,
  ACK,
  QUOTE,
  SKIP,
  ERROR,
  INFO,
  COMPLETE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ActivityAction fromValue(String value) {
    for (ActivityAction action : values()) {
      if (action.value().equalsIgnoreCase(value)) {
        return action;
      }
    }
    throw new IllegalArgumentException("Unknown activity action: " + value);
  }
}
