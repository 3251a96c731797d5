package io.b2mash.b2b.inquiryquote.extraction;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds the earliest ISO currency code or currency symbol in the text. */
final class CurrencyDetector {

  private static final Pattern CURRENCY =
      Pattern.compile("\\b(USD|EUR|GBP|CAD|AUD|JPY|CHF)\\b|([$€£¥])");

  private static final Map<String, String> SYMBOLS =
      Map.of("$", "USD", "€", "EUR", "£", "GBP", "¥", "JPY");

  String detect(String text) {
    Matcher matcher = CURRENCY.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    return matcher.group(1) != null ? matcher.group(1) : SYMBOLS.get(matcher.group(2));
  }
}
