package io.b2mash.b2b.inquiryquote.extraction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/** Keyword-based urgency. Tiers are checked high, medium, low; the first tier that matches wins. */
final class UrgencyDetector {

  private static final Map<Urgency, Pattern> KEYWORDS = new LinkedHashMap<>();

  static {
    KEYWORDS.put(
        Urgency.HIGH,
        Pattern.compile(
            "(?<!no )(?<!not )\\b(urgent(ly)?|asap|a\\.s\\.a\\.p|as soon as possible|rush"
                + "|immediate(ly)?|emergency)\\b",
            Pattern.CASE_INSENSITIVE));
    KEYWORDS.put(
        Urgency.MEDIUM,
        Pattern.compile(
            "\\b(soon|quick(ly)?|fast|(?<!low )priority|promptly)\\b", Pattern.CASE_INSENSITIVE));
    KEYWORDS.put(
        Urgency.LOW,
        Pattern.compile(
            "\\b(no rush|no hurry|not urgent|low priority|whenever|flexible)\\b",
            Pattern.CASE_INSENSITIVE));
  }

  Urgency detect(String text) {
    for (var entry : KEYWORDS.entrySet()) {
      if (entry.getValue().matcher(text).find()) {
        return entry.getKey();
      }
    }
    return null;
  }
}
