package io.b2mash.b2b.inquiryquote.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class SenderExtractor {

  private static final Pattern FROM_LINE =
      Pattern.compile("^\\s*From:\\s*(.*)$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
  private static final Pattern EMAIL =
      Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
  private static final Pattern ANGLE_ADDRESS = Pattern.compile("<[^>]*>");

  SenderInfo extract(String text) {
    String name = null;
    String email = null;

    Matcher from = FROM_LINE.matcher(text);
    if (from.find()) {
      String value = from.group(1).strip();
      Matcher address = EMAIL.matcher(value);
      if (address.find()) {
        email = address.group();
      }
      name = displayName(value);
    }

    if (email == null) {
      Matcher anywhere = EMAIL.matcher(text);
      if (anywhere.find()) {
        email = anywhere.group();
      }
    }

    if (name != null && email != null) {
      return new SenderInfo(name, email, 1.0);
    }
    if (name != null || email != null) {
      return new SenderInfo(name, email, SenderInfo.PARTIAL_CONFIDENCE);
    }
    return SenderInfo.unknown();
  }

  private static String displayName(String headerValue) {
    String withoutAddress = ANGLE_ADDRESS.matcher(headerValue).replaceAll(" ");
    withoutAddress = EMAIL.matcher(withoutAddress).replaceAll(" ");
    String name = withoutAddress.replace("\"", "").replace("'", "").strip();
    return name.isEmpty() ? null : name;
  }
}
