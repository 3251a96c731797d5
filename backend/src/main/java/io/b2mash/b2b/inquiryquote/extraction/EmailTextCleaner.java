package io.b2mash.b2b.inquiryquote.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips quoted reply lines and the signature block so that earlier messages in a thread and
 * contact details in a signature are not mistaken for the request itself.
 */
final class EmailTextCleaner {

  // A line holding only a sign-off marks the start of the signature
  private static final Pattern SIGNATURE_START =
      Pattern.compile(
          "^\\s*(--|best regards,?|kind regards,?|regards,?|sincerely,?|thank you,?|cheers,?)\\s*$",
          Pattern.CASE_INSENSITIVE);

  List<String> cleanLines(String content) {
    var lines = new ArrayList<String>();
    for (String line : content.split("\\R", -1)) {
      if (SIGNATURE_START.matcher(line).matches()) {
        break;
      }
      String trimmed = line.strip();
      if (trimmed.startsWith(">") || trimmed.startsWith("|")) {
        continue;
      }
      lines.add(line);
    }
    return lines;
  }
}
