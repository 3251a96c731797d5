package io.b2mash.b2b.inquiryquote.extraction;

import java.nio.charset.StandardCharsets;
import org.springframework.util.DigestUtils;

/** Content-derived email identifiers. Identical content always maps to the same id. */
public final class EmailIds {

  private static final int ID_LENGTH = 8;

  private EmailIds() {}

  public static String fromContent(String content) {
    return DigestUtils.md5DigestAsHex(content.getBytes(StandardCharsets.UTF_8))
        .substring(0, ID_LENGTH);
  }
}
