package io.b2mash.b2b.inquiryquote.extraction;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds requested products line by line. Catalog names are matched case-insensitively anywhere in
 * a line, and when two names overlap the longer one wins. Items outside the catalog are picked up
 * from a "number + Capitalized Words" pattern. The quantity for a catalog mention is the number
 * directly in front of it, else the first number after it, else the last number before it, never
 * reaching past a neighbouring product on the same line. A number is given to one product only: a
 * number directly in front of the next name belongs to that name, and a number taken from after a
 * name is not offered to the next one.
 */
final class ProductMatcher {

  private static final String UNIT_WORDS =
      "pieces|piece|pcs|pc|kits|kit|packs|pack|boxes|box|sets|set|units|unit";

  private static final String NUMBER_TEXT = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";

  // Excludes digits glued to words, prices, order numbers and times
  private static final String NUMBER_START = "(?<![\\w.,#$€£¥/:-])";

  private static final Pattern NUMBER = Pattern.compile(NUMBER_START + NUMBER_TEXT);

  // After a name a multiplier may be glued to the digits, as in "x10" or "×10"
  private static final Pattern NUMBER_AFTER_NAME =
      Pattern.compile("(?:(?<=(?:^|\\W)[xX×])|" + NUMBER_START + ")" + NUMBER_TEXT);

  private static final Pattern QUANTITY_BEFORE =
      Pattern.compile(
          NUMBER_START
              + NUMBER_TEXT
              + "\\s*(?:x\\s*)?(?:("
              + UNIT_WORDS
              + ")\\s+)?(?:of\\s+)?$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern UNIT_NEXT =
      Pattern.compile("^\\s*(?:x\\s*)?(" + UNIT_WORDS + ")\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern GENERIC_ITEM =
      Pattern.compile(
          NUMBER_START
              + NUMBER_TEXT
              + "\\s*(?:x\\s+)?(?:(?i:("
              + UNIT_WORDS
              + "))\\s+(?:(?i:of)\\s+)?)?"
              + "([A-Z][a-z][\\w-]*(?:[ \\t]+[A-Z][\\w-]*){0,3})");

  private static final Set<String> NOT_PRODUCTS =
      Set.of(
          "january", "february", "march", "april", "may", "june", "july", "august", "september",
          "october", "november", "december", "jan", "feb", "mar", "apr", "jun", "jul", "aug",
          "sep", "sept", "oct", "nov", "dec", "monday", "tuesday", "wednesday", "thursday",
          "friday", "saturday", "sunday", "minutes", "hours", "days", "weeks", "months", "years",
          "business", "working", "percent", "street", "avenue", "road", "suite", "floor");

  private final List<NamePattern> catalogPatterns;

  ProductMatcher(Collection<String> catalogNames) {
    this.catalogPatterns =
        catalogNames.stream()
            .map(name -> new NamePattern(name, compileName(name)))
            .toList();
  }

  List<ProductMatch> findMatches(List<String> lines) {
    Map<String, ProductMatch> found = new LinkedHashMap<>();
    for (String line : lines) {
      for (ProductMatch match : matchLine(line)) {
        String key = match.name().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        ProductMatch existing = found.get(key);
        if (existing == null) {
          found.put(key, match);
        } else if (!existing.hasQuantity() && match.hasQuantity()) {
          found.put(key, existing.withQuantity(match.quantity(), match.unit()));
        }
      }
    }
    return List.copyOf(found.values());
  }

  private List<ProductMatch> matchLine(String line) {
    List<Span> spans = new ArrayList<>(catalogSpans(line));
    spans.addAll(genericSpans(line, spans));
    spans.sort(Comparator.comparingInt(Span::start));

    var matches = new ArrayList<ProductMatch>();
    int claimedUntil = 0;
    for (int i = 0; i < spans.size(); i++) {
      Span span = spans.get(i);
      Span nextSpan = i + 1 < spans.size() ? spans.get(i + 1) : null;
      int segmentStart = Math.max(claimedUntil, i == 0 ? 0 : spans.get(i - 1).end());
      int segmentEnd = nextSpan == null ? line.length() : quantityBoundary(line, span, nextSpan);
      String before = line.substring(segmentStart, span.start());
      String after = line.substring(span.end(), segmentEnd);
      claimedUntil = span.end();

      if (span.inCatalog()) {
        Located located = quantityNear(span.name(), before, after);
        matches.add(located.match());
        claimedUntil = span.end() + located.afterConsumed();
      } else {
        String unit = span.unit() != null ? span.unit() : unitAt(after);
        matches.add(new ProductMatch(span.name(), false, span.quantity(), unit));
      }
    }
    return matches;
  }

  /**
   * End of the text following {@code span} that may hold its quantity. A quantity written directly
   * in front of the next catalog name belongs to that name.
   */
  private static int quantityBoundary(String line, Span span, Span nextSpan) {
    if (!nextSpan.inCatalog()) {
      return nextSpan.start();
    }
    Matcher adjacent = QUANTITY_BEFORE.matcher(line.substring(span.end(), nextSpan.start()));
    return adjacent.find() ? span.end() + adjacent.start() : nextSpan.start();
  }

  private List<Span> catalogSpans(String line) {
    var candidates = new ArrayList<Span>();
    for (NamePattern namePattern : catalogPatterns) {
      Matcher matcher = namePattern.pattern().matcher(line);
      while (matcher.find()) {
        candidates.add(
            new Span(matcher.start(), matcher.end(), namePattern.name(), true, null, null));
      }
    }
    candidates.sort(
        Comparator.comparingInt((Span span) -> span.end() - span.start())
            .reversed()
            .thenComparingInt(Span::start));

    var accepted = new ArrayList<Span>();
    for (Span candidate : candidates) {
      if (accepted.stream().noneMatch(candidate::overlaps)) {
        accepted.add(candidate);
      }
    }
    return accepted;
  }

  private List<Span> genericSpans(String line, List<Span> catalogSpans) {
    var spans = new ArrayList<Span>();
    Matcher matcher = GENERIC_ITEM.matcher(line);
    while (matcher.find()) {
      var span =
          new Span(
              matcher.start(),
              matcher.end(),
              matcher.group(3),
              false,
              parseNumber(matcher.group(1)),
              matcher.group(2) != null ? canonicalUnit(matcher.group(2)) : null);
      if (catalogSpans.stream().noneMatch(span::overlaps) && looksLikeProduct(span.name())) {
        spans.add(span);
      }
    }
    return spans;
  }

  private static Located quantityNear(String name, String before, String after) {
    Matcher adjacent = QUANTITY_BEFORE.matcher(before);
    if (adjacent.find()) {
      String unit = adjacent.group(2) != null ? canonicalUnit(adjacent.group(2)) : unitAt(after);
      return new Located(new ProductMatch(name, true, parseNumber(adjacent.group(1)), unit), 0);
    }

    Matcher next = NUMBER_AFTER_NAME.matcher(after);
    if (next.find()) {
      String unit = unitAt(after.substring(next.end()));
      return new Located(
          new ProductMatch(
              name, true, parseNumber(next.group(1)), unit != null ? unit : unitAt(after)),
          next.end());
    }

    Matcher previous = NUMBER.matcher(before);
    String lastNumber = null;
    int lastEnd = -1;
    while (previous.find()) {
      lastNumber = previous.group(1);
      lastEnd = previous.end();
    }
    if (lastNumber != null) {
      String unit = unitAt(before.substring(lastEnd));
      return new Located(
          new ProductMatch(
              name, true, parseNumber(lastNumber), unit != null ? unit : unitAt(after)),
          0);
    }

    return new Located(new ProductMatch(name, true, null, unitAt(after)), 0);
  }

  private static String unitAt(String text) {
    Matcher matcher = UNIT_NEXT.matcher(text);
    return matcher.find() ? canonicalUnit(matcher.group(1)) : null;
  }

  static String canonicalUnit(String word) {
    String lower = word.toLowerCase(Locale.ROOT);
    if (lower.startsWith("pc") || lower.startsWith("piece")) {
      return "piece";
    }
    if (lower.startsWith("box")) {
      return "box";
    }
    // kits, packs, sets, units
    return lower.endsWith("s") ? lower.substring(0, lower.length() - 1) : lower;
  }

  private static BigDecimal parseNumber(String text) {
    return new BigDecimal(text.replace(",", ""));
  }

  private static boolean looksLikeProduct(String phrase) {
    for (String word : phrase.split("\\s+")) {
      if (NOT_PRODUCTS.contains(word.toLowerCase(Locale.ROOT))) {
        return false;
      }
    }
    return true;
  }

  private static Pattern compileName(String name) {
    var words = name.strip().split("\\s+");
    var regex = new StringBuilder();
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        regex.append("\\s+");
      }
      regex.append(Pattern.quote(words[i]));
    }
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  private record NamePattern(String name, Pattern pattern) {}

  /** A catalog match and how many characters after the name its quantity used up. */
  private record Located(ProductMatch match, int afterConsumed) {}

  private record Span(
      int start, int end, String name, boolean inCatalog, BigDecimal quantity, String unit) {

    boolean overlaps(Span other) {
      return start < other.end() && other.start() < end;
    }
  }
}
