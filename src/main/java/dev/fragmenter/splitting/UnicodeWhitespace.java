package dev.fragmenter.splitting;

import java.util.regex.Pattern;

/**
 * Trimming and blank checks that agree with the {@code \s} of the splitters' patterns, which are
 * compiled with {@link Pattern#UNICODE_CHARACTER_CLASS}. Unlike {@link String#strip()}, this treats
 * no-break spaces (U+00A0, U+2007, U+202F) as whitespace.
 */
final class UnicodeWhitespace {

  private static final Pattern EDGES =
      Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern BLANK = Pattern.compile("\\s*", Pattern.UNICODE_CHARACTER_CLASS);

  private UnicodeWhitespace() {
    // utility class
  }

  static String strip(String text) {
    return EDGES.matcher(text).replaceAll("");
  }

  static boolean isBlank(String text) {
    return BLANK.matcher(text).matches();
  }
}
