package dev.fragmenter.splitting;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Permissive scanner deciding whether a source contains HTML.
 *
 * <p>A source is HTML as soon as one start, end or self-closing tag is found ({@code <p>}, {@code
 * <a href="x">}, {@code </p>}, {@code <br/>}). Tag names must start with an ASCII letter, so
 * comparisons such as {@code a < b} or stray brackets in prose are not mistaken for markup. No DOM
 * is built: the splitters only need tag boundaries.
 */
@Component
public class ContentClassifier {

  private static final Pattern TAG_PATTERN =
      Pattern.compile("</?[A-Za-z][A-Za-z0-9:._-]*+(?:\\s[^<>]*+)?/?>");

  /**
   * Returns whether the source contains at least one recognizable HTML element.
   *
   * @param source the text to inspect
   * @return true when a tag is found, false for plain text
   */
  public boolean isHtml(String source) {
    return TAG_PATTERN.matcher(source).find();
  }

  /**
   * Classifies the source as {@link FragmentType#HTML} or {@link FragmentType#TEXT}.
   *
   * @param source the text to inspect
   * @return the detected fragment type
   */
  public FragmentType classify(String source) {
    return isHtml(source) ? FragmentType.HTML : FragmentType.TEXT;
  }
}
