package dev.fragmenter.splitting;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Streams an HTML source into fragments whose tag nesting is valid on its own.
 *
 * <p>The source is scanned left to right, alternating between tags and the text runs between
 * them. Each tag or text run is an indivisible unit: before appending one, the {@link
 * HtmlFragmentTracker} projects the fragment size including the closing tags it will need, and if
 * the unit does not fit the current fragment is closed and a new one is opened with the same
 * ancestor tags (raw attributes included).
 *
 * <p>Malformed markup is tolerated: closing tags that do not match the innermost open tag are kept
 * in the output but do not change the hierarchy. A trailing {@code <} without a matching
 * {@code >} ends the scan. A unit larger than the budget on its own is emitted as an oversized
 * fragment.
 */
final class HtmlSplitter extends FragmentIterator {

  /** Elements that never have content nor an end tag. */
  private static final Set<String> VOID_ELEMENTS =
      Set.of(
          "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param",
          "source", "track", "wbr");

  private final String source;
  private final HtmlFragmentTracker tracker;
  private int pos;
  private boolean finished;

  private HtmlSplitter(String source, int maxLength) {
    this.source = source;
    this.tracker = new HtmlFragmentTracker(maxLength);
  }

  /**
   * Splits HTML into fragments of at most {@code maxLength} UTF-8 bytes, closing tags included.
   *
   * @param source the markup to split; null or empty yields no fragments
   * @param maxLength byte budget per fragment; non-positive yields no fragments
   * @return lazy stream of fragments in source order
   */
  static Stream<String> split(@Nullable String source, int maxLength) {
    if (source == null || source.isEmpty() || maxLength <= 0) {
      return Stream.empty();
    }
    return new HtmlSplitter(source, maxLength).stream();
  }

  @Override
  protected @Nullable String computeNext() {
    if (finished) {
      return null;
    }
    while (pos < source.length()) {
      String fragment = source.charAt(pos) == '<' ? processTag() : processText();
      if (fragment != null) {
        return fragment;
      }
      if (finished) {
        break;
      }
    }
    finished = true;
    return tracker.hasContent() ? tracker.flush() : null;
  }

  /** Consumes one tag. Returns the fragment closed to make room for it, if any. */
  private @Nullable String processTag() {
    int tagEnd = source.indexOf('>', pos);
    if (tagEnd == -1) {
      // truncated trailing tag
      finished = true;
      pos = source.length();
      return null;
    }
    String fullTag = source.substring(pos, tagEnd + 1);
    String tagContent = fullTag.substring(1, fullTag.length() - 1);
    pos = tagEnd + 1;

    if (tagContent.startsWith("/")) {
      String name = tagName(tagContent.substring(1));
      String flushed = makeRoom(tracker.wouldExceedClosing(fullTag, name));
      tracker.onClosingTag(name);
      tracker.addContent(fullTag);
      return flushed;
    }

    String name = tagName(tagContent);
    if (isStandalone(tagContent, name)) {
      String flushed = makeRoom(tracker.wouldExceed(fullTag));
      tracker.addContent(fullTag);
      return flushed;
    }

    String flushed = makeRoom(tracker.wouldExceedOpening(fullTag, name));
    tracker.onOpeningTag(fullTag, name);
    tracker.addContent(fullTag);
    return flushed;
  }

  /** Consumes the text run up to the next tag. Whitespace-only runs are dropped. */
  private @Nullable String processText() {
    int nextTag = source.indexOf('<', pos);
    int end = nextTag == -1 ? source.length() : nextTag;
    String text = source.substring(pos, end);
    pos = end;

    if (UnicodeWhitespace.isBlank(text)) {
      return null;
    }
    String flushed = makeRoom(tracker.wouldExceed(text));
    tracker.addContent(text);
    return flushed;
  }

  private @Nullable String makeRoom(boolean exceeded) {
    if (!exceeded || !tracker.hasContent()) {
      return null;
    }
    String fragment = tracker.flush();
    tracker.startFragment();
    return fragment;
  }

  private static String tagName(String tagContent) {
    String trimmed = tagContent.strip();
    int end = 0;
    while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
      end++;
    }
    return trimmed.substring(0, end);
  }

  private static boolean isStandalone(String tagContent, String name) {
    if (tagContent.endsWith("/") || name.isEmpty()) {
      return true;
    }
    char first = name.charAt(0);
    if (first == '!' || first == '?') {
      return true;
    }
    return VOID_ELEMENTS.contains(name.toLowerCase(Locale.ROOT));
  }
}
