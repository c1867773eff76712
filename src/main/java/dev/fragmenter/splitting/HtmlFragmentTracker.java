package dev.fragmenter.splitting;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one HTML split: the stack of open tags, their raw opening markup, and the
 * fragment being assembled with its UTF-8 byte length.
 *
 * <p>Every size projection includes the closing tags the fragment would need if it were flushed
 * right now, so a fragment that respects the budget still respects it once closed.
 *
 * <p>Not thread-safe. One instance belongs to a single split call for its whole lifetime.
 */
public final class HtmlFragmentTracker {

  private final int maxLength;
  private final List<String> stack = new ArrayList<>();
  private final List<SavedTag> savedTags = new ArrayList<>();
  private final List<String> currentFragment = new ArrayList<>();
  private int currentLength;
  private boolean hasContent;

  public HtmlFragmentTracker(int maxLength) {
    this.maxLength = maxLength;
  }

  /**
   * Builds the markup that re-opens and closes every currently open tag.
   *
   * @return opening markup (outermost first) and closing markup (innermost first)
   */
  public TagHierarchy tagHierarchy() {
    StringBuilder opening = new StringBuilder();
    for (SavedTag tag : savedTags) {
      opening.append(tag.rawTag());
    }
    return new TagHierarchy(opening.toString(), closingTags());
  }

  /**
   * Returns whether appending {@code content} would push the fragment past the budget once its
   * closing tags are added.
   */
  public boolean wouldExceed(String content) {
    return projectedLength(Utf8.byteLength(content)) > maxLength;
  }

  /**
   * Like {@link #wouldExceed(String)} for an opening tag, also counting the closing tag the new
   * element will need once it is on the stack.
   */
  public boolean wouldExceedOpening(String rawTag, String name) {
    int tagBytes = Utf8.byteLength(rawTag) + Utf8.byteLength(closingTag(name));
    return projectedLength(tagBytes) > maxLength;
  }

  /**
   * Like {@link #wouldExceed(String)} for a closing tag. When the tag closes the innermost open
   * element, it takes the place of that element's synthesized closing tag instead of adding to it.
   */
  public boolean wouldExceedClosing(String rawTag, String name) {
    int tagBytes = Utf8.byteLength(rawTag);
    int top = stack.size() - 1;
    if (top >= 0 && stack.get(top).equals(name)) {
      tagBytes -= Utf8.byteLength(closingTag(name));
    }
    return projectedLength(tagBytes) > maxLength;
  }

  /**
   * Closes the current fragment.
   *
   * @return the fragment with its closing tags appended, or an empty string if nothing was
   *     buffered
   */
  public String flush() {
    if (currentFragment.isEmpty()) {
      return "";
    }
    currentFragment.add(closingTags());
    return String.join("", currentFragment);
  }

  /** Resets the buffer to the re-opened ancestor markup, discarding the previous fragment. */
  public void startFragment() {
    String opening = tagHierarchy().opening();
    currentFragment.clear();
    currentFragment.add(opening);
    currentLength = Utf8.byteLength(opening);
    hasContent = false;
  }

  /** Appends text or markup verbatim. */
  public void addContent(String content) {
    currentFragment.add(content);
    currentLength += Utf8.byteLength(content);
    hasContent = true;
  }

  /**
   * Returns whether source content was appended since the fragment started. A buffer holding only
   * re-opened ancestors has no content.
   */
  public boolean hasContent() {
    return hasContent;
  }

  /** Pops the innermost open tag if it matches {@code name}; otherwise does nothing. */
  public void onClosingTag(String name) {
    int top = stack.size() - 1;
    if (top >= 0 && stack.get(top).equals(name)) {
      stack.remove(top);
      savedTags.remove(top);
    }
  }

  public void onOpeningTag(String rawTag, String name) {
    stack.add(name);
    savedTags.add(new SavedTag(rawTag, name));
  }

  public int maxLength() {
    return maxLength;
  }

  public int currentLength() {
    return currentLength;
  }

  /** Snapshot of the open tag names, outermost first. */
  public List<String> openTags() {
    return List.copyOf(stack);
  }

  /** Snapshot of the saved opening tags, outermost first. */
  public List<SavedTag> savedTags() {
    return List.copyOf(savedTags);
  }

  private int projectedLength(int additionalBytes) {
    return currentLength + additionalBytes + Utf8.byteLength(closingTags());
  }

  private String closingTags() {
    StringBuilder closing = new StringBuilder();
    for (int i = stack.size() - 1; i >= 0; i--) {
      closing.append(closingTag(stack.get(i)));
    }
    return closing.toString();
  }

  private static String closingTag(String name) {
    return "</" + name + ">";
  }
}
