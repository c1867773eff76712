package dev.fragmenter.splitting;

import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for splitting content into byte-bounded fragments.
 *
 * <p>{@link #splitContent(Object, int)} classifies the source eagerly, then dispatches to the HTML
 * splitter (tag hierarchy preserved in every fragment) or the text splitter (sentence, then word
 * packing). Input errors are thrown before a stream is returned; fragments themselves are computed
 * only as the returned stream is consumed.
 *
 * <p>This bean is stateless: every call creates its own splitting state, so it can be shared.
 */
@Component
public class ContentSplitter {

  private static final Logger log = LoggerFactory.getLogger(ContentSplitter.class);

  private final ContentClassifier classifier;

  public ContentSplitter(ContentClassifier classifier) {
    this.classifier = classifier;
  }

  /**
   * Splits HTML or plain text, depending on what the source contains.
   *
   * @param source the content to split; must be a {@link String}
   * @param maxLength maximum UTF-8 byte length per fragment
   * @return lazy, single-use stream of fragments; empty for an empty source or a non-positive
   *     {@code maxLength}
   * @throws InvalidInputTypeException if {@code source} is not a string
   * @throws InvalidInputFormatException if the source could not be classified
   */
  public Stream<String> splitContent(@Nullable Object source, int maxLength) {
    String text = requireString(source);
    if (text.isEmpty() || maxLength <= 0) {
      return Stream.empty();
    }
    return switch (classifyText(text)) {
      case HTML -> splitHtmlContent(text, maxLength);
      case TEXT -> splitTextContent(text, maxLength);
    };
  }

  /**
   * Splits markup so that every fragment re-opens and closes the tags enclosing it.
   *
   * @param source the markup to split
   * @param maxLength maximum UTF-8 byte length per fragment, closing tags included
   * @return lazy, single-use stream of fragments
   */
  public Stream<String> splitHtmlContent(@Nullable String source, int maxLength) {
    return HtmlSplitter.split(source, maxLength);
  }

  /**
   * Splits prose at sentence boundaries, falling back to word boundaries for long sentences.
   *
   * @param source the text to split
   * @param maxLength maximum UTF-8 byte length per fragment
   * @return lazy, single-use stream of trimmed fragments
   */
  public Stream<String> splitTextContent(@Nullable String source, int maxLength) {
    return TextSplitter.split(source, maxLength);
  }

  /**
   * Detects whether the source is HTML or plain text, applying the same input checks as {@link
   * #splitContent(Object, int)}.
   *
   * @param source the content to classify; must be a {@link String}
   * @return the detected type
   */
  public FragmentType classify(@Nullable Object source) {
    return classifyText(requireString(source));
  }

  private FragmentType classifyText(String source) {
    FragmentType type;
    try {
      type = classifier.classify(source);
    } catch (RuntimeException e) {
      throw new InvalidInputFormatException("Invalid input format", e);
    }
    log.debug("Classified {} chars of content as {}", source.length(), type.value());
    return type;
  }

  private static String requireString(@Nullable Object source) {
    if (source instanceof String text) {
      return text;
    }
    String actual = source == null ? "null" : source.getClass().getName();
    throw new InvalidInputTypeException("Input must be a string, got: " + actual);
  }
}
