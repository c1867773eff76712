package dev.fragmenter.splitting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Streams plain text into fragments by greedy packing: whole sentences first, words when a single
 * sentence is larger than the budget.
 *
 * <p>Sentences end with {@code .}, {@code !} or {@code ?} followed by whitespace. Sentences and
 * words are re-joined with single spaces, so every fragment is trimmed and internal runs of
 * whitespace collapse. A word larger than the budget on its own is emitted as an oversized
 * fragment; words are never cut.
 */
final class TextSplitter extends FragmentIterator {

  private static final Pattern SENTENCE_BOUNDARY =
      Pattern.compile("(?<=[.!?])\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final int SEPARATOR_BYTES = 1;

  private final int maxLength;
  private final List<String> sentences;
  private final Deque<String> pending = new ArrayDeque<>();
  private final List<String> currentFragment = new ArrayList<>();
  private int currentLength;
  private int nextSentence;
  private List<String> words = List.of();
  private int nextWord;

  TextSplitter(String source, int maxLength) {
    this.maxLength = maxLength;
    this.sentences =
        Arrays.stream(SENTENCE_BOUNDARY.split(source))
            .map(UnicodeWhitespace::strip)
            .filter(sentence -> !sentence.isEmpty())
            .toList();
  }

  /**
   * Splits plain text into fragments of at most {@code maxLength} UTF-8 bytes.
   *
   * @param source the text to split; null or empty yields no fragments
   * @param maxLength byte budget per fragment; non-positive yields no fragments
   * @return lazy stream of trimmed fragments in source order
   */
  static Stream<String> split(@Nullable String source, int maxLength) {
    if (source == null || source.isEmpty() || maxLength <= 0) {
      return Stream.empty();
    }
    return new TextSplitter(source, maxLength).stream();
  }

  @Override
  protected @Nullable String computeNext() {
    while (true) {
      if (!pending.isEmpty()) {
        return pending.poll();
      }
      if (nextWord < words.size()) {
        return packWords();
      }
      if (nextSentence >= sentences.size()) {
        break;
      }
      accept(sentences.get(nextSentence++));
    }
    if (!currentFragment.isEmpty()) {
      return flushCurrent();
    }
    return null;
  }

  /** Fragments already computed but not yet handed out. */
  int bufferedFragments() {
    return pending.size();
  }

  private void accept(String sentence) {
    int sentenceLength = Utf8.byteLength(sentence);
    if (sentenceLength > maxLength) {
      // Emit what was packed before this sentence first, to keep source order
      if (!currentFragment.isEmpty()) {
        pending.add(flushCurrent());
      }
      words = Arrays.asList(WHITESPACE.split(sentence));
      nextWord = 0;
      return;
    }

    int joinedLength =
        currentFragment.isEmpty()
            ? sentenceLength
            : currentLength + SEPARATOR_BYTES + sentenceLength;
    if (joinedLength > maxLength) {
      pending.add(flushCurrent());
      currentFragment.add(sentence);
      currentLength = sentenceLength;
    } else {
      currentFragment.add(sentence);
      currentLength = joinedLength;
    }
  }

  /**
   * Packs the next words of an oversized sentence into one fragment, each word accounted with one
   * trailing separator. A single word over the budget makes a fragment of its own.
   */
  private String packWords() {
    List<String> packed = new ArrayList<>();
    int packedLength = 0;
    while (nextWord < words.size()) {
      String word = words.get(nextWord);
      int wordSize = Utf8.byteLength(word) + SEPARATOR_BYTES;
      if (packedLength + wordSize > maxLength && !packed.isEmpty()) {
        break;
      }
      packed.add(word);
      packedLength += wordSize;
      nextWord++;
    }
    return UnicodeWhitespace.strip(String.join(" ", packed));
  }

  private String flushCurrent() {
    String fragment = UnicodeWhitespace.strip(String.join(" ", currentFragment));
    currentFragment.clear();
    currentLength = 0;
    return fragment;
  }
}
