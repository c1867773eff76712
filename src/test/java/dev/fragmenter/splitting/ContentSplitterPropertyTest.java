package dev.fragmenter.splitting;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/**
 * Property-based tests for the splitting invariants using jqwik.
 *
 * <p>HTML documents are generated with at most three levels of nesting and short units, and budgets
 * are chosen so that the re-opened ancestors plus any single tag or text run always fit. Under
 * those conditions every fragment must respect the budget, be balanced on its own, and the text
 * runs must survive in order. Plain text is generated from sentences of short words, mixing
 * multi-byte characters.
 */
class ContentSplitterPropertyTest {

  private static final Pattern TAG = Pattern.compile("<[^>]*>");

  private final ContentSplitter splitter = new ContentSplitter(new ContentClassifier());

  // =========================================================================
  // HTML Arbitrary Generator
  // =========================================================================

  @Provide
  Arbitrary<String> htmlDocuments() {
    return element(3);
  }

  private Arbitrary<String> element(int depth) {
    return Combinators.combine(openingTag(), children(depth))
        .as((tag, content) -> tag.raw() + content + "</" + tag.name() + ">");
  }

  private Arbitrary<String> children(int depth) {
    return Arbitraries.integers()
        .between(1, 4)
        .flatMap(
            count -> {
              List<Arbitrary<String>> parts = new ArrayList<>();
              for (int i = 0; i < count; i++) {
                parts.add(child(depth));
              }
              return Combinators.combine(parts).as(list -> String.join("", list));
            });
  }

  private Arbitrary<String> child(int depth) {
    if (depth <= 1) {
      return Arbitraries.oneOf(textRun(), standaloneTag(), whitespace());
    }
    return Arbitraries.oneOf(textRun(), standaloneTag(), whitespace(), element(depth - 1));
  }

  private Arbitrary<Tag> openingTag() {
    return Combinators.combine(
            Arbitraries.of("div", "p", "span", "b", "em", "li"),
            Arbitraries.of("", " class=\"note\"", " id=\"x1\""))
        .as((name, attributes) -> new Tag("<" + name + attributes + ">", name));
  }

  private Arbitrary<String> standaloneTag() {
    return Arbitraries.of("<br/>", "<br>", "<hr />", "<!-- c -->");
  }

  private Arbitrary<String> whitespace() {
    return Arbitraries.of("\n", "  ", "\n    ");
  }

  private Arbitrary<String> textRun() {
    return Arbitraries.of(
        "Hello",
        " world ",
        "Text runs stay whole.",
        "naïve café",
        "日本語のテキスト",
        "emoji 👋 here",
        "a & b",
        "x");
  }

  private record Tag(String raw, String name) {}

  // =========================================================================
  // Plain Text Arbitrary Generator
  // =========================================================================

  @Provide
  Arbitrary<String> textDocuments() {
    return sentence()
        .list()
        .ofMinSize(1)
        .ofMaxSize(12)
        .flatMap(
            sentences ->
                Arbitraries.of(" ", "\n", "  ", "\n\n")
                    .list()
                    .ofSize(sentences.size())
                    .map(
                        separators -> {
                          StringBuilder sb = new StringBuilder();
                          for (int i = 0; i < sentences.size(); i++) {
                            sb.append(sentences.get(i)).append(separators.get(i));
                          }
                          return sb.toString();
                        }));
  }

  @Provide
  Arbitrary<String> singleSpacedText() {
    return sentence().list().ofMinSize(1).ofMaxSize(6).map(list -> String.join(" ", list));
  }

  private Arbitrary<String> sentence() {
    return Combinators.combine(
            word().list().ofMinSize(1).ofMaxSize(10), Arbitraries.of(".", "!", "?"))
        .as((words, end) -> String.join(" ", words) + end);
  }

  private Arbitrary<String> word() {
    return Arbitraries.of(
        "the", "quick", "brown", "fox", "jumps", "over", "lazy", "dog", "über", "naïve", "日本",
        "👋", "configuration", "a");
  }

  // =========================================================================
  // HTML Properties
  // =========================================================================

  @Property(tries = 300)
  void htmlFragmentsRespectTheBudget(
      @ForAll("htmlDocuments") String html, @ForAll @IntRange(min = 150, max = 400) int maxLength) {
    List<String> fragments = splitter.splitHtmlContent(html, maxLength).toList();

    assertThat(fragments).isNotEmpty();
    for (String fragment : fragments) {
      assertThat(bytes(fragment))
          .as("Fragment exceeds %d bytes: %s", maxLength, fragment)
          .isLessThanOrEqualTo(maxLength);
    }
  }

  @Property(tries = 300)
  void everyHtmlFragmentIsBalanced(
      @ForAll("htmlDocuments") String html, @ForAll @IntRange(min = 150, max = 400) int maxLength) {
    for (String fragment : splitter.splitHtmlContent(html, maxLength).toList()) {
      assertThat(isBalanced(fragment)).as("Unbalanced fragment: %s", fragment).isTrue();
    }
  }

  @Property(tries = 300)
  void htmlTextRunsAreConservedInOrder(
      @ForAll("htmlDocuments") String html, @ForAll @IntRange(min = 150, max = 400) int maxLength) {
    List<String> fragments = splitter.splitHtmlContent(html, maxLength).toList();

    List<String> expected = textRuns(html);
    List<String> actual = new ArrayList<>();
    fragments.forEach(fragment -> actual.addAll(textRuns(fragment)));

    assertThat(actual).isEqualTo(expected);
  }

  @Property(tries = 300)
  void laterFragmentsReopenTheOutermostElementVerbatim(
      @ForAll("htmlDocuments") String html, @ForAll @IntRange(min = 150, max = 400) int maxLength) {
    List<String> fragments = splitter.splitHtmlContent(html, maxLength).toList();
    String rootTag = html.substring(0, html.indexOf('>') + 1);

    // the generated root encloses everything, so it is open at every split point
    for (String fragment : fragments) {
      assertThat(fragment).startsWith(rootTag);
    }
  }

  @Property(tries = 200)
  void htmlWithinBudgetIsReturnedAsOneFragment(@ForAll("htmlDocuments") String html) {
    List<String> fragments = splitter.splitHtmlContent(html, bytes(html)).toList();

    assertThat(fragments).hasSize(1);
    assertThat(textRuns(fragments.get(0))).isEqualTo(textRuns(html));
  }

  @Property(tries = 200)
  void htmlDocumentsAreRoutedToTheHtmlSplitter(
      @ForAll("htmlDocuments") String html, @ForAll @IntRange(min = 150, max = 400) int maxLength) {
    assertThat(splitter.splitContent(html, maxLength).toList())
        .isEqualTo(splitter.splitHtmlContent(html, maxLength).toList());
  }

  // =========================================================================
  // Text Properties
  // =========================================================================

  @Property(tries = 300)
  void textFragmentsRespectTheBudget(
      @ForAll("textDocuments") String text, @ForAll @IntRange(min = 20, max = 120) int maxLength) {
    for (String fragment : splitter.splitTextContent(text, maxLength).toList()) {
      assertThat(bytes(fragment))
          .as("Fragment exceeds %d bytes: %s", maxLength, fragment)
          .isLessThanOrEqualTo(maxLength);
    }
  }

  @Property(tries = 300)
  void textWordsAreConservedInOrder(
      @ForAll("textDocuments") String text, @ForAll @IntRange(min = 1, max = 120) int maxLength) {
    List<String> fragments = splitter.splitTextContent(text, maxLength).toList();

    List<String> actual = new ArrayList<>();
    fragments.forEach(fragment -> actual.addAll(words(fragment)));

    assertThat(actual).isEqualTo(words(text));
  }

  @Property(tries = 300)
  void textFragmentsAreTrimmedAndNonEmpty(
      @ForAll("textDocuments") String text, @ForAll @IntRange(min = 1, max = 120) int maxLength) {
    for (String fragment : splitter.splitTextContent(text, maxLength).toList()) {
      assertThat(fragment).isNotBlank().isEqualTo(fragment.strip());
    }
  }

  @Property(tries = 200)
  void textWithinBudgetIsReturnedAsOneFragment(@ForAll("singleSpacedText") String text) {
    assertThat(splitter.splitTextContent(text, bytes(text)).toList()).containsExactly(text.strip());
  }

  @Property(tries = 100)
  void nonPositiveBudgetYieldsNothing(
      @ForAll("textDocuments") String text, @ForAll @IntRange(min = -100, max = 0) int maxLength) {
    assertThat(splitter.splitContent(text, maxLength)).isEmpty();
    assertThat(splitter.splitTextContent(text, maxLength)).isEmpty();
    assertThat(splitter.splitHtmlContent(text, maxLength)).isEmpty();
  }

  // =========================================================================
  // Helpers
  // =========================================================================

  private static int bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8).length;
  }

  private static List<String> words(String text) {
    String stripped = text.strip();
    if (stripped.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(stripped.split("\\s+"));
  }

  /** Non-blank text between tags, in document order. */
  private static List<String> textRuns(String html) {
    List<String> runs = new ArrayList<>();
    for (String run : TAG.split(html)) {
      if (!run.isBlank()) {
        runs.add(run);
      }
    }
    return runs;
  }

  /** Every closing tag matches the innermost open element and nothing is left open. */
  private static boolean isBalanced(String fragment) {
    Deque<String> open = new ArrayDeque<>();
    Matcher matcher = TAG.matcher(fragment);
    while (matcher.find()) {
      String tag = matcher.group();
      String content = tag.substring(1, tag.length() - 1);
      if (content.startsWith("!") || content.endsWith("/") || content.isEmpty()) {
        continue;
      }
      String name = content.split("\\s+")[0];
      if (name.equals("br") || name.equals("hr")) {
        continue;
      }
      if (content.startsWith("/")) {
        if (open.isEmpty() || !open.pop().equals(name.substring(1))) {
          return false;
        }
      } else {
        open.push(name);
      }
    }
    return open.isEmpty();
  }
}
