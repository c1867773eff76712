package dev.fragmenter.splitting;

import java.util.Objects;

/**
 * Markup needed to make a fragment self-contained at the current scan position.
 *
 * @param opening saved raw opening tags, outermost first (e.g. {@code <div class="a"><p>})
 * @param closing synthesized closing tags, innermost first (e.g. {@code </p></div>})
 */
public record TagHierarchy(String opening, String closing) {
  public TagHierarchy {
    Objects.requireNonNull(opening, "opening must not be null");
    Objects.requireNonNull(closing, "closing must not be null");
  }
}
