package dev.fragmenter.splitting;

import java.util.Objects;

/**
 * An opening tag exactly as it appeared in the source, kept so it can be re-emitted with its
 * attributes at the start of the next fragment.
 *
 * @param rawTag the literal markup, brackets included
 * @param name the tag name used for matching closing tags
 */
public record SavedTag(String rawTag, String name) {
  public SavedTag {
    Objects.requireNonNull(rawTag, "rawTag must not be null");
    Objects.requireNonNull(name, "name must not be null");
  }
}
