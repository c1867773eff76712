package dev.fragmenter.splitting;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jspecify.annotations.Nullable;

/**
 * Base for the lazy fragment producers. Subclasses compute one fragment per {@link #computeNext()}
 * call, so nothing past the last pulled fragment is ever scanned.
 */
abstract class FragmentIterator implements Iterator<String> {

  private @Nullable String next;
  private boolean done;

  /**
   * Computes the next fragment.
   *
   * @return the fragment, or null when the source is exhausted
   */
  protected abstract @Nullable String computeNext();

  @Override
  public boolean hasNext() {
    if (next == null && !done) {
      next = computeNext();
      done = next == null;
    }
    return next != null;
  }

  @Override
  public String next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    String fragment = next;
    next = null;
    return fragment;
  }

  /** Wraps this iterator in a sequential, ordered, single-use stream. */
  Stream<String> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            this, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
        false);
  }
}
