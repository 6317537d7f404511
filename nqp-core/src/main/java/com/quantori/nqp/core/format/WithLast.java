package com.quantori.nqp.core.format;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Marks the last element of an iterator. Reads at most one element ahead of the element returned.
 *
 * @param <T> element type
 */
public class WithLast<T> implements Iterator<WithLast.Item<T>> {

  private final Iterator<T> source;
  private T pending;
  private boolean hasPending;

  public WithLast(Iterator<T> source) {
    this.source = source;
  }

  public static <T> WithLast<T> of(Iterator<T> source) {
    return new WithLast<>(source);
  }

  @Override
  public boolean hasNext() {
    return hasPending || source.hasNext();
  }

  @Override
  public Item<T> next() {
    if (!hasPending) {
      if (!source.hasNext()) {
        throw new NoSuchElementException();
      }
      pending = source.next();
    }
    T current = pending;
    hasPending = source.hasNext();
    pending = hasPending ? source.next() : null;
    return new Item<>(current, !hasPending);
  }

  /**
   * An element and whether it is the final one.
   */
  public record Item<T>(T value, boolean last) {
  }
}
