package com.quantori.nqp.core.format;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy sequence of result units holding a resource released by {@link #close()}.
 *
 * @param <T> unit type
 */
public interface ResultStream<T> extends Iterator<T>, Closeable {

  static <T> ResultStream<T> of(Iterator<T> iterator, Closeable resource) {
    return new ResultStream<>() {
      @Override
      public boolean hasNext() {
        return iterator.hasNext();
      }

      @Override
      public T next() {
        return iterator.next();
      }

      @Override
      public void close() throws IOException {
        resource.close();
      }
    };
  }

  static <T> ResultStream<T> of(List<T> values) {
    return of(values.iterator(), () -> {
    });
  }

  static <T> ResultStream<T> empty() {
    return of(List.of());
  }

  /**
   * Lazily mapped stream closing the same resource.
   */
  default <R> ResultStream<R> map(Function<? super T, ? extends R> mapper) {
    ResultStream<T> self = this;
    return new ResultStream<>() {
      @Override
      public boolean hasNext() {
        return self.hasNext();
      }

      @Override
      public R next() {
        if (!self.hasNext()) {
          throw new NoSuchElementException();
        }
        return mapper.apply(self.next());
      }

      @Override
      public void close() throws IOException {
        self.close();
      }
    };
  }

  /**
   * Same resource, different iterator over it.
   */
  default <R> ResultStream<R> with(Iterator<R> iterator) {
    return of(iterator, this);
  }
}
