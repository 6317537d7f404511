package com.quantori.nqp.core.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WithLastTest {

  @Test
  void emptySourceYieldsNothing() {
    WithLast<String> items = WithLast.of(List.<String>of().iterator());

    assertFalse(items.hasNext());
    assertThrows(NoSuchElementException.class, items::next);
  }

  @Test
  void singleElementIsLast() {
    WithLast<String> items = WithLast.of(List.of("a").iterator());

    assertEquals(new WithLast.Item<>("a", true), items.next());
    assertFalse(items.hasNext());
  }

  @Test
  void onlyFinalElementIsLast() {
    var result = new ArrayList<WithLast.Item<Integer>>();
    WithLast.of(List.of(1, 2, 3).iterator()).forEachRemaining(result::add);

    assertThat(result).containsExactly(
        new WithLast.Item<>(1, false), new WithLast.Item<>(2, false), new WithLast.Item<>(3, true));
  }

  @Test
  void readsOneElementAhead() {
    var pulled = new AtomicInteger();
    Iterator<Integer> source = new Iterator<>() {
      @Override
      public boolean hasNext() {
        return pulled.get() < 100;
      }

      @Override
      public Integer next() {
        return pulled.incrementAndGet();
      }
    };
    WithLast<Integer> items = WithLast.of(source);

    items.next();
    assertEquals(2, pulled.get());
    items.next();
    assertEquals(3, pulled.get());
  }
}
