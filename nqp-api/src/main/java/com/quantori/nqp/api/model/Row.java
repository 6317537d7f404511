package com.quantori.nqp.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A result row, values aligned with the columns of the compiled query. Array columns hold {@code List<String>},
 * json columns hold maps or lists, booleans hold {@link Boolean}, integers hold {@link Integer}.
 *
 * @param values column values, may contain nulls
 */
public record Row(List<Object> values) {

  public Row {
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static Row of(Object... values) {
    return new Row(Arrays.asList(values));
  }

  public Object get(int index) {
    return values.get(index);
  }

  public int size() {
    return values.size();
  }

  /**
   * Copy of this row with one value replaced.
   */
  public Row with(int index, Object value) {
    var copy = new ArrayList<>(values);
    copy.set(index, value);
    return new Row(copy);
  }
}
