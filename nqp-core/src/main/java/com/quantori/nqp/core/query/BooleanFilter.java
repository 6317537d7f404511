package com.quantori.nqp.core.query;

import java.util.List;

/**
 * Boolean argument filtering on boolean columns.
 *
 * @param columns      OR'd boolean columns
 * @param defaultValue value used when the argument is absent, null for no filtering
 * @param exact        if true the columns must equal the requested value, otherwise only a true value filters
 */
public record BooleanFilter(List<String> columns, Boolean defaultValue, boolean exact) {

  public BooleanFilter {
    columns = List.copyOf(columns);
  }

  public static BooleanFilter whenTrue(Boolean defaultValue, String... columns) {
    return new BooleanFilter(List.of(columns), defaultValue, false);
  }

  public static BooleanFilter exact(String column) {
    return new BooleanFilter(List.of(column), null, true);
  }
}
