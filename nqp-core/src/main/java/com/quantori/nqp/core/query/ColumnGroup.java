package com.quantori.nqp.core.query;

import java.util.List;
import java.util.Set;

/**
 * Columns a WHERE argument is matched against. Per column predicates are OR'd, unless the request holds exactly one
 * value and that value is one of the conjunctive values, then every column must match.
 */
public record ColumnGroup(List<String> columns, Set<String> conjunctiveValues) {

  public ColumnGroup {
    columns = List.copyOf(columns);
    conjunctiveValues = Set.copyOf(conjunctiveValues);
  }

  public static ColumnGroup of(String... columns) {
    return new ColumnGroup(List.of(columns), Set.of());
  }

  public ColumnGroup conjunctiveFor(String... values) {
    return new ColumnGroup(columns, Set.of(values));
  }
}
