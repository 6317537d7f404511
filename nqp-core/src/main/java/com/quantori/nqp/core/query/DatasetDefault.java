package com.quantori.nqp.core.query;

import java.util.List;
import java.util.Set;

/**
 * Flag values assumed when none of the narrowing arguments is given, so a query never scans a table unfiltered by
 * accident.
 */
public record DatasetDefault(String argument, Set<String> unlessPresent, List<String> values) {

  public DatasetDefault {
    unlessPresent = Set.copyOf(unlessPresent);
    values = List.copyOf(values);
  }
}
