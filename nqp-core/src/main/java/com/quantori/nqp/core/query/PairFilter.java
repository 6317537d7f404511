package com.quantori.nqp.core.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Boolean argument restricting rows to a fixed set of (key, value) column pairs.
 */
public record PairFilter(String argument, String keyColumn, String valueColumn, Map<String, List<String>> pairs) {

  public PairFilter {
    pairs = Collections.unmodifiableMap(new TreeMap<>(pairs));
  }
}
