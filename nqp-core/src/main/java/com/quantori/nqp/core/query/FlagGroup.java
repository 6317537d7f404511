package com.quantori.nqp.core.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Maps requested flag values to a disjunction of boolean columns.
 */
@Value
@Builder
public class FlagGroup {
  @NonNull
  String argument;
  @Singular("valueColumn")
  Map<String, List<String>> valueColumns;
  @Singular("override")
  Map<String, List<FlagOverride>> overrides;
  /**
   * Name of the requestable field expanding to the columns of the selected flags, null if there is none.
   */
  String fieldName;

  public List<String> columnsOf(String value) {
    return valueColumns.getOrDefault(value, List.of());
  }

  public List<FlagOverride> overridesOf(String value) {
    return overrides.getOrDefault(value, List.of());
  }

  public Set<String> allColumns() {
    var columns = new LinkedHashSet<String>();
    valueColumns.values().forEach(columns::addAll);
    return columns;
  }
}
