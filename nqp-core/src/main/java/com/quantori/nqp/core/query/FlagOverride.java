package com.quantori.nqp.core.query;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replacement of the plain boolean check of one flag value, triggered by a sibling argument.
 *
 * @param triggerArgument argument whose presence triggers the override
 * @param kind            shape of the replacing predicate
 * @param column          array column matched against the trigger values, for {@link Kind#ARRAY_MEMBERSHIP}
 * @param valueColumns    trigger value to boolean column, for {@link Kind#BOOLEAN_COLUMNS}
 * @param defaultValues   trigger values assumed when the flag is selected without the trigger argument
 */
public record FlagOverride(String triggerArgument, Kind kind, String column, Map<String, String> valueColumns,
                           List<String> defaultValues) {

  public FlagOverride {
    Objects.requireNonNull(triggerArgument, "triggerArgument");
    Objects.requireNonNull(kind, "kind");
    valueColumns = Map.copyOf(valueColumns);
    defaultValues = List.copyOf(defaultValues);
  }

  public static FlagOverride arrayMembership(String triggerArgument, String column, List<String> defaultValues) {
    return new FlagOverride(triggerArgument, Kind.ARRAY_MEMBERSHIP, column, Map.of(), defaultValues);
  }

  public static FlagOverride booleanColumns(String triggerArgument, Map<String, String> valueColumns) {
    return new FlagOverride(triggerArgument, Kind.BOOLEAN_COLUMNS, null, valueColumns, List.of());
  }

  public enum Kind {
    ARRAY_MEMBERSHIP,
    BOOLEAN_COLUMNS
  }
}
