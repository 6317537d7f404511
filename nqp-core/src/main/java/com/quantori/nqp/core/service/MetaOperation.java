package com.quantori.nqp.core.service;

import com.quantori.nqp.api.model.QueryType;
import com.quantori.nqp.core.query.ArgumentSpec;
import com.quantori.nqp.core.query.QueryParameterMaps;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Requests describing the service itself rather than querying a table.
 */
public enum MetaOperation {
  /** Valid arguments and values of a query type. */
  QUERIES("queries"),
  /** Dataset tags of the interactions table. */
  DATASETS("datasets"),
  /** Resources of interaction datasets. */
  DATABASES("databases"),
  /** Registry entries enabled at the requested license tier. */
  RESOURCES("resources");

  private final String operationName;

  MetaOperation(String operationName) {
    this.operationName = operationName;
  }

  public String getOperationName() {
    return operationName;
  }

  public static Optional<MetaOperation> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(operation -> operation.operationName.equals(key)).findFirst();
  }

  /**
   * Accepted arguments, the common ones plus the {@code datasets} filter of {@link #RESOURCES}.
   */
  public List<ArgumentSpec> arguments() {
    var arguments = new ArrayList<>(QueryParameterMaps.commonArguments());
    if (this == RESOURCES) {
      arguments.add(ArgumentSpec.list(QueryParameterMaps.DATASETS,
          Arrays.stream(QueryType.values()).map(QueryType::getQueryName).toArray(String[]::new)));
    }
    return arguments;
  }
}
