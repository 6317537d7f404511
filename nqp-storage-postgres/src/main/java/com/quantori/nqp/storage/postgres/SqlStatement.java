package com.quantori.nqp.storage.postgres;

import java.util.List;

/**
 * A parameterized statement. Parameters are bound in order, {@link SqlArray} parameters as SQL arrays.
 */
public record SqlStatement(String sql, List<Object> parameters) {

  public SqlStatement {
    parameters = List.copyOf(parameters);
  }

  /**
   * Array parameter, created from the connection at bind time.
   *
   * @param elementType SQL type name of the elements
   * @param values      elements
   */
  public record SqlArray(String elementType, List<Object> values) {

    public SqlArray {
      values = List.copyOf(values);
    }
  }
}
