package com.quantori.nqp.core.query;

import com.quantori.nqp.api.model.ColumnDefinition;
import com.quantori.nqp.api.model.FieldCriteria;
import java.util.Collection;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Chooses the comparison of a column with a request value from the column kind and the value shape only.
 */
@UtilityClass
public class OperatorInference {

  public FieldCriteria.Operator infer(ColumnDefinition column, Object value) {
    boolean many = value instanceof Collection<?>;
    if (column.isArray()) {
      return many ? FieldCriteria.Operator.OVERLAP : FieldCriteria.Operator.CONTAINS;
    }
    if (column.isBoolean() && value instanceof Boolean) {
      return FieldCriteria.Operator.IS;
    }
    return many ? FieldCriteria.Operator.IN : FieldCriteria.Operator.EQUAL;
  }

  public FieldCriteria criteria(ColumnDefinition column, Object value) {
    Object operand = value instanceof Collection<?> values ? List.copyOf(values) : value;
    return new FieldCriteria(column.name(), infer(column, value), operand);
  }
}
