package com.quantori.nqp.api.model;

import java.util.Objects;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A criteria comparing two columns of the same row.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode
public class ColumnCriteria implements Criteria {

  public static final Operator DEFAULT_OPERATOR = Operator.NOT_EQUAL;

  private String left;
  private Operator operator = DEFAULT_OPERATOR;
  private String right;

  public ColumnCriteria(String left, Operator operator, String right) {
    this.left = left;
    setOperator(operator);
    this.right = right;
  }

  public void setOperator(Operator operator) {
    this.operator = Objects.requireNonNullElse(operator, DEFAULT_OPERATOR);
  }

  public enum Operator {
    EQUAL,
    NOT_EQUAL
  }
}
