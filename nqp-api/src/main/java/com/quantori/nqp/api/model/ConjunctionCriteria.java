package com.quantori.nqp.api.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A logical conjunction criteria providing logical "and" and logical "or" operations.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode
public class ConjunctionCriteria implements Criteria {

  public static final Operator DEFAULT_OPERATOR = Operator.AND;

  private List<Criteria> criteriaList;
  private Operator operator = DEFAULT_OPERATOR;

  /**
   * A simple view of criteria with two operands
   *
   * @param left     first (left) operand
   * @param right    second (right) operand
   * @param operator logical operator
   */
  public ConjunctionCriteria(Criteria left, Criteria right, Operator operator) {
    this.criteriaList = Arrays.asList(left, right);
    setOperator(operator);
  }

  public ConjunctionCriteria(List<Criteria> criteriaList, Operator operator) {
    this.criteriaList = criteriaList;
    setOperator(operator);
  }

  /**
   * Combines the operands, collapsing a single operand to itself.
   *
   * @return the combined criteria or null if there are no operands
   */
  public static Criteria of(List<Criteria> operands, Operator operator) {
    if (operands.isEmpty()) {
      return null;
    }
    if (operands.size() == 1) {
      return operands.get(0);
    }
    return new ConjunctionCriteria(List.copyOf(operands), operator);
  }

  public void setOperator(Operator operator) {
    this.operator = Objects.requireNonNullElse(operator, DEFAULT_OPERATOR);
  }

  public enum Operator {
    AND, OR
  }
}
