package com.quantori.nqp.api.model;

import java.util.List;
import java.util.Objects;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A column criteria comparing a column with request values: equality, membership, array contains, array overlap and
 * boolean identity.
 *
 * <p>The value is a {@link String} for {@link Operator#EQUAL} and {@link Operator#CONTAINS}, a list of strings for
 * {@link Operator#IN} and {@link Operator#OVERLAP}, and a {@link Boolean} for {@link Operator#IS}.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode
public class FieldCriteria implements Criteria {

  public static final Operator DEFAULT_OPERATOR = Operator.EQUAL;

  private String column;
  private Operator operator = DEFAULT_OPERATOR;
  private Object value;

  public FieldCriteria(String column, Operator operator, Object value) {
    this.column = column;
    setOperator(operator);
    this.value = value;
  }

  public static FieldCriteria isTrue(String column) {
    return new FieldCriteria(column, Operator.IS, Boolean.TRUE);
  }

  public static FieldCriteria in(String column, List<String> values) {
    return new FieldCriteria(column, Operator.IN, List.copyOf(values));
  }

  public void setOperator(Operator operator) {
    this.operator = Objects.requireNonNullElse(operator, DEFAULT_OPERATOR);
  }

  public enum Operator {
    /** column = value */
    EQUAL,
    /** column in (values) */
    IN,
    /** value = any(array column) */
    CONTAINS,
    /** array column && values */
    OVERLAP,
    /** boolean column is value */
    IS;

    public boolean isArrayOperator() {
      return this == CONTAINS || this == OVERLAP;
    }
  }
}
