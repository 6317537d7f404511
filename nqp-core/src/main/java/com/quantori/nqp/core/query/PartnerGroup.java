package com.quantori.nqp.core.query;

import com.quantori.nqp.api.model.ConjunctionCriteria;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Two symmetric sides of a relation, e.g. source and target.
 */
@Value
@Builder
public class PartnerGroup {
  @NonNull
  String sideArgument;
  @NonNull
  String otherSideArgument;
  @Singular("sideColumn")
  List<String> sideColumns;
  @Singular("otherSideColumn")
  List<String> otherSideColumns;
  /**
   * Argument overriding the operator combining the two sides.
   */
  String operatorArgument;
  @Builder.Default
  ConjunctionCriteria.Operator defaultOperator = ConjunctionCriteria.Operator.OR;
  /**
   * Argument filling both sides when neither is given.
   */
  String partnersArgument;
  /**
   * Boolean argument allowing rows whose two sides are the same.
   */
  String loopsArgument;
  String loopColumn;
  String otherLoopColumn;
}
