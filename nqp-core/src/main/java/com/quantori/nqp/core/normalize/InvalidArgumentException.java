package com.quantori.nqp.core.normalize;

import java.util.List;
import lombok.Getter;

/**
 * Request arguments that cannot be turned into a query: unknown argument names, values outside of a closed
 * vocabulary, unparsable numbers or booleans. The message is meant to be shown to the client as is.
 */
@Getter
public class InvalidArgumentException extends RuntimeException {

  static final String HEADLINE = "Something is not entirely good:";
  static final String HELP = "Please check the valid arguments and their values at the `queries` endpoint.";

  private final List<String> problems;

  public InvalidArgumentException(List<String> problems) {
    super(describe(problems));
    this.problems = List.copyOf(problems);
  }

  /**
   * A single problem explained by a complete message.
   *
   * @param message client facing explanation
   */
  public InvalidArgumentException(String message) {
    super(message);
    this.problems = List.of(message);
  }

  private static String describe(List<String> problems) {
    var message = new StringBuilder(HEADLINE).append('\n');
    problems.forEach(problem -> message.append(" ==> ").append(problem).append('\n'));
    return message.append('\n').append(HELP).toString();
  }
}
