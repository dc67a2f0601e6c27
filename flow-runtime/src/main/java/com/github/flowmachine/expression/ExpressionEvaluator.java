package com.github.flowmachine.expression;

import com.github.flowmachine.FlowException;

/**
 * Entry points for one-off evaluation of guard source text. Callers that evaluate the same source
 * repeatedly should {@link #compile(String)} once and keep the tree.
 */
public final class ExpressionEvaluator {

  public static Node compile(final String source) throws FlowException {
    return ExpressionParser.parse(source);
  }

  public static Value evaluate(final String source, final VariableLookup variables)
      throws FlowException {
    return compile(source).evaluate(variables);
  }

  public static boolean test(final String source, final VariableLookup variables)
      throws FlowException {
    return evaluate(source, variables).isTruthy();
  }

  private ExpressionEvaluator() {}
}
