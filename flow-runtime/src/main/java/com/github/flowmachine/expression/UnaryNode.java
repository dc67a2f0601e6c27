package com.github.flowmachine.expression;

final class UnaryNode implements Node {
  private final TokenType operator;
  private final Node operand;

  UnaryNode(final TokenType operator, final Node operand) {
    this.operator = operator;
    this.operand = operand;
  }

  @Override
  public Value evaluate(final VariableLookup variables) {
    final Value value = operand.evaluate(variables);
    if (operator == TokenType.MINUS) {
      return Value.of(-value.asNumber());
    }
    return Value.of(!value.isTruthy());
  }

  @Override
  public String toString() {
    return "(" + operator.getSymbol() + operand + ")";
  }
}
