package com.github.flowmachine.expression;

/**
 * Binary operators. Equality and {@code +} switch to string semantics as soon as one side is a
 * string; relational and the other arithmetic operators are always numeric. Both operands are
 * always evaluated.
 */
final class BinaryNode implements Node {
  private final TokenType operator;
  private final Node left;
  private final Node right;

  BinaryNode(final TokenType operator, final Node left, final Node right) {
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  @Override
  public Value evaluate(final VariableLookup variables) {
    final Value lhs = left.evaluate(variables);
    final Value rhs = right.evaluate(variables);
    switch (operator) {
      case OR:
        return Value.of(lhs.isTruthy() | rhs.isTruthy());
      case AND:
        return Value.of(lhs.isTruthy() & rhs.isTruthy());
      case EQ:
        return Value.of(equal(lhs, rhs));
      case NE:
        return Value.of(!equal(lhs, rhs));
      case GT:
        return Value.of(lhs.asNumber() > rhs.asNumber());
      case LT:
        return Value.of(lhs.asNumber() < rhs.asNumber());
      case GE:
        return Value.of(lhs.asNumber() >= rhs.asNumber());
      case LE:
        return Value.of(lhs.asNumber() <= rhs.asNumber());
      case PLUS:
        if (lhs.isString() || rhs.isString()) {
          return Value.of(lhs.asString() + rhs.asString());
        }
        return Value.of(lhs.asNumber() + rhs.asNumber());
      case MINUS:
        return Value.of(lhs.asNumber() - rhs.asNumber());
      case STAR:
        return Value.of(lhs.asNumber() * rhs.asNumber());
      case SLASH:
        return Value.of(lhs.asNumber() / rhs.asNumber());
      case PERCENT:
        return Value.of(lhs.asNumber() % rhs.asNumber());
      default:
        throw new IllegalStateException("Not a binary operator: " + operator);
    }
  }

  private static boolean equal(final Value lhs, final Value rhs) {
    if (lhs.isString() || rhs.isString()) {
      return lhs.asString().equals(rhs.asString());
    }
    return lhs.asNumber() == rhs.asNumber();
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
