package com.github.flowmachine.expression;

final class LiteralNode implements Node {
  private final Value value;

  LiteralNode(final Value value) {
    this.value = value;
  }

  @Override
  public Value evaluate(final VariableLookup variables) {
    return value;
  }

  @Override
  public String toString() {
    return value.isString() ? "\"" + value.asString() + "\"" : value.asString();
  }
}
