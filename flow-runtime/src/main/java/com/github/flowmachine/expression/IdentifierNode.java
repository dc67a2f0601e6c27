package com.github.flowmachine.expression;

final class IdentifierNode implements Node {
  private final String name;

  IdentifierNode(final String name) {
    this.name = name;
  }

  /**
   * Unbound names read as 0.
   */
  @Override
  public Value evaluate(final VariableLookup variables) {
    final Value value = variables == null ? null : variables.resolve(name);
    return value == null ? Value.ZERO : value;
  }

  @Override
  public String toString() {
    return name;
  }
}
