package com.github.flowmachine.expression;

/**
 * Source of identifier values during evaluation.
 */
public interface VariableLookup {

  /**
   * Returns the value bound to the name, or null if nothing is bound.
   */
  Value resolve(final String name);

  /**
   * A lookup with nothing bound.
   */
  VariableLookup EMPTY = new VariableLookup() {
    @Override
    public Value resolve(final String name) {
      return null;
    }
  };
}
