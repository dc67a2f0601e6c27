package com.github.flowmachine.expression;

/**
 * A node of a parsed guard expression. Evaluation has no side effects, so a tree may be evaluated
 * any number of times against different variable bindings.
 */
public interface Node {

  Value evaluate(final VariableLookup variables);
}
