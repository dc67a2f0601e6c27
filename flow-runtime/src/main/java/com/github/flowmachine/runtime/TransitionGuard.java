package com.github.flowmachine.runtime;

import java.util.Optional;
import java.util.function.BooleanSupplier;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.expression.ExpressionParser;
import com.github.flowmachine.expression.Node;
import com.github.flowmachine.expression.Value;

/**
 * Compiled form of a transition condition.
 *
 * An empty condition always passes. A condition free of operator characters, other than the
 * literals {@code true} and {@code false}, is a bare name and skips the parser: it asks the
 * registered condition callbacks first, then reads a bool variable, then tests a number variable
 * for non-zero. A number such as {@code 5} is a bare name too and passes only if something is
 * registered under it. Anything else is parsed once here and evaluated per check.
 */
public abstract class TransitionGuard {
  private static final String operatorCharacters = "><=!&|()\"";
  private static final String arithmeticCharacters = "+-*/%";

  public static final TransitionGuard ALWAYS = new TransitionGuard("") {
    @Override
    public boolean test(final ActionRegistry actions, final VariableStore variables) {
      return true;
    }
  };

  private final String source;

  private TransitionGuard(final String source) {
    this.source = source;
  }

  public String getSource() {
    return source;
  }

  public abstract boolean test(final ActionRegistry actions, final VariableStore variables);

  public static TransitionGuard compile(final String condition) throws FlowException {
    final String trimmed = condition == null ? "" : condition.trim();
    if (trimmed.isEmpty()) {
      return ALWAYS;
    }
    if (isBareIdentifier(trimmed)) {
      return new IdentifierGuard(trimmed);
    }
    return new ExpressionGuard(trimmed, ExpressionParser.parse(trimmed));
  }

  static boolean isBareIdentifier(final String condition) {
    for (int i = 0; i < condition.length(); i++) {
      final char c = condition.charAt(i);
      if (operatorCharacters.indexOf(c) >= 0 || arithmeticCharacters.indexOf(c) >= 0) {
        return false;
      }
    }
    return !"true".equals(condition) && !"false".equals(condition);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [" + source + "]";
  }

  private static final class IdentifierGuard extends TransitionGuard {
    private IdentifierGuard(final String name) {
      super(name);
    }

    @Override
    public boolean test(final ActionRegistry actions, final VariableStore variables) {
      final Optional<BooleanSupplier> callback = actions.findCondition(getSource());
      if (callback.isPresent()) {
        return callback.get().getAsBoolean();
      }
      final Value value = variables.resolve(getSource());
      if (value == null) {
        return false;
      }
      switch (value.getType()) {
        case BOOL:
        case NUMBER:
          return value.isTruthy();
        default:
          return false;
      }
    }
  }

  private static final class ExpressionGuard extends TransitionGuard {
    private final Node root;

    private ExpressionGuard(final String source, final Node root) {
      super(source);
      this.root = root;
    }

    @Override
    public boolean test(final ActionRegistry actions, final VariableStore variables) {
      return root.evaluate(variables).isTruthy();
    }
  }
}
