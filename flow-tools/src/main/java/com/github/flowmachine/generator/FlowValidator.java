package com.github.flowmachine.generator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.flowmachine.FlowException;
import com.github.flowmachine.FlowException.Code;
import com.github.flowmachine.model.FlowModel;
import com.github.flowmachine.model.FlowSequenceStep;
import com.github.flowmachine.model.FlowTransition;
import com.github.flowmachine.model.FlowVariable;
import com.github.flowmachine.model.VariableType;
import com.github.flowmachine.runtime.TransitionGuard;

/**
 * Checks the structural rules the editor does not enforce while authoring. Every problem found is
 * reported in a single {@link FlowException} so the user can fix them in one pass.
 */
public final class FlowValidator {

  public static void validate(final FlowModel model) throws FlowException {
    final StringBuilder messages = new StringBuilder();
    final int stateCount = model.getStates().size();

    final List<FlowTransition> transitions = model.getTransitions();
    for (int i = 0; i < transitions.size(); i++) {
      final FlowTransition transition = transitions.get(i);
      if (!inRange(transition.getFromState(), stateCount)) {
        messages.append(String.format("Transition %d starts at missing state %d. ", i,
            transition.getFromState()));
      }
      if (!inRange(transition.getToState(), stateCount)) {
        messages.append(String.format("Transition %d ends at missing state %d. ", i,
            transition.getToState()));
      }
      try {
        TransitionGuard.compile(transition.getCondition());
      } catch (FlowException problem) {
        messages.append(String.format("Transition %d has a bad condition: %s. ", i,
            problem.getMessage()));
      }
    }

    for (final FlowSequenceStep step : model.getSteps()) {
      final double duration = step.getDuration();
      if (duration < 0.0 || Double.isNaN(duration) || Double.isInfinite(duration)) {
        messages.append(String.format("Step %s has invalid duration %s. ", step.getName(),
            Double.toString(duration)));
      }
    }

    final Set<String> variableNames = new HashSet<>();
    for (final FlowVariable variable : model.getVariables()) {
      if (!variableNames.add(variable.getName())) {
        messages.append(String.format("Variable %s is declared more than once. ",
            variable.getName()));
      }
      if (variable.getType() == VariableType.NUMBER
          && (Double.isNaN(variable.getNumberValue())
              || Double.isInfinite(variable.getNumberValue()))) {
        messages.append(String.format("Variable %s has non-finite value %s. ",
            variable.getName(), Double.toString(variable.getNumberValue())));
      }
    }

    if (messages.length() > 0) {
      throw new FlowException(Code.INVALID_MODEL, messages.toString().trim());
    }
  }

  private static boolean inRange(final int index, final int size) {
    return index >= 0 && index < size;
  }

  private FlowValidator() {}
}
