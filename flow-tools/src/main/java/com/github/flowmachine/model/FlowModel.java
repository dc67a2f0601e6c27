package com.github.flowmachine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The authoring model of one flow: an event-driven state machine plus a looping timed sequence,
 * the key bindings that feed events into it and the variables its guards read.
 *
 * Notes for users:<br>
 * 1. this is a plain data holder mutated directly by the editor; it has no behavior and performs
 * no validation<br>
 *
 * 2. the lists are owned outright and returned live, so callers add, remove and reorder entries
 * in place. Removing a state does not touch the transitions that reference it<br>
 *
 * 3. it is not thread-safe; the editor mutates it from its UI thread only<br>
 */
public final class FlowModel {
  public static final int CURRENT_VERSION = 1;

  private String name = "";
  private int version = CURRENT_VERSION;
  private final List<FlowState> states = new ArrayList<>();
  private final List<FlowTransition> transitions = new ArrayList<>();
  private final List<FlowSequenceStep> steps = new ArrayList<>();
  private final List<FlowEventTrigger> triggers = new ArrayList<>();
  private final List<FlowVariable> variables = new ArrayList<>();

  public FlowModel() {}

  public FlowModel(final String name) {
    setName(name);
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name == null ? "" : name;
  }

  public int getVersion() {
    return version;
  }

  public void setVersion(final int version) {
    this.version = version;
  }

  public List<FlowState> getStates() {
    return states;
  }

  public List<FlowTransition> getTransitions() {
    return transitions;
  }

  public List<FlowSequenceStep> getSteps() {
    return steps;
  }

  public List<FlowEventTrigger> getTriggers() {
    return triggers;
  }

  public List<FlowVariable> getVariables() {
    return variables;
  }

  public FlowModel addState(final FlowState state) {
    states.add(state);
    return this;
  }

  public FlowModel addTransition(final FlowTransition transition) {
    transitions.add(transition);
    return this;
  }

  public FlowModel addStep(final FlowSequenceStep step) {
    steps.add(step);
    return this;
  }

  public FlowModel addTrigger(final FlowEventTrigger trigger) {
    triggers.add(trigger);
    return this;
  }

  public FlowModel addVariable(final FlowVariable variable) {
    variables.add(variable);
    return this;
  }

  public void clear() {
    name = "";
    version = CURRENT_VERSION;
    states.clear();
    transitions.clear();
    steps.clear();
    triggers.clear();
    variables.clear();
  }

  /**
   * Drop everything held here and take over the content of the other model.
   */
  public void replaceWith(final FlowModel other) {
    if (other == this) {
      return;
    }
    clear();
    name = other.name;
    version = other.version;
    states.addAll(other.states);
    transitions.addAll(other.transitions);
    steps.addAll(other.steps);
    triggers.addAll(other.triggers);
    variables.addAll(other.variables);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowModel)) {
      return false;
    }
    FlowModel other = (FlowModel) o;
    return version == other.version && name.equals(other.name) && states.equals(other.states)
        && transitions.equals(other.transitions) && steps.equals(other.steps)
        && triggers.equals(other.triggers) && variables.equals(other.variables);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, version, states, transitions, steps, triggers, variables);
  }

  @Override
  public String toString() {
    return "FlowModel [name=" + name + ", version=" + version + ", states=" + states.size()
        + ", transitions=" + transitions.size() + ", steps=" + steps.size() + ", triggers="
        + triggers.size() + ", variables=" + variables.size() + "]";
  }
}
