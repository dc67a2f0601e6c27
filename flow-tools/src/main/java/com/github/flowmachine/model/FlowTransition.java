package com.github.flowmachine.model;

import java.util.Objects;

/**
 * An edge between two states, addressed by their positions in {@link FlowModel#getStates()}. The
 * indices are not kept in sync when states are removed or reordered; they are checked when the
 * runtime is generated.
 */
public final class FlowTransition {
  private int fromState;
  private int toState;
  private String eventName = "";
  // guard expression source, empty means always true
  private String condition = "";

  public FlowTransition() {}

  public FlowTransition(final int fromState, final int toState, final String eventName,
      final String condition) {
    this.fromState = fromState;
    this.toState = toState;
    setEventName(eventName);
    setCondition(condition);
  }

  public int getFromState() {
    return fromState;
  }

  public void setFromState(final int fromState) {
    this.fromState = fromState;
  }

  public int getToState() {
    return toState;
  }

  public void setToState(final int toState) {
    this.toState = toState;
  }

  public String getEventName() {
    return eventName;
  }

  public void setEventName(final String eventName) {
    this.eventName = eventName == null ? "" : eventName;
  }

  public String getCondition() {
    return condition;
  }

  public void setCondition(final String condition) {
    this.condition = condition == null ? "" : condition;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowTransition)) {
      return false;
    }
    FlowTransition other = (FlowTransition) o;
    return fromState == other.fromState && toState == other.toState
        && eventName.equals(other.eventName) && condition.equals(other.condition);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, toState, eventName, condition);
  }

  @Override
  public String toString() {
    return "FlowTransition [fromState=" + fromState + ", toState=" + toState + ", eventName="
        + eventName + ", condition=" + condition + "]";
  }
}
