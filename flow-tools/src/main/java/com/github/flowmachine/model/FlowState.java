package com.github.flowmachine.model;

import java.util.Objects;

/**
 * A state of the flow's event-driven machine. Hook fields hold action names resolved by the
 * runtime's action registry; an empty name means no hook. The position is only used by the editor.
 */
public final class FlowState {
  private String name = "";
  private String onEnter = "";
  private String onExit = "";
  private float x;
  private float y;

  public FlowState() {}

  public FlowState(final String name, final String onEnter, final String onExit) {
    setName(name);
    setOnEnter(onEnter);
    setOnExit(onExit);
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name == null ? "" : name;
  }

  public String getOnEnter() {
    return onEnter;
  }

  public void setOnEnter(final String onEnter) {
    this.onEnter = onEnter == null ? "" : onEnter;
  }

  public String getOnExit() {
    return onExit;
  }

  public void setOnExit(final String onExit) {
    this.onExit = onExit == null ? "" : onExit;
  }

  public float getX() {
    return x;
  }

  public float getY() {
    return y;
  }

  public void setPosition(final float x, final float y) {
    this.x = x;
    this.y = y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowState)) {
      return false;
    }
    FlowState other = (FlowState) o;
    return Float.compare(x, other.x) == 0 && Float.compare(y, other.y) == 0
        && name.equals(other.name) && onEnter.equals(other.onEnter)
        && onExit.equals(other.onExit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, onEnter, onExit, x, y);
  }

  @Override
  public String toString() {
    return "FlowState [name=" + name + ", onEnter=" + onEnter + ", onExit=" + onExit + ", x=" + x
        + ", y=" + y + "]";
  }
}
