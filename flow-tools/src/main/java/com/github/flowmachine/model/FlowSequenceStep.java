package com.github.flowmachine.model;

import java.util.Objects;

/**
 * One timed step of the flow's looping sequence.
 */
public final class FlowSequenceStep {
  private String name = "";
  // seconds
  private double duration;
  private String onStart = "";
  private String onUpdate = "";
  private String onEnd = "";
  private float x;
  private float y;

  public FlowSequenceStep() {}

  public FlowSequenceStep(final String name, final double duration, final String onStart,
      final String onUpdate, final String onEnd) {
    setName(name);
    this.duration = duration;
    setOnStart(onStart);
    setOnUpdate(onUpdate);
    setOnEnd(onEnd);
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name == null ? "" : name;
  }

  public double getDuration() {
    return duration;
  }

  public void setDuration(final double duration) {
    this.duration = duration;
  }

  public String getOnStart() {
    return onStart;
  }

  public void setOnStart(final String onStart) {
    this.onStart = onStart == null ? "" : onStart;
  }

  public String getOnUpdate() {
    return onUpdate;
  }

  public void setOnUpdate(final String onUpdate) {
    this.onUpdate = onUpdate == null ? "" : onUpdate;
  }

  public String getOnEnd() {
    return onEnd;
  }

  public void setOnEnd(final String onEnd) {
    this.onEnd = onEnd == null ? "" : onEnd;
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
    if (!(o instanceof FlowSequenceStep)) {
      return false;
    }
    FlowSequenceStep other = (FlowSequenceStep) o;
    return Double.compare(duration, other.duration) == 0 && Float.compare(x, other.x) == 0
        && Float.compare(y, other.y) == 0 && name.equals(other.name)
        && onStart.equals(other.onStart) && onUpdate.equals(other.onUpdate)
        && onEnd.equals(other.onEnd);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, duration, onStart, onUpdate, onEnd, x, y);
  }

  @Override
  public String toString() {
    return "FlowSequenceStep [name=" + name + ", duration=" + duration + ", onStart=" + onStart
        + ", onUpdate=" + onUpdate + ", onEnd=" + onEnd + ", x=" + x + ", y=" + y + "]";
  }
}
