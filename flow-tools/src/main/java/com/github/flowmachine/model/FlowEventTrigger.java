package com.github.flowmachine.model;

import java.util.Objects;

/**
 * Binds a physical input key to the emission of a named flow event.
 */
public final class FlowEventTrigger {
  private String eventName = "";
  private String key = "";

  public FlowEventTrigger() {}

  public FlowEventTrigger(final String eventName, final String key) {
    setEventName(eventName);
    setKey(key);
  }

  public String getEventName() {
    return eventName;
  }

  public void setEventName(final String eventName) {
    this.eventName = eventName == null ? "" : eventName;
  }

  public String getKey() {
    return key;
  }

  public void setKey(final String key) {
    this.key = key == null ? "" : key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowEventTrigger)) {
      return false;
    }
    FlowEventTrigger other = (FlowEventTrigger) o;
    return eventName.equals(other.eventName) && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(eventName, key);
  }

  @Override
  public String toString() {
    return "FlowEventTrigger [eventName=" + eventName + ", key=" + key + "]";
  }
}
