package com.github.flowmachine.model;

import java.util.Objects;

/**
 * A named, typed variable with its initial value. Only the slot matching {@link #getType()} is
 * meaningful; setting a typed value switches the type.
 */
public final class FlowVariable {
  private String name = "";
  private VariableType type = VariableType.NUMBER;
  private double numberValue;
  private boolean boolValue;
  private String stringValue = "";

  public FlowVariable() {}

  public static FlowVariable number(final String name, final double value) {
    final FlowVariable variable = new FlowVariable();
    variable.setName(name);
    variable.setNumberValue(value);
    return variable;
  }

  public static FlowVariable bool(final String name, final boolean value) {
    final FlowVariable variable = new FlowVariable();
    variable.setName(name);
    variable.setBoolValue(value);
    return variable;
  }

  public static FlowVariable string(final String name, final String value) {
    final FlowVariable variable = new FlowVariable();
    variable.setName(name);
    variable.setStringValue(value);
    return variable;
  }

  public String getName() {
    return name;
  }

  public void setName(final String name) {
    this.name = name == null ? "" : name;
  }

  public VariableType getType() {
    return type;
  }

  public double getNumberValue() {
    return numberValue;
  }

  public void setNumberValue(final double numberValue) {
    this.type = VariableType.NUMBER;
    this.numberValue = numberValue;
  }

  public boolean getBoolValue() {
    return boolValue;
  }

  public void setBoolValue(final boolean boolValue) {
    this.type = VariableType.BOOL;
    this.boolValue = boolValue;
  }

  public String getStringValue() {
    return stringValue;
  }

  public void setStringValue(final String stringValue) {
    this.type = VariableType.STRING;
    this.stringValue = stringValue == null ? "" : stringValue;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FlowVariable)) {
      return false;
    }
    FlowVariable other = (FlowVariable) o;
    if (!name.equals(other.name) || type != other.type) {
      return false;
    }
    switch (type) {
      case BOOL:
        return boolValue == other.boolValue;
      case STRING:
        return stringValue.equals(other.stringValue);
      default:
        return Double.compare(numberValue, other.numberValue) == 0;
    }
  }

  @Override
  public int hashCode() {
    switch (type) {
      case BOOL:
        return Objects.hash(name, type, boolValue);
      case STRING:
        return Objects.hash(name, type, stringValue);
      default:
        return Objects.hash(name, type, numberValue);
    }
  }

  @Override
  public String toString() {
    final Object value;
    switch (type) {
      case BOOL:
        value = boolValue;
        break;
      case STRING:
        value = stringValue;
        break;
      default:
        value = numberValue;
    }
    return "FlowVariable [name=" + name + ", type=" + type + ", value=" + value + "]";
  }
}
