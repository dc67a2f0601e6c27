package com.github.flowmachine.runtime;

import java.util.HashMap;
import java.util.Map;

import com.github.flowmachine.expression.Value;
import com.github.flowmachine.expression.VariableLookup;

/**
 * Runtime variables of one flow. All three value kinds share a single namespace: setting a name
 * with a different kind replaces the previous binding. Typed getters return the supplied default
 * when the name is unbound or bound to another kind.
 */
public final class VariableStore implements VariableLookup {
  private final Map<String, Value> values = new HashMap<>();

  public void setNumber(final String name, final double value) {
    values.put(name, Value.of(value));
  }

  public void setBool(final String name, final boolean value) {
    values.put(name, Value.of(value));
  }

  public void setString(final String name, final String value) {
    values.put(name, Value.of(value));
  }

  public double getNumber(final String name, final double defaultValue) {
    final Value value = values.get(name);
    return value != null && value.getType() == Value.Type.NUMBER ? value.asNumber() : defaultValue;
  }

  public boolean getBool(final String name, final boolean defaultValue) {
    final Value value = values.get(name);
    return value != null && value.getType() == Value.Type.BOOL ? value.isTruthy() : defaultValue;
  }

  public String getString(final String name, final String defaultValue) {
    final Value value = values.get(name);
    return value != null && value.isString() ? value.asString() : defaultValue;
  }

  public boolean contains(final String name) {
    return values.containsKey(name);
  }

  public void remove(final String name) {
    values.remove(name);
  }

  public void clear() {
    values.clear();
  }

  public int size() {
    return values.size();
  }

  @Override
  public Value resolve(final String name) {
    return values.get(name);
  }

  @Override
  public String toString() {
    return "VariableStore " + values;
  }
}
