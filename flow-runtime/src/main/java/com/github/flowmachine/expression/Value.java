package com.github.flowmachine.expression;

import java.util.Objects;

/**
 * Immutable tagged union of the three value kinds guards operate on. Conversions between kinds
 * are dynamic and never fail.
 */
public final class Value {
  public static enum Type {
    NUMBER, STRING, BOOL;
  }

  public static final Value TRUE = new Value(Type.BOOL, 0.0, null, true);
  public static final Value FALSE = new Value(Type.BOOL, 0.0, null, false);
  public static final Value ZERO = new Value(Type.NUMBER, 0.0, null, false);

  private final Type type;
  private final double number;
  private final String string;
  private final boolean bool;

  private Value(final Type type, final double number, final String string, final boolean bool) {
    this.type = type;
    this.number = number;
    this.string = string;
    this.bool = bool;
  }

  public static Value of(final double number) {
    return new Value(Type.NUMBER, number, null, false);
  }

  public static Value of(final boolean bool) {
    return bool ? TRUE : FALSE;
  }

  public static Value of(final String string) {
    return new Value(Type.STRING, 0.0, string == null ? "" : string, false);
  }

  public Type getType() {
    return type;
  }

  public boolean isString() {
    return type == Type.STRING;
  }

  public boolean isTruthy() {
    switch (type) {
      case BOOL:
        return bool;
      case STRING:
        return !string.isEmpty();
      default:
        return number != 0.0;
    }
  }

  /**
   * Bools count as 1 or 0, strings as 0.
   */
  public double asNumber() {
    switch (type) {
      case BOOL:
        return bool ? 1.0 : 0.0;
      case STRING:
        return 0.0;
      default:
        return number;
    }
  }

  public String asString() {
    switch (type) {
      case BOOL:
        return bool ? "true" : "false";
      case STRING:
        return string;
      default:
        return formatNumber(number);
    }
  }

  /**
   * Whole numbers print without a fractional part so that {@code 5 == "5"} holds.
   */
  static String formatNumber(final double number) {
    if (!Double.isInfinite(number) && number == Math.rint(number)
        && Math.abs(number) < 1.0e15) {
      return Long.toString((long) number);
    }
    return Double.toString(number);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Value)) {
      return false;
    }
    Value other = (Value) o;
    return type == other.type && Double.compare(number, other.number) == 0
        && bool == other.bool && Objects.equals(string, other.string);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, number, string, bool);
  }

  @Override
  public String toString() {
    return type + "(" + asString() + ")";
  }
}
