package com.github.flowmachine.model;

/**
 * The value slot a {@link FlowVariable} carries. The label is the persisted spelling.
 */
public enum VariableType {
  NUMBER("Number"),
  BOOL("Bool"),
  STRING("String");

  private final String label;

  private VariableType(final String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Unknown labels fall back to NUMBER.
   */
  public static VariableType fromLabel(final String label) {
    for (final VariableType type : values()) {
      if (type.label.equalsIgnoreCase(label)) {
        return type;
      }
    }
    return NUMBER;
  }
}
