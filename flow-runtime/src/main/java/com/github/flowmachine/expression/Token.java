package com.github.flowmachine.expression;

public final class Token {
  private final TokenType type;
  private final String text;
  private final int position;

  public Token(final TokenType type, final String text, final int position) {
    this.type = type;
    this.text = text;
    this.position = position;
  }

  public TokenType getType() {
    return type;
  }

  public String getText() {
    return text;
  }

  public int getPosition() {
    return position;
  }

  @Override
  public String toString() {
    return type + "[" + text + "]@" + position;
  }
}
